package calculadora;

import java.util.Objects;

/**
 * Resultado de uma operação: um valor numérico ou um {@link ErrorKind} com mensagem.
 * Quem chama decide o que fazer consultando {@link #isSuccess()}.
 */
public final class CalculationResult {

    private final double value;
    private final ErrorKind errorKind;
    private final String message;

    private CalculationResult(double value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static CalculationResult success(double value) {
        return new CalculationResult(value, null, null);
    }

    public static CalculationResult failure(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        return new CalculationResult(Double.NaN, kind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    /**
     * @return o valor calculado
     * @throws CalculationException se a operação falhou
     */
    public double getValue() {
        if (errorKind != null) {
            throw new CalculationException(errorKind, message);
        }
        return value;
    }

    /**
     * Retorna o valor calculado, ou {@code fallback} se a operação falhou.
     */
    public double orElse(double fallback) {
        return errorKind == null ? value : fallback;
    }

    /** Tipo da falha, ou {@code null} em caso de sucesso. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /** Mensagem da falha, ou {@code null} em caso de sucesso. */
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CalculationResult)) {
            return false;
        }
        CalculationResult other = (CalculationResult) o;
        return Double.compare(value, other.value) == 0
                && errorKind == other.errorKind
                && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, errorKind, message);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "CalculationResult[value=" + value + "]"
                : "CalculationResult[" + errorKind + ": " + message + "]";
    }
}
