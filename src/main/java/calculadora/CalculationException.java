package calculadora;

import java.util.Objects;

/**
 * Lançada quando se lê o valor de um {@link CalculationResult} que falhou.
 */
public class CalculationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public CalculationException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
