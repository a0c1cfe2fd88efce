package calculadora;

import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Calculadora com as quatro operações, um registrador de memória e o último resultado.
 * <p>
 * Só uma operação aritmética bem-sucedida altera o último resultado; em caso de
 * falha nenhum registrador muda. A memória e o último resultado são independentes.
 * Instâncias não são thread-safe.
 */
public class BasicCalculator {

    private static final Logger logger = LogManager.getLogger(BasicCalculator.class);

    private final CalculatorSettings settings;

    private double memory = 0.0;
    private double lastResult = 0.0;

    public BasicCalculator() {
        this(CalculatorSettings.defaults());
    }

    public BasicCalculator(CalculatorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CalculationResult add(double a, double b) {
        return checkOverflow("add", a, b, a + b, "Addition Overflow");
    }

    public CalculationResult subtract(double a, double b) {
        return checkOverflow("subtract", a, b, a - b, "Subtraction Overflow");
    }

    /**
     * Multiplica {@code a} por {@code b}. Apenas resultado infinito é falha;
     * NaN (como em {@code 0 * Infinity}) é devolvido e gravado normalmente.
     */
    public CalculationResult multiply(double a, double b) {
        return checkOverflow("multiply", a, b, a * b, "Multiplication Overflow");
    }

    /**
     * Divide {@code a} por {@code b}. Falha se {@code b} for zero dentro do epsilon
     * configurado; o resultado não passa por verificação de overflow.
     */
    public CalculationResult divide(double a, double b) {
        if (MathUtils.isZero(b, settings.getEpsilon())) {
            return fail("divide", a, b, ErrorKind.DIVISION_BY_ZERO, "Division by zero");
        }
        return succeed("divide", a, b, a / b);
    }

    private CalculationResult checkOverflow(String operation, double a, double b, double result, String message) {
        if (Double.isInfinite(result)) {
            return fail(operation, a, b, ErrorKind.OVERFLOW, message);
        }
        return succeed(operation, a, b, result);
    }

    private CalculationResult succeed(String operation, double a, double b, double result) {
        lastResult = result;
        logger.debug("{}({}, {}) = {}", operation, a, b, result);
        return CalculationResult.success(result);
    }

    private CalculationResult fail(String operation, double a, double b, ErrorKind kind, String message) {
        logger.warn("{}({}, {}) falhou [{}]: {}", operation, a, b, kind, message);
        return CalculationResult.failure(kind, message);
    }

    public void memoryStore(double value) {
        memory = value;
    }

    public double memoryRecall() {
        return memory;
    }

    public void memoryClear() {
        memory = 0.0;
    }

    /** Zera o último resultado. A memória não é alterada. */
    public void clear() {
        lastResult = 0.0;
    }

    public double getLastResult() {
        return lastResult;
    }

    public CalculatorSettings getSettings() {
        return settings;
    }
}
