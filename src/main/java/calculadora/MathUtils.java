package calculadora;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Funções numéricas sem estado usadas pela calculadora e por quem mais precisar.
 */
public final class MathUtils {

    private static final Logger logger = LogManager.getLogger(MathUtils.class);

    /** Tolerância padrão das comparações com zero. */
    public static final double DEFAULT_EPSILON = 1e-9;

    /** Maior n cujo fatorial cabe num double (170! ~ 7.26e306). */
    public static final int MAX_FACTORIAL_ARGUMENT = 170;

    private MathUtils() {
    }

    public static boolean isZero(double value) {
        return isZero(value, DEFAULT_EPSILON);
    }

    public static boolean isZero(double value, double epsilon) {
        return Math.abs(value) < epsilon;
    }

    public static boolean areEqual(double a, double b) {
        return areEqual(a, b, DEFAULT_EPSILON);
    }

    public static boolean areEqual(double a, double b, double epsilon) {
        return Math.abs(a - b) < epsilon;
    }

    /**
     * Calcula n! por produto iterativo.
     *
     * @param n argumento, entre 0 e {@value #MAX_FACTORIAL_ARGUMENT}
     * @return o fatorial, ou falha {@link ErrorKind#DOMAIN} para n negativo
     *         e {@link ErrorKind#OVERFLOW} para n acima de 170
     */
    public static CalculationResult factorial(int n) {
        if (n < 0) {
            logger.debug("factorial({}) rejeitado: argumento negativo", n);
            return CalculationResult.failure(ErrorKind.DOMAIN, "Factorial undefined for negative numbers");
        }
        if (n > MAX_FACTORIAL_ARGUMENT) {
            logger.debug("factorial({}) rejeitado: excede a precisao de double", n);
            return CalculationResult.failure(ErrorKind.OVERFLOW, "Factorial too large for double precision");
        }
        if (n <= 1) {
            return CalculationResult.success(1.0);
        }

        double result = 1.0;
        for (int i = 2; i <= n; i++) {
            result *= i;
        }
        return CalculationResult.success(result);
    }

    /**
     * Potência com expoente inteiro por exponenciação binária.
     * Expoente negativo com base zero é {@link ErrorKind#DOMAIN}.
     */
    public static CalculationResult power(double base, int exponent) {
        if (exponent == 0) {
            return CalculationResult.success(1.0);
        }
        if (exponent < 0) {
            if (isZero(base)) {
                logger.debug("power({}, {}) rejeitado: base zero com expoente negativo", base, exponent);
                return CalculationResult.failure(ErrorKind.DOMAIN, "Cannot raise zero to negative power");
            }
            // long: -Integer.MIN_VALUE não cabe em int
            return CalculationResult.success(1.0 / positivePower(base, -(long) exponent));
        }
        return CalculationResult.success(positivePower(base, exponent));
    }

    private static double positivePower(double base, long exponent) {
        double result = 1.0;
        double currentPower = base;
        while (exponent > 0) {
            if ((exponent & 1) == 1) {
                result *= currentPower;
            }
            currentPower *= currentPower;
            exponent >>= 1;
        }
        return result;
    }

    public static double degreeToRadian(double degrees) {
        return degrees * Math.PI / 180.0;
    }

    public static double radianToDegree(double radians) {
        return radians * 180.0 / Math.PI;
    }

    public static boolean isFinite(double value) {
        return Double.isFinite(value);
    }

    public static boolean isValidForLog(double value) {
        return value > 0.0 && Double.isFinite(value);
    }

    public static boolean isValidForSqrt(double value) {
        return value >= 0.0 && Double.isFinite(value);
    }
}
