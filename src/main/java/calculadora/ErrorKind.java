package calculadora;

/**
 * Tipos de falha que uma operação pode reportar.
 */
public enum ErrorKind {
    /** Entrada matematicamente indefinida para a operação. */
    DOMAIN,
    /** Resultado fora da faixa representável por um double. */
    OVERFLOW,
    /** Divisor igual a zero (dentro do epsilon). */
    DIVISION_BY_ZERO
}
