package calculadora;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MathUtilsTest {

    @Test
    void isZero_usaEpsilonPadrao() {
        assertTrue(MathUtils.isZero(1e-10));
        assertTrue(MathUtils.isZero(0.0));
        assertTrue(MathUtils.isZero(-1e-10));
        assertFalse(MathUtils.isZero(1e-8));
        assertFalse(MathUtils.isZero(1e-9));
    }

    @Test
    void isZero_comEpsilonInformado() {
        assertTrue(MathUtils.isZero(0.05, 0.1));
        assertFalse(MathUtils.isZero(0.1, 0.1));
    }

    @Test
    void areEqual_comparaDentroDoEpsilon() {
        assertTrue(MathUtils.areEqual(0.1 + 0.2, 0.3));
        assertFalse(MathUtils.areEqual(1.0, 1.0 + 1e-6));
        assertTrue(MathUtils.areEqual(1.0, 1.05, 0.1));
    }

    @Test
    void factorial_casosBase() {
        assertEquals(1, MathUtils.factorial(0).getValue());
        assertEquals(1, MathUtils.factorial(1).getValue());
        assertEquals(120, MathUtils.factorial(5).getValue());
        assertEquals(3628800, MathUtils.factorial(10).getValue());
    }

    @Test
    void factorial_170EhFinito() {
        assertTrue(Double.isFinite(MathUtils.factorial(170).getValue()));
    }

    @Test
    void factorial_171EhOverflow() {
        CalculationResult r = MathUtils.factorial(171);
        assertEquals(ErrorKind.OVERFLOW, r.getErrorKind());
        assertEquals("Factorial too large for double precision", r.getMessage());
    }

    @Test
    void factorial_negativoEhErroDeDominio() {
        CalculationResult r = MathUtils.factorial(-1);
        assertEquals(ErrorKind.DOMAIN, r.getErrorKind());
        assertEquals("Factorial undefined for negative numbers", r.getMessage());
    }

    @Test
    void power_expoentePositivo() {
        assertEquals(1024, MathUtils.power(2, 10).getValue());
        assertEquals(-27, MathUtils.power(-3, 3).getValue());
        assertEquals(2.25, MathUtils.power(1.5, 2).getValue(), 1e-12);
    }

    @Test
    void power_expoenteNegativo() {
        assertEquals(0.25, MathUtils.power(2, -2).getValue());
        assertEquals(0.001, MathUtils.power(10, -3).getValue(), 1e-15);
    }

    @Test
    void power_expoenteZeroSempreUm() {
        double[] bases = {0.0, 1.0, -1.0, 2.5, -7.0, 1e300, Double.MIN_VALUE};
        for (double base : bases) {
            assertEquals(1, MathUtils.power(base, 0).getValue(), "base " + base);
        }
    }

    @Test
    void power_zeroComExpoenteNegativoEhErroDeDominio() {
        CalculationResult r = MathUtils.power(0, -1);
        assertEquals(ErrorKind.DOMAIN, r.getErrorKind());
        assertEquals("Cannot raise zero to negative power", r.getMessage());
        assertEquals(ErrorKind.DOMAIN, MathUtils.power(1e-12, -2).getErrorKind());
    }

    @Test
    void power_expoenteMinimoInteiro() {
        assertEquals(1, MathUtils.power(1, Integer.MIN_VALUE).getValue());
        assertEquals(1, MathUtils.power(-1, Integer.MIN_VALUE).getValue());
        assertEquals(0, MathUtils.power(2, Integer.MIN_VALUE).getValue());
    }

    @Test
    void power_resultadoGrandeViraInfinito() {
        assertEquals(Double.POSITIVE_INFINITY, MathUtils.power(10, 400).getValue());
    }

    @Test
    void conversaoDeAngulos() {
        assertEquals(Math.PI, MathUtils.degreeToRadian(180), 1e-12);
        assertEquals(90, MathUtils.radianToDegree(Math.PI / 2), 1e-12);
        assertEquals(-45, MathUtils.radianToDegree(MathUtils.degreeToRadian(-45)), 1e-12);
    }

    @Test
    void conversaoDeAngulos_idaEVolta() {
        double[] valores = {0.0, 1.0, -2.5, Math.PI, 10.0, 123.456};
        for (double x : valores) {
            assertTrue(MathUtils.areEqual(x, MathUtils.degreeToRadian(MathUtils.radianToDegree(x))), "x = " + x);
        }
    }

    @Test
    void isFinite_rejeitaInfinitoENan() {
        assertTrue(MathUtils.isFinite(1.0));
        assertTrue(MathUtils.isFinite(-Double.MAX_VALUE));
        assertFalse(MathUtils.isFinite(Double.POSITIVE_INFINITY));
        assertFalse(MathUtils.isFinite(Double.NEGATIVE_INFINITY));
        assertFalse(MathUtils.isFinite(Double.NaN));
    }

    @Test
    void isValidForLog_exigePositivoFinito() {
        assertTrue(MathUtils.isValidForLog(1e-300));
        assertFalse(MathUtils.isValidForLog(0.0));
        assertFalse(MathUtils.isValidForLog(-1.0));
        assertFalse(MathUtils.isValidForLog(Double.POSITIVE_INFINITY));
        assertFalse(MathUtils.isValidForLog(Double.NaN));
    }

    @Test
    void isValidForSqrt_aceitaZero() {
        assertTrue(MathUtils.isValidForSqrt(0.0));
        assertTrue(MathUtils.isValidForSqrt(4.0));
        assertFalse(MathUtils.isValidForSqrt(-0.1));
        assertFalse(MathUtils.isValidForSqrt(Double.POSITIVE_INFINITY));
        assertFalse(MathUtils.isValidForSqrt(Double.NaN));
    }
}
