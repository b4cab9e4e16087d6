package work.marlowe.kernel.shared;

import java.math.BigInteger;

/**
 * Integer helpers shared by the evaluator and the reduction engine.
 */
public final class Arithmetic {
    private Arithmetic() {}

    /**
     * Divides rounding to the nearest integer, ties away from zero. A zero divisor yields zero.
     */
    public static BigInteger divide(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        BigInteger quotient = qr[0];
        BigInteger remainder = qr[1];
        if (remainder.signum() == 0) {
            return quotient;
        }
        if (remainder.abs().shiftLeft(1).compareTo(denominator.abs()) < 0) {
            return quotient;
        }
        return numerator.signum() == denominator.signum()
            ? quotient.add(BigInteger.ONE)
            : quotient.subtract(BigInteger.ONE);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigInteger max(BigInteger a, BigInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static boolean between(BigInteger value, BigInteger low, BigInteger high) {
        return value.compareTo(low) >= 0 && value.compareTo(high) <= 0;
    }
}
