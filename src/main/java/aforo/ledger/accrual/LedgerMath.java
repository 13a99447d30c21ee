package aforo.ledger.accrual;

import aforo.ledger.exception.ValidationException;

/**
 * Exact long arithmetic for currency units. Overflow aborts the operation instead of wrapping.
 */
public final class LedgerMath {

    private LedgerMath() {}

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount overflow adding " + a + " and " + b, e);
        }
    }

    public static long subtract(long a, long b) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount overflow subtracting " + b + " from " + a, e);
        }
    }

    public static long multiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount overflow multiplying " + a + " by " + b, e);
        }
    }
}
