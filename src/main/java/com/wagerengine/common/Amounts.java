package com.wagerengine.common;

import com.wagerengine.common.exception.ArithmeticDomainException;
import com.wagerengine.common.exception.InvalidAmountException;

/**
 * Unsigned integer arithmetic for ledger amounts.
 *
 * All amounts are non-negative {@code long} values in the smallest unit of their asset.
 * Overflow and underflow abort the request instead of wrapping or saturating.
 */
public final class Amounts {

    private Amounts() {
    }

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticDomainException("addition overflow: " + a + " + " + b, e);
        }
    }

    public static long subtract(long a, long b) {
        if (b > a) {
            throw new ArithmeticDomainException("subtraction underflow: " + a + " - " + b);
        }
        return a - b;
    }

    public static long multiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticDomainException("multiplication overflow: " + a + " * " + b, e);
        }
    }

    /**
     * Apply a basis-point rate, truncating toward zero.
     */
    public static long applyBasisPoints(long amount, long bps) {
        return multiply(amount, bps) / EngineConstants.BASIS_POINTS_DENOM;
    }

    public static long toPegged(long nativeAmount) {
        return multiply(nativeAmount, EngineConstants.RATIO);
    }

    public static long toNative(long peggedAmount) {
        return peggedAmount / EngineConstants.RATIO;
    }

    public static void requirePositive(long amount, String field) {
        if (amount <= 0) {
            throw new InvalidAmountException(field + " must be positive, got " + amount);
        }
    }

    public static void requireNonNegative(long amount, String field) {
        if (amount < 0) {
            throw new InvalidAmountException(field + " must not be negative, got " + amount);
        }
    }
}
