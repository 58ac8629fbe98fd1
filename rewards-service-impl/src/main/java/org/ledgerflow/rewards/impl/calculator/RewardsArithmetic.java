// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.calculator;

import static org.ledgerflow.app.spi.workflows.ResponseCode.AMOUNT_OVERFLOW;

import java.math.BigInteger;
import org.ledgerflow.app.spi.workflows.HandleException;

/**
 * Exact unsigned integer arithmetic over non-negative {@code long} values. Divisions truncate.
 */
public final class RewardsArithmetic {

    private RewardsArithmetic() {
        // Utility class
    }

    /**
     * Computes {@code floor(a * b / d)} without overflowing the intermediate product.
     *
     * @param a a non-negative factor
     * @param b a non-negative factor
     * @param d a positive divisor
     * @return the truncated quotient
     * @throws HandleException with {@code AMOUNT_OVERFLOW} if the quotient does not fit in a long
     */
    public static long mulDiv(final long a, final long b, final long d) {
        if (!productWouldOverflow(a, b)) {
            return a * b / d;
        }
        return toLongExact(BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).divide(BigInteger.valueOf(d)));
    }

    /**
     * Computes {@code floor(a * b * c / (d1 * d2))} without overflowing any intermediate product.
     *
     * @param a a non-negative factor
     * @param b a non-negative factor
     * @param c a non-negative factor
     * @param d1 a positive divisor
     * @param d2 a positive divisor
     * @return the truncated quotient
     * @throws HandleException with {@code AMOUNT_OVERFLOW} if the quotient does not fit in a long
     */
    public static long mulDiv(final long a, final long b, final long c, final long d1, final long d2) {
        final var numerator = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).multiply(BigInteger.valueOf(c));
        final var denominator = BigInteger.valueOf(d1).multiply(BigInteger.valueOf(d2));
        return toLongExact(numerator.divide(denominator));
    }

    /**
     * Adds two non-negative values.
     *
     * @param a a non-negative value
     * @param b a non-negative value
     * @return the sum
     * @throws HandleException with {@code AMOUNT_OVERFLOW} if the sum does not fit in a long
     */
    public static long addExact(final long a, final long b) {
        try {
            return Math.addExact(a, b);
        } catch (final ArithmeticException e) {
            throw new HandleException(AMOUNT_OVERFLOW, a + " + " + b);
        }
    }

    /**
     * Returns whether the product of two non-negative values overflows a long.
     *
     * @param a a non-negative value
     * @param b a non-negative value
     * @return true if {@code a * b} overflows
     */
    public static boolean productWouldOverflow(final long a, final long b) {
        return a != 0 && b > Long.MAX_VALUE / a;
    }

    private static long toLongExact(final BigInteger value) {
        if (value.bitLength() > 63) {
            throw new HandleException(AMOUNT_OVERFLOW, value.toString());
        }
        return value.longValue();
    }
}
