///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Arithmetic helpers for sizing the sections of a track dataset file.
 */
abstract class MathUtil {

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes dividend / divisor, but instead of truncating any remainder, it always rounds up.
     *
     * @param dividend
     *     the dividend
     * @param divisor
     *     the divisor
     *
     * @return The result of the calculation.
     */
    // This can be replaced by Math.ceilDiv() in Java 18
    static int divideAndRoundUp(int dividend, int divisor) {
        assert 0 < divisor : "divideAndRoundUp requires a positive divisor";
        assert 0 <= dividend : "divideAndRoundUp doesn't handle negative numbers";

        return (dividend + divisor - 1) / divisor;
    }

    /**
     * Multiplies two sizes, failing instead of silently overflowing.
     *
     * @param a
     *     the first factor
     * @param b
     *     the second factor
     * @param description
     *     what is being sized, for the exception message
     *
     * @return {@code a * b}
     *
     * @throws IllegalArgumentException
     *     if the product does not fit in an {@code int}.
     */
    static int multiplySize(int a, int b, String description) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(description + " is too large", e);
        }
    }
}
