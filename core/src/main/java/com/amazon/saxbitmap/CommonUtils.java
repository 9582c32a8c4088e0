/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.saxbitmap;

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {}

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the specified input
     * is false.
     *
     * @param condition A condition to test.
     * @param message The error message to include in the {@code IllegalArgumentException} if {@code
     *     condition} is false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the specified input is
     * false.
     *
     * @param condition A condition to test.
     * @param message The error message to include in the {@code IllegalStateException} if {@code
     *     condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the specified input is
     * null.
     *
     * @param <T> An arbitrary type.
     * @param object An object reference to test for nullity.
     * @param message The error message to include in the {@code NullPointerException} if {@code
     *     object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Computes {@code base^exponent} for non-negative arguments.
     *
     * @param base the base
     * @param exponent the exponent
     * @return the exact power
     * @throws IllegalArgumentException if the result does not fit in an int
     */
    public static int checkedPow(int base, int exponent) {
        checkArgument(base >= 0 && exponent >= 0, "base and exponent must be non-negative");
        long result = 1;
        for (int i = 0; i < exponent; i++) {
            result *= base;
            checkArgument(result <= Integer.MAX_VALUE, base + "^" + exponent + " is too large");
        }
        return (int) result;
    }

    /**
     * Multiplies two positive values and fails when the product does not fit in an
     * int.
     *
     * @param first a factor
     * @param second a factor
     * @param name what the product describes, used in the error message
     * @return the product
     */
    public static int checkedProduct(int first, int second, String name) {
        long result = (long) first * second;
        checkArgument(result <= Integer.MAX_VALUE, name + " is too large");
        return (int) result;
    }

    /**
     * @param value a non-negative number
     * @return the integer square root of value if value is a perfect square, -1
     *         otherwise
     */
    public static int exactSquareRoot(int value) {
        if (value < 0) {
            return -1;
        }
        int root = (int) Math.round(Math.sqrt(value));
        return ((long) root * root == value) ? root : -1;
    }

    public static boolean isPerfectSquare(int value) {
        return exactSquareRoot(value) >= 0;
    }

    public static void checkFinite(double[] values, String message) {
        checkNotNull(values, message);
        for (double value : values) {
            checkArgument(Double.isFinite(value), message);
        }
    }
}
