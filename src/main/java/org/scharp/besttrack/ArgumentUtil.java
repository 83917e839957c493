///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.nio.charset.StandardCharsets;

/**
 * Argument checks shared by the public builders and the dataset exporter.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is longer than a given number of bytes when encoded in UTF-8, which is
     * the only encoding a track dataset file uses.
     *
     * @param argument
     *     The string to check
     * @param maximumLengthInBytes
     *     The maximum length that {@code argument} may be when encoded.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is longer than {@code maximumLengthInBytes}.
     */
    static void checkMaximumUtf8Length(String argument, int maximumLengthInBytes, String argumentName) {
        assert 0 <= maximumLengthInBytes : "maximumLengthInBytes must not be negative";
        assert argumentName != null : "argumentName must not be null";

        if (maximumLengthInBytes < argument.getBytes(StandardCharsets.UTF_8).length) {
            String unit = maximumLengthInBytes == 1 ? " byte" : " bytes";
            throw new IllegalArgumentException(
                argumentName + " must not be longer than " + maximumLengthInBytes + unit + " when encoded with UTF-8");
        }
    }

    /**
     * Throws an exception if {@code argument} contains a NUL character.  NUL is the padding byte of character values,
     * so a value containing one could not be read back unchanged.
     *
     * @param argument
     *     The string to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} contains {@code '\0'}.
     */
    static void checkNoNulCharacter(String argument, String argumentName) {
        if (argument.indexOf('\0') != -1) {
            throw new IllegalArgumentException(argumentName + " must not contain a NUL character");
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }
}
