///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link ArgumentUtil}. */
public class ArgumentUtilTest {

    @Test
    void checkNotNull() {
        ArgumentUtil.checkNotNull("", "argument");

        Exception exception = assertThrows(
            NullPointerException.class,
            () -> ArgumentUtil.checkNotNull(null, "myArgument"));
        assertEquals("myArgument must not be null", exception.getMessage());
    }

    @Test
    void checkMaximumUtf8Length() {
        ArgumentUtil.checkMaximumUtf8Length("", 0, "argument");
        ArgumentUtil.checkMaximumUtf8Length("ZETA", 4, "argument");
        ArgumentUtil.checkMaximumUtf8Length("ÉTÉ", 5, "argument");

        // Each é is two bytes in UTF-8.
        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkMaximumUtf8Length("ÉTÉ", 4, "name"));
        assertEquals("name must not be longer than 4 bytes when encoded with UTF-8", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkMaximumUtf8Length("É", 1, "identifier"));
        assertEquals("identifier must not be longer than 1 byte when encoded with UTF-8", exception.getMessage());
    }

    @Test
    void checkNoNulCharacter() {
        ArgumentUtil.checkNoNulCharacter("IDALIA", "argument");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNoNulCharacter("IDA\0LIA", "name"));
        assertEquals("name must not contain a NUL character", exception.getMessage());
    }

    @Test
    void checkNotNegative() {
        ArgumentUtil.checkNotNegative(0, "argument");
        ArgumentUtil.checkNotNegative(Integer.MAX_VALUE, "argument");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(-1, "count"));
        assertEquals("count must not be negative", exception.getMessage());
    }
}
