///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.time.LocalDateTime;

/**
 * The type of column in a track dataset.
 */
public enum ColumnType {
    /** A 32-bit integer column whose values are {@link Integer}. */
    INTEGER(1, 4, Integer.class),

    /** A double-precision floating point column whose values are {@link Double}. */
    DOUBLE(2, 8, Double.class),

    /** A date and time with whole-second precision whose values are {@link LocalDateTime} (in UTC). */
    TIMESTAMP(3, 8, LocalDateTime.class),

    /** A fixed-width UTF-8 text column whose values are {@link String}. */
    CHARACTER(4, 0, String.class);

    private final byte code;
    private final int fixedLength;
    private final Class<?> valueClass;

    ColumnType(int code, int fixedLength, Class<?> valueClass) {
        this.code = (byte) code;
        this.fixedLength = fixedLength;
        this.valueClass = valueClass;
    }

    /** The byte that identifies this type in a file's column descriptor. */
    byte code() {
        return code;
    }

    /**
     * The number of bytes a value of this type occupies, or 0 if the length is chosen per column.
     */
    int fixedLength() {
        return fixedLength;
    }

    /**
     * Gets the Java class of the values in a column of this type.
     *
     * @return The value class.  This is never {@code null}.
     */
    public Class<?> valueClass() {
        return valueClass;
    }

    static ColumnType fromCode(byte code) {
        for (ColumnType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown column type code " + code);
    }
}
