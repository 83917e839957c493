///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.HashMap;
import java.util.Objects;

/**
 * A column in a track dataset.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link Column.Builder}:
 * </p>
 *
 * <pre>
 * Column nameColumn = Column.builder().
 *     name("name").
 *     type(ColumnType.CHARACTER).
 *     length(10).
 *     label("Storm name").
 *     build();
 * </pre>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances can be used as keys in a
 * {@code HashMap}.
 * </p>
 */
public final class Column {

    /** The maximum number of bytes in a column name when encoded in UTF-8. */
    public static final int MAX_NAME_LENGTH = 64;

    /** The maximum number of bytes in a column label when encoded in UTF-8. */
    public static final int MAX_LABEL_LENGTH = 256;

    private final String name;
    private final ColumnType type;
    private final int length;
    private final String label;
    private final boolean nullable;

    /**
     * A builder class for {@link Column}.
     */
    public final static class Builder {
        private String name;
        private ColumnType type;
        private int length;
        private String label;
        private boolean nullable;

        private Builder() {
            this.name = null; // required parameter
            this.type = null; // required parameter
            this.length = 0; // required for CHARACTER, derived for the other types

            this.label = ""; // optional, so default to blank
            this.nullable = false;
        }

        /**
         * Sets the column's name.
         *
         * @param name
         *     The column's new name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code name} is empty or exceeds 64 bytes in UTF-8.
         */
        public Builder name(String name) {
            ArgumentUtil.checkNotNull(name, "name");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("column names cannot be blank");
            }
            ArgumentUtil.checkMaximumUtf8Length(name, MAX_NAME_LENGTH, "column names");

            this.name = name;
            return this;
        }

        /**
         * Sets the column's type.
         *
         * @param type
         *     The column's new type.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code type} is {@code null}.
         */
        public Builder type(ColumnType type) {
            ArgumentUtil.checkNotNull(type, "type");
            this.type = type;
            return this;
        }

        /**
         * Sets the number of bytes each value of a {@link ColumnType#CHARACTER} column occupies.
         * <p>
         * The other types have a fixed length and it is not necessary to set it.
         * </p>
         *
         * @param length
         *     The length of the new column.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code length} is less than 1 or greater than 32,767.
         */
        public Builder length(int length) {
            if (length <= 0) {
                throw new IllegalArgumentException("column length must be positive");
            }
            if (Short.MAX_VALUE < length) {
                throw new IllegalArgumentException("column length cannot be greater than " + Short.MAX_VALUE);
            }

            this.length = length;
            return this;
        }

        /**
         * Sets the column's label.
         *
         * @param label
         *     The column's new label.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code label} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code label} exceeds 256 bytes in UTF-8.
         */
        public Builder label(String label) {
            ArgumentUtil.checkNotNull(label, "label");
            ArgumentUtil.checkMaximumUtf8Length(label, MAX_LABEL_LENGTH, "column labels");

            this.label = label;
            return this;
        }

        /**
         * Sets whether the column accepts {@code null} (missing) values.
         *
         * @param nullable
         *     {@code true} if values may be missing.
         *
         * @return This builder
         */
        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        /**
         * Builds an immutable {@code Column} with the configured options.
         *
         * @return a {@code Column}
         *
         * @throws IllegalStateException
         *     if the name or type haven't been set, if a CHARACTER column has no length, or if the length of any
         *     other type was set to something other than its fixed length.
         */
        public Column build() {
            if (name == null) {
                throw new IllegalStateException("name must be set");
            }
            if (type == null) {
                throw new IllegalStateException("type must be set");
            }

            final int columnLength;
            if (type == ColumnType.CHARACTER) {
                if (length == 0) {
                    throw new IllegalStateException("length must be set for CHARACTER columns");
                }
                columnLength = length;
            } else {
                // The length can be set before the type, so it can only be checked here.
                if (length != 0 && length != type.fixedLength()) {
                    throw new IllegalStateException(
                        type + " columns must have a length of " + type.fixedLength());
                }
                columnLength = type.fixedLength();
            }

            return new Column(name, type, columnLength, label, nullable);
        }
    }

    /**
     * Creates a new Column builder with a blank label that does not accept {@code null} values.
     * <p>
     * You must set the name and type (and the length for CHARACTER columns) before invoking
     * {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private Column(String name, ColumnType type, int length, String label, boolean nullable) {
        this.name = name;
        this.type = type;
        this.length = length;
        this.label = label;
        this.nullable = nullable;
    }

    /**
     * Gets this column's name.
     *
     * @return This column's name. This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this column's type.
     *
     * @return This column's type. This is never {@code null}.
     */
    public ColumnType type() {
        return type;
    }

    /**
     * Gets the number of bytes that each of this column's values occupies.
     *
     * @return This column's length.
     */
    public int length() {
        return length;
    }

    /**
     * Gets this column's label.
     *
     * @return This column's label. This may be the empty string but never {@code null}.
     */
    public String label() {
        return label;
    }

    /**
     * Gets whether this column accepts missing values.
     *
     * @return {@code true}, if a value of this column may be {@code null}.
     */
    public boolean nullable() {
        return nullable;
    }

    /**
     * Gets a hash code for this column.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This column's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(name, type, length, label, nullable);
    }

    /**
     * Determines if this column is equal to another object.
     * <p>
     * Two columns are equal if and only if their name, type, length, label, and nullability are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this column.
     *
     * @return {@code true}, if this column is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Column otherColumn)) {
            return false;
        }

        return name.equals(otherColumn.name) &&
            type == otherColumn.type &&
            length == otherColumn.length &&
            label.equals(otherColumn.label) &&
            nullable == otherColumn.nullable;
    }

    @Override
    public String toString() {
        return name + " " + type + "(" + length + ")" + (nullable ? " NULL" : " NOT NULL");
    }
}
