///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The choices that control how a best-track file is read.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link BestTrackOptions.Builder}:
 * </p>
 * <pre>
 * BestTrackOptions options = BestTrackOptions.builder().
 *     errorPolicy(ErrorPolicy.WARN_AND_MARK_MISSING).
 *     acceptLegacyLines(true).
 *     build();
 * </pre>
 */
public final class BestTrackOptions {

    /** The values that mean "missing" in the numeric fields unless other sentinels are configured. */
    public static final Set<Integer> DEFAULT_SENTINEL_VALUES = Collections.unmodifiableSet(
        new LinkedHashSet<>(List.of(-999, -99)));

    private final ErrorPolicy errorPolicy;
    private final Set<Integer> sentinelValues;
    private final Charset charset;
    private final boolean acceptLegacyLines;
    private final boolean failOnUnexpectedMismatch;
    private final boolean failOnDamagedHeader;

    /**
     * A builder class for {@link BestTrackOptions}.
     */
    public final static class Builder {
        private ErrorPolicy errorPolicy;
        private Set<Integer> sentinelValues;
        private Charset charset;
        private boolean acceptLegacyLines;
        private boolean failOnUnexpectedMismatch;
        private boolean failOnDamagedHeader;

        private Builder() {
            errorPolicy = ErrorPolicy.FAIL;
            sentinelValues = DEFAULT_SENTINEL_VALUES;
            charset = StandardCharsets.UTF_8;
            acceptLegacyLines = false;
            failOnUnexpectedMismatch = false;
            failOnDamagedHeader = false;
        }

        /**
         * Sets what happens to track points with an unknown status or an impossible date.
         *
         * @param errorPolicy
         *     The policy.
         *
         * @return this builder
         *
         * @throws NullPointerException
         *     if {@code errorPolicy} is {@code null}.
         */
        public Builder errorPolicy(ErrorPolicy errorPolicy) {
            ArgumentUtil.checkNotNull(errorPolicy, "errorPolicy");
            this.errorPolicy = errorPolicy;
            return this;
        }

        /**
         * Sets the numbers that mean a numeric field is missing.  Blank and non-numeric fields are always missing.
         *
         * @param sentinelValues
         *     The sentinel values.  This may be empty, in which case every number is kept.
         *
         * @return this builder
         *
         * @throws NullPointerException
         *     if {@code sentinelValues} is {@code null} or contains {@code null}.
         */
        public Builder sentinelValues(Set<Integer> sentinelValues) {
            ArgumentUtil.checkNotNull(sentinelValues, "sentinelValues");
            for (Integer sentinelValue : sentinelValues) {
                if (sentinelValue == null) {
                    throw new NullPointerException("sentinelValues must not contain null");
                }
            }
            this.sentinelValues = Collections.unmodifiableSet(new LinkedHashSet<>(sentinelValues));
            return this;
        }

        /**
         * Sets the character set in which files are read.
         *
         * @param charset
         *     The character set.
         *
         * @return this builder
         *
         * @throws NullPointerException
         *     if {@code charset} is {@code null}.
         */
        public Builder charset(Charset charset) {
            ArgumentUtil.checkNotNull(charset, "charset");
            this.charset = charset;
            return this;
        }

        /**
         * Sets whether track point lines that end after the wind radii, as written before the radius of maximum wind
         * was added to the format, are accepted.
         *
         * @param acceptLegacyLines
         *     {@code true} to accept the shorter lines.  Their radius of maximum wind is missing.
         *
         * @return this builder
         */
        public Builder acceptLegacyLines(boolean acceptLegacyLines) {
            this.acceptLegacyLines = acceptLegacyLines;
            return this;
        }

        /**
         * Sets whether a track point count that differs from the storm's declared count for a reason other than the
         * storm crossing into a new year stops the parse.
         *
         * @param failOnUnexpectedMismatch
         *     {@code true} to throw an {@link EntryCountMismatchException}; {@code false} to log a warning.
         *
         * @return this builder
         */
        public Builder failOnUnexpectedMismatch(boolean failOnUnexpectedMismatch) {
            this.failOnUnexpectedMismatch = failOnUnexpectedMismatch;
            return this;
        }

        /**
         * Sets whether a line that begins like a storm header but can't be parsed as one stops the parse.  Such a line
         * is otherwise skipped with a warning, along with any track point lines that follow it.
         *
         * @param failOnDamagedHeader
         *     {@code true} to throw a {@link MalformedHeaderException}; {@code false} to skip the line.
         *
         * @return this builder
         */
        public Builder failOnDamagedHeader(boolean failOnDamagedHeader) {
            this.failOnDamagedHeader = failOnDamagedHeader;
            return this;
        }

        /**
         * Builds an immutable {@code BestTrackOptions}.
         *
         * @return the options
         */
        public BestTrackOptions build() {
            return new BestTrackOptions(this);
        }
    }

    private BestTrackOptions(Builder builder) {
        this.errorPolicy = builder.errorPolicy;
        this.sentinelValues = builder.sentinelValues;
        this.charset = builder.charset;
        this.acceptLegacyLines = builder.acceptLegacyLines;
        this.failOnUnexpectedMismatch = builder.failOnUnexpectedMismatch;
        this.failOnDamagedHeader = builder.failOnDamagedHeader;
    }

    /**
     * Creates a builder that is initialized with the default options: {@link ErrorPolicy#FAIL}, the
     * {@linkplain #DEFAULT_SENTINEL_VALUES default sentinels}, UTF-8, no legacy lines, and warnings for entry count
     * mismatches and damaged headers.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the default options.
     */
    public static BestTrackOptions defaults() {
        return builder().build();
    }

    public ErrorPolicy errorPolicy() {
        return errorPolicy;
    }

    /**
     * @return an unmodifiable set of the numbers that mean a numeric field is missing.
     */
    public Set<Integer> sentinelValues() {
        return sentinelValues;
    }

    public Charset charset() {
        return charset;
    }

    public boolean acceptLegacyLines() {
        return acceptLegacyLines;
    }

    public boolean failOnUnexpectedMismatch() {
        return failOnUnexpectedMismatch;
    }

    public boolean failOnDamagedHeader() {
        return failOnDamagedHeader;
    }
}
