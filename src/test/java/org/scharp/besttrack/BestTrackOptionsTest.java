///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link BestTrackOptions}. */
public class BestTrackOptionsTest {

    @Test
    void defaults() {
        BestTrackOptions options = BestTrackOptions.defaults();
        assertEquals(ErrorPolicy.FAIL, options.errorPolicy());
        assertEquals(Set.of(-999, -99), options.sentinelValues());
        assertEquals(StandardCharsets.UTF_8, options.charset());
        assertFalse(options.acceptLegacyLines());
        assertFalse(options.failOnUnexpectedMismatch());
        assertFalse(options.failOnDamagedHeader());
    }

    @Test
    void buildWithAllOptions() {
        BestTrackOptions options = BestTrackOptions.builder().
            errorPolicy(ErrorPolicy.WARN_AND_MARK_MISSING).
            sentinelValues(Set.of(-1)).
            charset(StandardCharsets.ISO_8859_1).
            acceptLegacyLines(true).
            failOnUnexpectedMismatch(true).
            failOnDamagedHeader(true).
            build();

        assertEquals(ErrorPolicy.WARN_AND_MARK_MISSING, options.errorPolicy());
        assertEquals(Set.of(-1), options.sentinelValues());
        assertEquals(StandardCharsets.ISO_8859_1, options.charset());
        assertTrue(options.acceptLegacyLines());
        assertTrue(options.failOnUnexpectedMismatch());
        assertTrue(options.failOnDamagedHeader());
    }

    @Test
    void sentinelValuesAreCopied() {
        Set<Integer> sentinels = new HashSet<>(Arrays.asList(-999, -1));
        BestTrackOptions.Builder builder = BestTrackOptions.builder().sentinelValues(sentinels);
        sentinels.add(0);

        BestTrackOptions options = builder.build();
        assertEquals(Set.of(-999, -1), options.sentinelValues());
        assertThrows(UnsupportedOperationException.class, () -> options.sentinelValues().add(5));
    }

    @Test
    void nullArguments() {
        BestTrackOptions.Builder builder = BestTrackOptions.builder();

        Exception exception = assertThrows(NullPointerException.class, () -> builder.errorPolicy(null));
        assertEquals("errorPolicy must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.sentinelValues(null));
        assertEquals("sentinelValues must not be null", exception.getMessage());

        exception = assertThrows(
            NullPointerException.class,
            () -> builder.sentinelValues(new HashSet<>(Arrays.asList(-999, null))));
        assertEquals("sentinelValues must not contain null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.charset(null));
        assertEquals("charset must not be null", exception.getMessage());

        // The exceptions shouldn't corrupt the state of the builder.
        assertEquals(BestTrackOptions.DEFAULT_SENTINEL_VALUES, builder.build().sentinelValues());
    }
}
