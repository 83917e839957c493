///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link LineCursor}. */
public class LineCursorTest {

    @Test
    void readLines() throws IOException {
        try (LineCursor cursor = new LineCursor(new StringReader("first\r\n\nthird"))) {
            assertEquals(0, cursor.lineNumber());
            assertEquals("first", cursor.nextLine());
            assertEquals(1, cursor.lineNumber());
            assertEquals("", cursor.nextLine());
            assertEquals("third", cursor.nextLine());
            assertEquals(3, cursor.lineNumber());

            // The end of the input is sticky.
            assertNull(cursor.nextLine());
            assertNull(cursor.nextLine());
            assertEquals(3, cursor.lineNumber());
        }
    }

    @Test
    void readFailure() {
        Reader failingReader = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk on fire");
            }

            @Override
            public void close() {
            }
        };

        LineCursor cursor = new LineCursor(failingReader);
        UncheckedIOException exception = assertThrows(UncheckedIOException.class, cursor::nextLine);
        assertEquals("could not read line 1", exception.getMessage());
        assertEquals("disk on fire", exception.getCause().getMessage());
    }

    @Test
    void nextLineAfterClose() throws IOException {
        LineCursor cursor = new LineCursor(new StringReader("first\n"));
        cursor.close();
        assertNull(cursor.nextLine());
    }
}
