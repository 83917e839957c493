///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * A forward-only position in a stream of lines.
 * <p>
 * The cursor reads one line at a time, so the input never has to be held in memory.  It is not thread-safe and
 * should have a single owner.
 * </p>
 */
final class LineCursor implements Closeable {

    private final BufferedReader reader;
    private int lineNumber;
    private boolean exhausted;

    LineCursor(Reader reader) {
        ArgumentUtil.checkNotNull(reader, "reader");
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.lineNumber = 0;
        this.exhausted = false;
    }

    /**
     * Advances to the next line.
     *
     * @return The next line, without its line terminator, or {@code null} at the end of the input.
     *
     * @throws UncheckedIOException
     *     if the line could not be read.
     */
    String nextLine() {
        if (exhausted) {
            return null;
        }

        final String line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("could not read line " + (lineNumber + 1), e);
        }

        if (line == null) {
            exhausted = true;
        } else {
            lineNumber++;
        }
        return line;
    }

    /**
     * Gets the 1-based number of the line most recently returned by {@link #nextLine}.
     *
     * @return The line number, or 0 if no line has been read.
     */
    int lineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        exhausted = true;
        reader.close();
    }
}
