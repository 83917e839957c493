///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Parses the fixed-width header line that introduces each storm.
 * <p>
 * A header line looks like this:
 * </p>
 * <pre>
 * AL011851,            UNNAMED,     14,
 * </pre>
 * <p>
 * Fields are read by position, not by splitting on commas:
 * </p>
 * <pre>
 *   [0,2)    basin
 *   [2,4)    cyclone number
 *   [4,8)    year
 *   [18,28)  name, right-justified
 *   [33,36)  number of track point lines that follow
 * </pre>
 */
public final class HeaderLineParser {

    /** The shortest line that holds every header field. */
    public static final int MINIMUM_LENGTH = 36;

    static final int EARLIEST_PLAUSIBLE_YEAR = 1800;
    static final int LATEST_PLAUSIBLE_YEAR = 2999;

    private static final int BASIN_START = 0;
    private static final int BASIN_END = 2;
    private static final int CYCLONE_NUMBER_START = 2;
    private static final int CYCLONE_NUMBER_END = 4;
    private static final int YEAR_START = 4;
    private static final int YEAR_END = 8;
    private static final int NAME_START = 18;
    private static final int NAME_END = 28;
    private static final int ENTRIES_START = 33;
    private static final int ENTRIES_END = 36;

    // private constructor to prevent anyone from instantiating the class.
    private HeaderLineParser() {
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || '9' < c) {
                return false;
            }
        }
        return true;
    }

    private static boolean isLetters(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c < 'A' || 'Z' < c) && (c < 'a' || 'z' < c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Determines whether a line begins the way a header does: a two-letter basin, a two-digit cyclone number, and a
     * plausible four-digit year.  Track point lines begin with a date, so they never match.
     *
     * @param line
     *     The line to check.
     *
     * @return {@code true} if the line's prefix has the shape of a header.
     */
    static boolean claimsHeader(String line) {
        if (line.length() < YEAR_END) {
            return false;
        }
        String year = line.substring(YEAR_START, YEAR_END);
        if (!isLetters(line.substring(BASIN_START, BASIN_END)) ||
            !isDigits(line.substring(CYCLONE_NUMBER_START, CYCLONE_NUMBER_END)) ||
            !isDigits(year)) {
            return false;
        }
        int yearValue = Integer.parseInt(year);
        return EARLIEST_PLAUSIBLE_YEAR <= yearValue && yearValue <= LATEST_PLAUSIBLE_YEAR;
    }

    /**
     * Determines whether a line is a storm header.  A line is a header if its prefix has the shape of one and the
     * whole line parses with {@link #parse}.  No basin code is singled out.
     *
     * @param line
     *     The line to check.
     *
     * @return {@code true} if the line is a header.
     *
     * @throws NullPointerException
     *     if {@code line} is {@code null}.
     */
    public static boolean isHeader(String line) {
        ArgumentUtil.checkNotNull(line, "line");
        return claimsHeader(line) && findProblem(line) == null;
    }

    /**
     * Checks the parts of a line that {@link #parse} requires.
     *
     * @return a description of what's wrong with the line, or {@code null} if it can be parsed.
     */
    private static String findProblem(String line) {
        if (line.length() < MINIMUM_LENGTH) {
            return "header line has " + line.length() + " characters but at least " + MINIMUM_LENGTH + " are required";
        }
        String year = line.substring(YEAR_START, YEAR_END).trim();
        if (!isDigits(year)) {
            return "header year \"" + year + "\" is not a number";
        }
        String entries = line.substring(ENTRIES_START, ENTRIES_END).trim();
        if (!isDigits(entries)) {
            return "header entry count \"" + entries + "\" is not a non-negative integer";
        }
        return null;
    }

    /**
     * Parses a header line.
     *
     * @param line
     *     The line to parse.
     * @param lineNumber
     *     The 1-based line number, for error messages.  Use {@link BestTrackFormatException#UNKNOWN_LINE} if it isn't
     *     known.
     *
     * @return The parsed header.
     *
     * @throws NullPointerException
     *     if {@code line} is {@code null}.
     * @throws MalformedHeaderException
     *     if the line is shorter than {@link #MINIMUM_LENGTH}, or its year or entry count isn't a non-negative
     *     integer.
     */
    public static HeaderRecord parse(String line, int lineNumber) {
        ArgumentUtil.checkNotNull(line, "line");

        String problem = findProblem(line);
        if (problem != null) {
            throw new MalformedHeaderException(problem, lineNumber, null);
        }

        return new HeaderRecord(
            line.substring(BASIN_START, BASIN_END).trim(),
            line.substring(CYCLONE_NUMBER_START, CYCLONE_NUMBER_END).trim(),
            Integer.parseInt(line.substring(YEAR_START, YEAR_END).trim()),
            line.substring(NAME_START, NAME_END).trim(),
            Integer.parseInt(line.substring(ENTRIES_START, ENTRIES_END).trim()),
            lineNumber);
    }
}
