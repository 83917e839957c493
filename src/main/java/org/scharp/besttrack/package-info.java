///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library reads best-track storm files (the fixed-width HURDAT2 format) into typed track points and writes them
 * as columnar track dataset files.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.besttrack.BestTrackPipeline} for sample code on reading a file.  The
 * stages it runs can also be used on their own: {@link org.scharp.besttrack.RecordAssembler},
 * {@link org.scharp.besttrack.EntryCountValidator}, and {@link org.scharp.besttrack.SchemaNormalizer}.  Datasets are
 * written with {@link org.scharp.besttrack.DatasetExporter} and read with {@link org.scharp.besttrack.DatasetReader}.
 * </p>
 *
 * <h2>A Best-Track Primer for Java Programmers</h2>
 *
 * <p>
 * A best-track file lists every storm in a basin.  Each storm begins with a header line that gives its basin, its
 * number within the year, the year, its name, and the number of track point lines that follow.  Each track point is
 * one observation of the storm's position and intensity, usually at six-hour intervals.
 * </p>
 *
 * <p>
 * Although the fields are separated by commas, they are always at the same character positions, so this library reads
 * them by position.  A shifted field would be read as a different field without any error, so the parser is strict
 * about line lengths and the shape of each field.
 * </p>
 *
 * <p>
 * Numeric fields that were not measured hold a sentinel such as {@code -999}.  These, along with blank fields, become
 * {@code null}.  Storms that continue past December 31 have track points in two years, which matters when counting
 * track points by year (see {@link org.scharp.besttrack.EntryCountValidator}).
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * A malformed track point line stops the parse with a subclass of
 * {@link org.scharp.besttrack.BestTrackFormatException} that gives the line number and the storm.  Lines between storms
 * that aren't headers are skipped; damaged headers are skipped with a warning.  Storm track point counts that differ from their headers are only logged, unless the
 * caller asks for them to be fatal.  Arguments are checked fail-fast, as in the dataset writer.
 * </p>
 */
package org.scharp.besttrack;
