///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An optional analysis pass that finds and removes columns whose value never changes across a dataset.
 * <p>
 * Whether a column is uninformative is a property of one particular dataset, not of the file format.  For example, a
 * file holding a single basin has a constant {@code basin} column, and one holding only northern-hemisphere storms has
 * no negative latitudes.  Nothing in the parser applies this pass; callers invoke it explicitly.
 * </p>
 */
public final class UninformativeColumns {

    private static final Logger LOG = LoggerFactory.getLogger(UninformativeColumns.class);

    // private constructor to prevent anyone from instantiating the class.
    private UninformativeColumns() {
    }

    /**
     * Finds the columns that take at most one distinct value (where {@code null} counts as a value).
     *
     * @param dataset
     *     The dataset to analyze.
     *
     * @return The names of the uninformative columns, in column order.  An empty dataset has no uninformative columns.
     */
    public static List<String> find(Dataset dataset) {
        ArgumentUtil.checkNotNull(dataset, "dataset");

        List<String> uninformative = new ArrayList<>();
        if (dataset.size() == 0) {
            return uninformative;
        }

        List<Column> columns = dataset.metadata().columns();
        for (int i = 0; i < columns.size(); i++) {
            Object first = dataset.observations().get(0).get(i);
            boolean constant = true;
            for (List<Object> observation : dataset.observations()) {
                Object value = observation.get(i);
                if (first == null ? value != null : !first.equals(value)) {
                    constant = false;
                    break;
                }
            }
            if (constant) {
                uninformative.add(columns.get(i).name());
            }
        }

        LOG.debug("Found {} uninformative column(s): {}", uninformative.size(), uninformative);
        return uninformative;
    }

    /**
     * Creates a copy of a dataset without the given columns.
     *
     * @param dataset
     *     The dataset to copy.
     * @param columnNames
     *     The names of the columns to drop.
     *
     * @return A new dataset with the remaining columns in their original order.
     *
     * @throws IllegalArgumentException
     *     if a name doesn't match any column, or if every column would be dropped.
     */
    public static Dataset drop(Dataset dataset, Collection<String> columnNames) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(columnNames, "columnNames");

        Set<String> toDrop = new LinkedHashSet<>(columnNames);
        Set<String> existing = new HashSet<>();
        for (Column column : dataset.metadata().columns()) {
            existing.add(column.name());
        }
        for (String name : toDrop) {
            if (!existing.contains(name)) {
                throw new IllegalArgumentException("dataset has no column named \"" + name + "\"");
            }
        }
        if (toDrop.size() == existing.size()) {
            throw new IllegalArgumentException("cannot drop every column of a dataset");
        }

        List<Column> columns = dataset.metadata().columns();
        List<Integer> keptIndexes = new ArrayList<>();
        List<Column> keptColumns = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (!toDrop.contains(columns.get(i).name())) {
                keptIndexes.add(i);
                keptColumns.add(columns.get(i));
            }
        }

        List<List<Object>> observations = new ArrayList<>(dataset.size());
        for (List<Object> observation : dataset.observations()) {
            List<Object> row = new ArrayList<>(keptIndexes.size());
            for (int index : keptIndexes) {
                row.add(observation.get(index));
            }
            observations.add(row);
        }

        DatasetMetadata metadata = dataset.metadata().toBuilderWithoutColumns().columns(keptColumns).build();
        if (!toDrop.isEmpty()) {
            LOG.info("Dropped column(s) {} from dataset \"{}\"", toDrop, metadata.datasetName());
        }
        return new Dataset(metadata, observations);
    }

    /**
     * Finds the uninformative columns of a dataset and returns a copy without them.
     *
     * @param dataset
     *     The dataset to copy.
     *
     * @return A new dataset.  If every column is uninformative (for example, a dataset with a single row), the dataset
     *     is returned unchanged.
     */
    public static Dataset dropAll(Dataset dataset) {
        List<String> names = find(dataset);
        if (names.size() == dataset.metadata().columns().size()) {
            LOG.warn("Every column of dataset \"{}\" is uninformative; nothing was dropped",
                dataset.metadata().datasetName());
            return dataset;
        }
        return drop(dataset, names);
    }
}
