package dev.multiverse.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * An immutable table of named columns, shared read-only by every universe.
 * Column order and row order are preserved. Derivations return new instances.
 */
public final class Dataset {

    private static final Dataset EMPTY = new Dataset(new LinkedHashMap<>(), 0);

    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private Dataset(LinkedHashMap<String, List<Object>> columns, int rowCount) {
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    /**
     * Build a dataset from named columns. Every column must have the same length.
     */
    public static Dataset of(Map<String, ? extends List<?>> columns) {
        var copy = new LinkedHashMap<String, List<Object>>();
        int rows = -1;
        for (var entry : columns.entrySet()) {
            String name = Objects.requireNonNull(entry.getKey(), "column name must not be null");
            List<?> values = Objects.requireNonNull(entry.getValue(), "column '" + name + "' is null");
            if (rows >= 0 && values.size() != rows) {
                throw new IllegalArgumentException(
                    "Column '%s' has %d values, expected %d".formatted(name, values.size(), rows));
            }
            rows = values.size();
            copy.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        }
        return new Dataset(copy, Math.max(rows, 0));
    }

    /**
     * Build a dataset from row maps. Columns appear in first-seen order; missing cells are null.
     */
    public static Dataset fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> names = new LinkedHashSet<>();
        rows.forEach(r -> names.addAll(r.keySet()));

        var columns = new LinkedHashMap<String, List<Object>>();
        for (String name : names) {
            var values = new ArrayList<Object>(rows.size());
            for (Map<String, ?> row : rows) {
                values.add(row.get(name));
            }
            columns.put(name, values);
        }
        return of(columns);
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public Map<String, List<Object>> columns() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No such column: " + name + " (have " + columns.keySet() + ")");
        }
        return values;
    }

    /**
     * Column values as doubles. Nulls and non-numeric values are rejected.
     */
    public double[] numericColumn(String name) {
        List<Object> values = column(name);
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            if (!(values.get(i) instanceof Number n)) {
                throw new IllegalArgumentException(
                    "Column '%s' row %d is not numeric: %s".formatted(name, i, values.get(i)));
            }
            result[i] = n.doubleValue();
        }
        return result;
    }

    public int rowCount() {
        return rowCount;
    }

    public Map<String, Object> row(int index) {
        Objects.checkIndex(index, rowCount);
        var row = new LinkedHashMap<String, Object>();
        columns.forEach((name, values) -> row.put(name, values.get(index)));
        return Collections.unmodifiableMap(row);
    }

    /**
     * A new dataset with {@code name} added, or replaced in place if it already exists.
     */
    public Dataset withColumn(String name, List<?> values) {
        if (!columns.isEmpty() && values.size() != rowCount) {
            throw new IllegalArgumentException(
                "Column '%s' has %d values, expected %d".formatted(name, values.size(), rowCount));
        }
        var copy = new LinkedHashMap<String, List<?>>(columns);
        copy.put(name, values);
        return of(copy);
    }

    /**
     * A new dataset holding only the rows accepted by {@code keep}, in their original order.
     */
    public Dataset filterRows(Predicate<Map<String, Object>> keep) {
        var kept = new ArrayList<Integer>();
        for (int i = 0; i < rowCount; i++) {
            if (keep.test(row(i))) {
                kept.add(i);
            }
        }
        var copy = new LinkedHashMap<String, List<Object>>();
        columns.forEach((name, values) -> {
            var filtered = new ArrayList<Object>(kept.size());
            kept.forEach(i -> filtered.add(values.get(i)));
            copy.put(name, filtered);
        });
        return of(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Dataset other && columns.equals(other.columns) && rowCount == other.rowCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowCount);
    }

    @Override
    public String toString() {
        return "Dataset" + columns.keySet() + " x " + rowCount + " rows";
    }
}
