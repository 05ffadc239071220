package de.bsommerfeld.reviewinsights.core.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The uniform output of every report: ordered column labels plus ordered
 * rows. Every row has exactly {@code columns().size()} values. An empty
 * result still carries its labels, so renderers can always print a header.
 *
 * <p>
 * Instances are immutable. Both lists are copied on construction; row
 * values may be {@code null} (SQL NULL) which is why {@link List#copyOf} is
 * not used for the rows.
 *
 * @param columns column labels, non-empty, no duplicates
 * @param rows    row tuples in report order
 */
public record TabularResult(List<String> columns, List<List<Object>> rows) {

    public TabularResult {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("A tabular result needs at least one column");
        }
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (column == null || !seen.add(column)) {
                throw new IllegalArgumentException("Invalid or duplicate column label: " + column);
            }
        }
        columns = List.copyOf(columns);

        List<List<Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (int i = 0; i < rows.size(); i++) {
                List<Object> row = rows.get(i);
                if (row == null || row.size() != columns.size()) {
                    throw new IllegalArgumentException("Row " + i + " has arity "
                            + (row == null ? "null" : row.size()) + ", expected " + columns.size());
                }
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    /** A result with the given labels and no rows. */
    public static TabularResult empty(List<String> columns) {
        return new TabularResult(columns, List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Position of {@code label} in {@link #columns()}.
     *
     * @throws IllegalArgumentException if the label is not present
     */
    public int indexOf(String label) {
        int idx = columns.indexOf(label);
        if (idx < 0) {
            throw new IllegalArgumentException("No column '" + label + "' in " + columns);
        }
        return idx;
    }

    /** All values of one column, top to bottom. */
    public List<Object> column(String label) {
        int idx = indexOf(label);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(idx));
        }
        return values;
    }
}
