package de.bsommerfeld.reviewinsights.analytics;

import de.bsommerfeld.reviewinsights.core.result.TabularResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns positional rows plus column labels into a {@link TabularResult}.
 *
 * <p>
 * A label/arity mismatch means the catalog and its declared columns disagree.
 * It surfaces as {@link IllegalStateException}, never as a per-report
 * failure.
 */
public final class ResultProjector {

    private ResultProjector() {
    }

    /**
     * @throws IllegalStateException if {@code columns} is empty or has
     *                               duplicates, or a row's arity differs
     */
    public static TabularResult project(List<? extends List<?>> rows, List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalStateException("Projection without columns");
        }
        Set<String> unique = new HashSet<>(columns);
        if (unique.size() != columns.size() || unique.contains(null)) {
            throw new IllegalStateException("Column labels must be unique and non-null: " + columns);
        }

        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<?> row = rows.get(i);
            if (row == null || row.size() != columns.size()) {
                throw new IllegalStateException("Row " + i + " has " + (row == null ? "no" : row.size())
                        + " values but the projection declares " + columns.size() + " columns " + columns);
            }
            projected.add(new ArrayList<>(row));
        }
        return new TabularResult(columns, projected);
    }

    /** An empty result carrying {@code columns}. */
    public static TabularResult empty(List<String> columns) {
        return project(List.of(), columns);
    }
}
