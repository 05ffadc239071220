package de.bsommerfeld.reviewinsights.terminal.render;

import com.google.inject.Singleton;
import de.bsommerfeld.reviewinsights.core.result.TabularResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text table dump: a header line with the column labels, then one
 * line per row, every column right-aligned to its widest cell and separated
 * by two spaces. Floating point values get two decimals, SQL NULL prints as
 * {@code NULL}.
 */
@Singleton
public class TableRenderer {

    static final String SEPARATOR = "  ";

    public String render(TabularResult table) {
        List<String> columns = table.columns();
        List<List<String>> cells = new ArrayList<>(table.size());
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
        }

        for (List<Object> row : table.rows()) {
            List<String> line = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                String cell = format(row.get(c));
                widths[c] = Math.max(widths[c], cell.length());
                line.add(cell);
            }
            cells.add(line);
        }

        StringBuilder sb = new StringBuilder();
        appendLine(sb, columns, widths);
        for (List<String> line : cells) {
            appendLine(sb, line, widths);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
        for (int c = 0; c < cells.size(); c++) {
            if (c > 0) {
                sb.append(SEPARATOR);
            }
            String cell = cells.get(c);
            sb.append(" ".repeat(widths[c] - cell.length())).append(cell);
        }
        sb.append(System.lineSeparator());
    }

    static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%.2f", ((Number) value).doubleValue());
        }
        return value.toString();
    }
}
