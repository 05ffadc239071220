package de.bsommerfeld.reviewinsights.terminal.render;

import de.bsommerfeld.reviewinsights.core.result.TabularResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableRendererTest {

    private static final String NL = System.lineSeparator();

    private final TableRenderer renderer = new TableRenderer();

    @Test
    void render_shouldRightAlignColumns() {
        TabularResult table = new TabularResult(List.of("ASIN", "Salesrank"), List.of(
                List.of("B1", 3),
                List.of("B22", 10)));

        assertEquals(
                "ASIN  Salesrank" + NL
                        + "  B1          3" + NL
                        + " B22         10" + NL,
                renderer.render(table));
    }

    @Test
    void render_shouldPrintHeaderForEmptyTable() {
        assertEquals("Date  Average Rating" + NL,
                renderer.render(TabularResult.empty(List.of("Date", "Average Rating"))));
    }

    @Test
    void format_shouldUseTwoDecimalsForFloatingPoint() {
        assertEquals("4.60", TableRenderer.format(4.6));
        assertEquals("3.00", TableRenderer.format(3.0f));
        assertEquals("12", TableRenderer.format(12L));
    }

    @Test
    void format_shouldPrintNullMarker() {
        TabularResult table = new TabularResult(List.of("ASIN", "Avg"), List.of(Arrays.asList("B1", null)));

        assertTrue(renderer.render(table).contains("NULL"));
        assertEquals("NULL", TableRenderer.format(null));
    }
}
