package de.bsommerfeld.reviewinsights.analytics;

import de.bsommerfeld.reviewinsights.core.result.TabularResult;
import de.bsommerfeld.reviewinsights.db.QueryExecutionException;
import de.bsommerfeld.reviewinsights.db.QueryId;
import de.bsommerfeld.reviewinsights.db.RelationalExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Row interpretation with driver-specific value types and malformed rows,
 * using a mocked executor.
 */
@ExtendWith(MockitoExtension.class)
class QueryCatalogRowMappingTest {

    @Mock
    private RelationalExecutor executor;

    private QueryCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new QueryCatalog(executor);
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    void helpfulReviews_shouldPassAsinAndLimit() throws Exception {
        when(executor.execute(eq(QueryId.SELECT_TOP_RATED_REVIEWS), eq(List.of("B1", 5)))).thenReturn(List.of());

        catalog.helpfulReviewsHighestRated("B1");

        verify(executor).execute(QueryId.SELECT_TOP_RATED_REVIEWS, List.of("B1", QueryCatalog.HELPFUL_REVIEW_LIMIT));
    }

    @Test
    void dailyRatingTrend_shouldAcceptPostgresValueTypes() throws Exception {
        when(executor.execute(eq(QueryId.SELECT_DAILY_RATING_AVERAGES), eq(List.of("B1")))).thenReturn(List.of(
                row("review_date", Date.valueOf("2020-01-01"), "avg_rating", new BigDecimal("3.5000"))));

        TabularResult result = catalog.dailyRatingTrend("B1");

        assertEquals(LocalDate.of(2020, 1, 1), result.rows().get(0).get(0));
        assertEquals(3.5, result.rows().get(0).get(1));
    }

    @Test
    void mostActiveCustomers_shouldAcceptLongCounts() throws Exception {
        when(executor.execute(eq(QueryId.SELECT_CUSTOMER_REVIEW_COUNTS), eq(List.of()))).thenReturn(List.of(
                row("grp", "Book", "customer", "C1", "num_reviews", 3L),
                row("grp", "Book", "customer", "C2", "num_reviews", 7L)));

        TabularResult result = catalog.mostActiveCustomersPerGroup();

        assertEquals(List.of("C2", "C1"), result.column(ReportColumns.CUSTOMER));
    }

    @Test
    void topSalesRankPerGroup_shouldKeepTenPerGroup() throws Exception {
        List<Map<String, Object>> rows = new java.util.ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            rows.add(row("asin", String.format("B%02d", i), "grp", "Book", "salesrank", 100 - i));
        }
        when(executor.execute(eq(QueryId.SELECT_RANKED_PRODUCTS), eq(List.of()))).thenReturn(rows);

        TabularResult result = catalog.topSalesRankPerGroup();

        assertEquals(QueryCatalog.TOP_PER_GROUP, result.size());
        assertEquals("B15", result.rows().get(0).get(0));
        assertEquals(85, result.rows().get(0).get(2));
    }

    @Test
    void topSalesRankPerGroup_shouldSkipRowsWithoutGroup() throws Exception {
        when(executor.execute(eq(QueryId.SELECT_RANKED_PRODUCTS), eq(List.of()))).thenReturn(List.of(
                row("asin", "B1", "grp", null, "salesrank", 1),
                row("asin", "B2", "grp", "Book", "salesrank", 2)));

        assertEquals(List.of("B2"), catalog.topSalesRankPerGroup().column(ReportColumns.ASIN));
    }

    @Test
    void helpfulReviews_shouldFailOnMissingColumn() throws Exception {
        when(executor.execute(eq(QueryId.SELECT_LOW_RATED_REVIEWS), eq(List.of("B1", 5)))).thenReturn(List.of(
                row("customer", "C1", "votes", 1, "helpful", 1)));

        assertThrows(QueryExecutionException.class, () -> catalog.helpfulReviewsLowestRated("B1"));
    }

    @Test
    void similarCheaperProducts_shouldFailOnNonNumericRank() throws Exception {
        when(executor.execute(eq(QueryId.SELECT_SIMILAR_CHEAPER_PRODUCTS), eq(List.of("B1")))).thenReturn(List.of(
                row("asin_similar", "B2", "salesrank", "fast")));

        assertThrows(QueryExecutionException.class, () -> catalog.similarCheaperProducts("B1"));
    }

    @Test
    void bestHelpfulnessProducts_shouldKeepSqlNullAsNull() throws Exception {
        Map<String, Object> nullAverage = new HashMap<>();
        nullAverage.put("asin", "B1");
        nullAverage.put("avg_helpful", null);
        when(executor.execute(eq(QueryId.SELECT_PRODUCT_HELPFULNESS), eq(List.of(10)))).thenReturn(
                List.of(nullAverage));

        assertNull(catalog.bestHelpfulnessProducts().rows().get(0).get(1));
    }

    @Test
    void bestHelpfulnessCategories_shouldPropagateExecutorFailure() throws Exception {
        when(executor.execute(eq(QueryId.SELECT_CATEGORY_HELPFULNESS), eq(List.of(5))))
                .thenThrow(new QueryExecutionException("relation \"categoria\" does not exist"));

        assertThrows(QueryExecutionException.class, () -> catalog.bestHelpfulnessCategories());
    }
}
