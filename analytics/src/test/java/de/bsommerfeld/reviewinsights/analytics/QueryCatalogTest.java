package de.bsommerfeld.reviewinsights.analytics;

import de.bsommerfeld.reviewinsights.core.domain.Category;
import de.bsommerfeld.reviewinsights.core.domain.Product;
import de.bsommerfeld.reviewinsights.core.domain.ProductCategory;
import de.bsommerfeld.reviewinsights.core.domain.Review;
import de.bsommerfeld.reviewinsights.core.domain.SampleDataset;
import de.bsommerfeld.reviewinsights.core.domain.Similarity;
import de.bsommerfeld.reviewinsights.core.result.TabularResult;
import de.bsommerfeld.reviewinsights.db.SampleDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs every report against a small hand-built dataset in a temporary SQLite
 * database.
 *
 * <pre>
 * P1 Book  100   reviews C1..C6, categories Science
 * P2 Book   50   reviews C1, C2, C7 (trend 2020-01-01: 2, 4 / 2020-01-02: 5)
 * P3 Book  200
 * P4 Book    0   unranked
 * P5 Music  10   review C1, categories Jazz
 * P6 Music  10   review C8 without helpful votes, categories Drama
 * P1 is similar to P2, P3, P4 and P5
 * </pre>
 */
class QueryCatalogTest {

    private static final LocalDate DAY = LocalDate.of(2020, 1, 5);

    @TempDir
    Path tempDir;

    private QueryCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        SampleDatabase db = SampleDatabase.create(tempDir.resolve("catalog.db"));
        db.seed(new SampleDataset(
                List.of(
                        new Product("P1", "Book", 100),
                        new Product("P2", "Book", 50),
                        new Product("P3", "Book", 200),
                        new Product("P4", "Book", 0),
                        new Product("P5", "Music", 10),
                        new Product("P6", "Music", 10)),
                List.of(
                        new Review("P1", "C1", 5, 10, 8, DAY),
                        new Review("P1", "C2", 5, 3, 3, DAY),
                        new Review("P1", "C3", 1, 9, 9, DAY),
                        new Review("P1", "C4", 1, 0, 0, DAY),
                        new Review("P1", "C5", 3, 4, 2, DAY),
                        new Review("P1", "C6", 2, 1, 1, DAY),
                        new Review("P2", "C1", 2, 1, 0, LocalDate.of(2020, 1, 1)),
                        new Review("P2", "C2", 4, 5, 4, LocalDate.of(2020, 1, 1)),
                        new Review("P2", "C7", 5, 0, 0, LocalDate.of(2020, 1, 2)),
                        new Review("P5", "C1", 4, 6, 6, DAY),
                        new Review("P6", "C8", 3, 2, 0, DAY)),
                List.of(new Category(1, "Science"), new Category(2, "Jazz"), new Category(3, "Drama")),
                List.of(
                        new ProductCategory("P1", 1),
                        new ProductCategory("P2", 1),
                        new ProductCategory("P5", 2),
                        new ProductCategory("P6", 3)),
                List.of(
                        new Similarity("P1", "P2"),
                        new Similarity("P1", "P3"),
                        new Similarity("P1", "P4"),
                        new Similarity("P1", "P5"))));
        catalog = new QueryCatalog(db.executor());
    }

    // -- Helpful reviews --

    @Test
    void helpfulReviewsHighestRated_shouldOrderByRatingThenHelpful() throws Exception {
        TabularResult result = catalog.helpfulReviewsHighestRated("P1");

        assertEquals(ReportColumns.HELPFUL_REVIEWS, result.columns());
        assertEquals(List.of("C1", "C2", "C5", "C6", "C3"), result.column(ReportColumns.CUSTOMER));
        assertEquals(List.of(5, 5, 3, 2, 1), result.column(ReportColumns.RATING));
    }

    @Test
    void helpfulReviewsLowestRated_shouldOrderByRatingThenHelpful() throws Exception {
        TabularResult result = catalog.helpfulReviewsLowestRated("P1");

        assertEquals(List.of("C3", "C4", "C6", "C5", "C1"), result.column(ReportColumns.CUSTOMER));
        assertEquals(List.of(List.of("C3", 1, 9, 9)), result.rows().subList(0, 1));
    }

    @Test
    void helpfulReviews_shouldBeEmptyForProductWithoutReviews() throws Exception {
        TabularResult result = catalog.helpfulReviewsHighestRated("P3");

        assertTrue(result.isEmpty());
        assertEquals(ReportColumns.HELPFUL_REVIEWS, result.columns());
    }

    // -- Similar products --

    @Test
    void similarCheaperProducts_shouldOnlyListBetterSellingProducts() throws Exception {
        TabularResult result = catalog.similarCheaperProducts("P1");

        assertEquals(ReportColumns.SIMILAR_PRODUCTS, result.columns());
        assertEquals(List.of("P4", "P5", "P2"), result.column(ReportColumns.ASIN_SIMILAR));
        assertEquals(List.of(0, 10, 50), result.column(ReportColumns.SALESRANK));
    }

    @Test
    void similarCheaperProducts_shouldNotFollowReverseEdges() throws Exception {
        assertTrue(catalog.similarCheaperProducts("P3").isEmpty());
    }

    // -- Rating trend --

    @Test
    void dailyRatingTrend_shouldAverageRatingsPerDay() throws Exception {
        TabularResult result = catalog.dailyRatingTrend("P2");

        assertEquals(ReportColumns.RATING_TREND, result.columns());
        assertEquals(List.of(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 1, 2)),
                result.column(ReportColumns.DATE));
        assertEquals(3.0, (Double) result.rows().get(0).get(1), 1e-9);
        assertEquals(5.0, (Double) result.rows().get(1).get(1), 1e-9);
    }

    @Test
    void dailyRatingTrend_shouldBeEmptyForUnknownProduct() throws Exception {
        TabularResult result = catalog.dailyRatingTrend("UNKNOWN");

        assertTrue(result.isEmpty());
        assertEquals(ReportColumns.RATING_TREND, result.columns());
    }

    // -- Sales rank --

    @Test
    void topSalesRankPerGroup_shouldRankWithinGroupsAndSkipUnranked() throws Exception {
        TabularResult result = catalog.topSalesRankPerGroup();

        assertEquals(ReportColumns.SALES_RANK_PER_GROUP, result.columns());
        assertEquals(List.of("P2", "P1", "P3", "P5", "P6"), result.column(ReportColumns.ASIN));
        assertEquals(List.of("Book", "Book", "Book", "Music", "Music"), result.column(ReportColumns.GROUP));
        assertEquals(List.of(50, 100, 200, 10, 10), result.column(ReportColumns.SALESRANK));
    }

    // -- Helpfulness --

    @Test
    void bestHelpfulnessProducts_shouldAverageOnlyHelpfulReviews() throws Exception {
        TabularResult result = catalog.bestHelpfulnessProducts();

        assertEquals(ReportColumns.PRODUCT_HELPFULNESS, result.columns());
        // P6 has no helpful review at all; P2 averages 4 instead of 4/3
        assertEquals(List.of("P5", "P1", "P2"), result.column(ReportColumns.ASIN));
        assertEquals(6.0, (Double) result.rows().get(0).get(1), 1e-9);
        assertEquals(4.6, (Double) result.rows().get(1).get(1), 1e-9);
        assertEquals(4.0, (Double) result.rows().get(2).get(1), 1e-9);
    }

    @Test
    void bestHelpfulnessCategories_shouldAverageOverCategoryMembers() throws Exception {
        TabularResult result = catalog.bestHelpfulnessCategories();

        assertEquals(ReportColumns.CATEGORY_HELPFULNESS, result.columns());
        assertEquals(List.of("Jazz", "Science"), result.column(ReportColumns.CATEGORY));
        assertEquals(4.5, (Double) result.rows().get(1).get(1), 1e-9);
    }

    // -- Customer activity --

    @Test
    void mostActiveCustomersPerGroup_shouldRankByReviewCount() throws Exception {
        TabularResult result = catalog.mostActiveCustomersPerGroup();

        assertEquals(ReportColumns.CUSTOMER_ACTIVITY, result.columns());
        assertEquals(List.of("C1", "C2", "C3", "C4", "C5", "C6", "C7", "C1", "C8"),
                result.column(ReportColumns.CUSTOMER));
        assertEquals(List.of(2L, 2L, 1L, 1L, 1L, 1L, 1L, 1L, 1L), result.column(ReportColumns.NUM_COMMENTS));
        assertEquals("Music", result.rows().get(7).get(0));
    }

    // -- Determinism --

    @Test
    void reports_shouldBeIdempotent() throws Exception {
        assertEquals(catalog.helpfulReviewsHighestRated("P1"), catalog.helpfulReviewsHighestRated("P1"));
        assertEquals(catalog.topSalesRankPerGroup(), catalog.topSalesRankPerGroup());
        assertEquals(catalog.mostActiveCustomersPerGroup(), catalog.mostActiveCustomersPerGroup());
        assertEquals(catalog.bestHelpfulnessCategories(), catalog.bestHelpfulnessCategories());
    }
}
