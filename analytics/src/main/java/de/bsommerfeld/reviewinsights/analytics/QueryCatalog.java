package de.bsommerfeld.reviewinsights.analytics;

import com.google.inject.Singleton;
import de.bsommerfeld.reviewinsights.analytics.Ranker.Direction;
import de.bsommerfeld.reviewinsights.analytics.Ranker.Ranked;
import de.bsommerfeld.reviewinsights.core.result.TabularResult;
import de.bsommerfeld.reviewinsights.db.QueryExecutionException;
import de.bsommerfeld.reviewinsights.db.QueryId;
import de.bsommerfeld.reviewinsights.db.RelationalExecutor;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * The analytical reports. Every operation is a pure function of the dataset
 * and its argument: it reads through the {@link RelationalExecutor}, never
 * caches, and returns rows in a fully determined order.
 *
 * <table>
 * <caption>Report semantics</caption>
 * <tr><th>Operation</th><th>Filter</th><th>Order</th><th>Limit</th></tr>
 * <tr><td>{@link #helpfulReviewsHighestRated}</td><td>asin</td><td>rating desc, helpful desc</td><td>5</td></tr>
 * <tr><td>{@link #helpfulReviewsLowestRated}</td><td>asin</td><td>rating asc, helpful desc</td><td>5</td></tr>
 * <tr><td>{@link #similarCheaperProducts}</td><td>similar to asin, lower salesrank</td><td>salesrank asc</td><td>-</td></tr>
 * <tr><td>{@link #dailyRatingTrend}</td><td>asin</td><td>date asc, mean rating per date</td><td>-</td></tr>
 * <tr><td>{@link #topSalesRankPerGroup}</td><td>salesrank &gt; 0</td><td>group, salesrank asc</td><td>10 per group</td></tr>
 * <tr><td>{@link #bestHelpfulnessProducts}</td><td>helpful &gt; 0</td><td>mean helpful desc</td><td>10</td></tr>
 * <tr><td>{@link #bestHelpfulnessCategories}</td><td>helpful &gt; 0</td><td>mean helpful desc</td><td>5</td></tr>
 * <tr><td>{@link #mostActiveCustomersPerGroup}</td><td>-</td><td>group, review count desc</td><td>10 per group</td></tr>
 * </table>
 *
 * <p>
 * Helpfulness means average over reviews with {@code helpful > 0} only;
 * reviews without helpful votes do not pull the average down.
 *
 * <p>
 * No match yields an empty result with the report's columns. Malformed rows
 * (missing columns, values of the wrong type) raise
 * {@link QueryExecutionException} like a failed statement does.
 */
@Singleton
public class QueryCatalog {

    static final int HELPFUL_REVIEW_LIMIT = 5;
    static final int TOP_PER_GROUP = 10;
    static final int PRODUCT_HELPFULNESS_LIMIT = 10;
    static final int CATEGORY_HELPFULNESS_LIMIT = 5;

    private final RelationalExecutor executor;

    @Inject
    public QueryCatalog(RelationalExecutor executor) {
        this.executor = executor;
    }

    public TabularResult helpfulReviewsHighestRated(String asin) throws QueryExecutionException {
        return helpfulReviews(QueryId.SELECT_TOP_RATED_REVIEWS, asin);
    }

    public TabularResult helpfulReviewsLowestRated(String asin) throws QueryExecutionException {
        return helpfulReviews(QueryId.SELECT_LOW_RATED_REVIEWS, asin);
    }

    private TabularResult helpfulReviews(QueryId queryId, String asin) throws QueryExecutionException {
        List<List<Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : executor.execute(queryId, List.of(asin, HELPFUL_REVIEW_LIMIT))) {
            rows.add(Arrays.asList(
                    RowValues.text(row, "customer"),
                    RowValues.integer(row, "rating"),
                    RowValues.integer(row, "votes"),
                    RowValues.integer(row, "helpful")));
        }
        return ResultProjector.project(rows, ReportColumns.HELPFUL_REVIEWS);
    }

    public TabularResult similarCheaperProducts(String asin) throws QueryExecutionException {
        List<List<Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : executor.execute(QueryId.SELECT_SIMILAR_CHEAPER_PRODUCTS, List.of(asin))) {
            rows.add(Arrays.asList(
                    RowValues.text(row, "asin_similar"),
                    RowValues.integer(row, "salesrank")));
        }
        return ResultProjector.project(rows, ReportColumns.SIMILAR_PRODUCTS);
    }

    public TabularResult dailyRatingTrend(String asin) throws QueryExecutionException {
        List<List<Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : executor.execute(QueryId.SELECT_DAILY_RATING_AVERAGES, List.of(asin))) {
            rows.add(Arrays.asList(
                    RowValues.date(row, "review_date"),
                    RowValues.decimal(row, "avg_rating")));
        }
        return ResultProjector.project(rows, ReportColumns.RATING_TREND);
    }

    public TabularResult topSalesRankPerGroup() throws QueryExecutionException {
        List<RankedProduct> candidates = new ArrayList<>();
        for (Map<String, Object> row : executor.execute(QueryId.SELECT_RANKED_PRODUCTS, List.of())) {
            candidates.add(new RankedProduct(
                    RowValues.text(row, "asin"),
                    RowValues.text(row, "grp"),
                    RowValues.integer(row, "salesrank")));
        }

        List<List<Object>> rows = new ArrayList<>();
        for (Ranked<String, RankedProduct> ranked : Ranker.topPerPartition(
                candidates, RankedProduct::group, RankedProduct::salesrank, Direction.ASCENDING, TOP_PER_GROUP)) {
            RankedProduct product = ranked.row();
            rows.add(Arrays.asList(product.asin(), product.group(), product.salesrank()));
        }
        return ResultProjector.project(rows, ReportColumns.SALES_RANK_PER_GROUP);
    }

    public TabularResult bestHelpfulnessProducts() throws QueryExecutionException {
        List<List<Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : executor.execute(QueryId.SELECT_PRODUCT_HELPFULNESS,
                List.of(PRODUCT_HELPFULNESS_LIMIT))) {
            rows.add(Arrays.asList(
                    RowValues.text(row, "asin"),
                    RowValues.decimal(row, "avg_helpful")));
        }
        return ResultProjector.project(rows, ReportColumns.PRODUCT_HELPFULNESS);
    }

    public TabularResult bestHelpfulnessCategories() throws QueryExecutionException {
        List<List<Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : executor.execute(QueryId.SELECT_CATEGORY_HELPFULNESS,
                List.of(CATEGORY_HELPFULNESS_LIMIT))) {
            rows.add(Arrays.asList(
                    RowValues.text(row, "category"),
                    RowValues.decimal(row, "avg_helpful")));
        }
        return ResultProjector.project(rows, ReportColumns.CATEGORY_HELPFULNESS);
    }

    public TabularResult mostActiveCustomersPerGroup() throws QueryExecutionException {
        List<CustomerActivity> candidates = new ArrayList<>();
        for (Map<String, Object> row : executor.execute(QueryId.SELECT_CUSTOMER_REVIEW_COUNTS, List.of())) {
            candidates.add(new CustomerActivity(
                    RowValues.text(row, "grp"),
                    RowValues.text(row, "customer"),
                    RowValues.count(row, "num_reviews")));
        }

        List<List<Object>> rows = new ArrayList<>();
        for (Ranked<String, CustomerActivity> ranked : Ranker.topPerPartition(
                candidates, CustomerActivity::group, CustomerActivity::reviews, Direction.DESCENDING, TOP_PER_GROUP)) {
            CustomerActivity activity = ranked.row();
            rows.add(Arrays.asList(activity.group(), activity.customer(), activity.reviews()));
        }
        return ResultProjector.project(rows, ReportColumns.CUSTOMER_ACTIVITY);
    }

    private record RankedProduct(String asin, String group, Integer salesrank) {
    }

    private record CustomerActivity(String group, String customer, Long reviews) {
    }
}
