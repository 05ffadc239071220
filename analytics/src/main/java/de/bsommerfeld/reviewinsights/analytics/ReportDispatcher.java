package de.bsommerfeld.reviewinsights.analytics;

import com.google.inject.Singleton;
import de.bsommerfeld.reviewinsights.core.result.TabularResult;
import de.bsommerfeld.reviewinsights.db.ConnectionUnavailableException;
import de.bsommerfeld.reviewinsights.db.QueryExecutionException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes a {@link ReportId} to its {@link QueryCatalog} operation and folds
 * the outcome into a {@link ReportResult}.
 *
 * <p>
 * Failure handling:
 * <ul>
 * <li>{@link ConnectionUnavailableException} is rethrown. The session cannot
 * continue and an empty table must not be mistaken for "no data".</li>
 * <li>Any other {@link QueryExecutionException} becomes a
 * {@link ReportResult.Status#QUERY_FAILURE} result and a WARN log line with
 * report, parameter and cause. The next report runs normally.</li>
 * <li>A report that needs an ASIN but gets none fails the same way without
 * touching the store.</li>
 * </ul>
 */
@Singleton
public class ReportDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ReportDispatcher.class);

    @FunctionalInterface
    private interface CatalogEntry {
        TabularResult run(String asin) throws QueryExecutionException;
    }

    private final Map<ReportId, CatalogEntry> entries = new EnumMap<>(ReportId.class);

    @Inject
    public ReportDispatcher(QueryCatalog catalog) {
        entries.put(ReportId.HELPFUL_REVIEWS_HIGHEST_RATED, catalog::helpfulReviewsHighestRated);
        entries.put(ReportId.HELPFUL_REVIEWS_LOWEST_RATED, catalog::helpfulReviewsLowestRated);
        entries.put(ReportId.SIMILAR_CHEAPER_PRODUCTS, catalog::similarCheaperProducts);
        entries.put(ReportId.DAILY_RATING_TREND, catalog::dailyRatingTrend);
        entries.put(ReportId.TOP_SALES_RANK_PER_GROUP, asin -> catalog.topSalesRankPerGroup());
        entries.put(ReportId.BEST_HELPFULNESS_PRODUCTS, asin -> catalog.bestHelpfulnessProducts());
        entries.put(ReportId.BEST_HELPFULNESS_CATEGORIES, asin -> catalog.bestHelpfulnessCategories());
        entries.put(ReportId.MOST_ACTIVE_CUSTOMERS_PER_GROUP, asin -> catalog.mostActiveCustomersPerGroup());
    }

    /** Runs a report that takes no ASIN. */
    public ReportResult dispatch(ReportId reportId) throws ConnectionUnavailableException {
        return dispatch(reportId, null);
    }

    /**
     * Runs {@code reportId}. The ASIN is ignored by reports that do not take
     * one and trimmed for those that do.
     *
     * @throws ConnectionUnavailableException if the store is unreachable
     */
    public ReportResult dispatch(ReportId reportId, String asin) throws ConnectionUnavailableException {
        String parameter = null;
        if (reportId.requiresAsin()) {
            if (asin == null || asin.isBlank()) {
                LOG.warn("Report {} requested without an ASIN", reportId);
                return ReportResult.queryFailure(reportId, null, "Report " + reportId + " requires an ASIN");
            }
            parameter = asin.trim();
        }

        long start = System.nanoTime();
        try {
            TabularResult table = entries.get(reportId).run(parameter);
            LOG.debug("Report {} (asin={}) produced {} rows in {} ms", reportId, parameter, table.size(),
                    (System.nanoTime() - start) / 1_000_000);
            return ReportResult.success(reportId, parameter, table);
        } catch (ConnectionUnavailableException e) {
            LOG.error("Report {} (asin={}) aborted, store unavailable: {}", reportId, parameter, e.getMessage());
            throw e;
        } catch (QueryExecutionException e) {
            LOG.warn("Report {} (asin={}) failed: {}", reportId, parameter, e.getMessage(), e);
            return ReportResult.queryFailure(reportId, parameter, e.getMessage());
        }
    }
}
