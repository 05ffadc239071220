package de.bsommerfeld.reviewinsights.analytics;

import java.util.List;

/**
 * The fixed set of reports. Each knows whether it needs an ASIN, which
 * columns it produces and whether a chart can be drawn from it.
 */
public enum ReportId {

    HELPFUL_REVIEWS_HIGHEST_RATED(true, false, ReportColumns.HELPFUL_REVIEWS),
    HELPFUL_REVIEWS_LOWEST_RATED(true, false, ReportColumns.HELPFUL_REVIEWS),
    SIMILAR_CHEAPER_PRODUCTS(true, false, ReportColumns.SIMILAR_PRODUCTS),
    DAILY_RATING_TREND(true, true, ReportColumns.RATING_TREND),
    TOP_SALES_RANK_PER_GROUP(false, true, ReportColumns.SALES_RANK_PER_GROUP),
    BEST_HELPFULNESS_PRODUCTS(false, false, ReportColumns.PRODUCT_HELPFULNESS),
    BEST_HELPFULNESS_CATEGORIES(false, false, ReportColumns.CATEGORY_HELPFULNESS),
    MOST_ACTIVE_CUSTOMERS_PER_GROUP(false, false, ReportColumns.CUSTOMER_ACTIVITY);

    private final boolean requiresAsin;
    private final boolean chartable;
    private final List<String> columns;

    ReportId(boolean requiresAsin, boolean chartable, List<String> columns) {
        this.requiresAsin = requiresAsin;
        this.chartable = chartable;
        this.columns = columns;
    }

    public boolean requiresAsin() {
        return requiresAsin;
    }

    public boolean isChartable() {
        return chartable;
    }

    public List<String> columns() {
        return columns;
    }
}
