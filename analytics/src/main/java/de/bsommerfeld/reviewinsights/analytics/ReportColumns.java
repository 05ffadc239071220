package de.bsommerfeld.reviewinsights.analytics;

import java.util.List;

/**
 * Column labels of every report. Renderers and {@link ChartSeries} look
 * values up by these labels, so renaming one means updating both sides.
 */
public final class ReportColumns {

    public static final String CUSTOMER = "Customer";
    public static final String RATING = "Rating";
    public static final String VOTES = "Votes";
    public static final String HELPFUL = "Helpful";
    public static final String ASIN = "ASIN";
    public static final String ASIN_SIMILAR = "ASIN Similar";
    public static final String SALESRANK = "Salesrank";
    public static final String DATE = "Date";
    public static final String AVERAGE_RATING = "Average Rating";
    public static final String GROUP = "Group";
    public static final String AVG_HELPFUL_VOTES = "Avg Helpful Votes";
    public static final String CATEGORY = "Category";
    public static final String NUM_COMMENTS = "Num Comments";

    public static final List<String> HELPFUL_REVIEWS = List.of(CUSTOMER, RATING, VOTES, HELPFUL);
    public static final List<String> SIMILAR_PRODUCTS = List.of(ASIN_SIMILAR, SALESRANK);
    public static final List<String> RATING_TREND = List.of(DATE, AVERAGE_RATING);
    public static final List<String> SALES_RANK_PER_GROUP = List.of(ASIN, GROUP, SALESRANK);
    public static final List<String> PRODUCT_HELPFULNESS = List.of(ASIN, AVG_HELPFUL_VOTES);
    public static final List<String> CATEGORY_HELPFULNESS = List.of(CATEGORY, AVG_HELPFUL_VOTES);
    public static final List<String> CUSTOMER_ACTIVITY = List.of(GROUP, CUSTOMER, NUM_COMMENTS);

    private ReportColumns() {
    }
}
