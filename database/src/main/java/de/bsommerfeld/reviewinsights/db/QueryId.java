package de.bsommerfeld.reviewinsights.db;

/**
 * Every statement the application may run. Each constant names one file under
 * {@code sql/} on the classpath, see {@link SqlLoader}.
 */
public enum QueryId {

    /** Reviews of one product, best rating first. Params: asin, limit. */
    SELECT_TOP_RATED_REVIEWS("select-top-rated-reviews"),

    /** Reviews of one product, worst rating first. Params: asin, limit. */
    SELECT_LOW_RATED_REVIEWS("select-low-rated-reviews"),

    /** Similar products with a better (lower) sales rank. Params: asin. */
    SELECT_SIMILAR_CHEAPER_PRODUCTS("select-similar-cheaper-products"),

    /** Mean rating per review date of one product. Params: asin. */
    SELECT_DAILY_RATING_AVERAGES("select-daily-rating-averages"),

    /** Ranked products ({@code salesrank > 0}), unranked order. No params. */
    SELECT_RANKED_PRODUCTS("select-ranked-products"),

    /** Mean helpful votes per product over helpful reviews. Params: limit. */
    SELECT_PRODUCT_HELPFULNESS("select-product-helpfulness"),

    /** Mean helpful votes per category over helpful reviews. Params: limit. */
    SELECT_CATEGORY_HELPFULNESS("select-category-helpfulness"),

    /** Review count per (group, customer), unranked order. No params. */
    SELECT_CUSTOMER_REVIEW_COUNTS("select-customer-review-counts"),

    /** Connectivity check. No params. */
    PING("ping");

    private final String resourceName;

    QueryId(String resourceName) {
        this.resourceName = resourceName;
    }

    /** File stem under {@code sql/}, without extension. */
    public String resourceName() {
        return resourceName;
    }
}
