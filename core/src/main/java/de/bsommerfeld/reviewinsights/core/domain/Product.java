package de.bsommerfeld.reviewinsights.core.domain;

/**
 * A catalog product as stored in {@code produto}.
 *
 * @param asin      unique product identifier
 * @param group     category-group label (e.g. {@code Book}, {@code Music})
 * @param salesrank sales ranking; values {@code <= 0} mean "unranked"
 */
public record Product(String asin, String group, int salesrank) {

    /** Whether this product takes part in sales-rank rankings. */
    public boolean isRanked() {
        return salesrank > 0;
    }
}
