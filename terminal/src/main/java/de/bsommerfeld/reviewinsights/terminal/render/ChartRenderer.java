package de.bsommerfeld.reviewinsights.terminal.render;

import de.bsommerfeld.reviewinsights.core.domain.RatingTrendPoint;
import de.bsommerfeld.reviewinsights.core.domain.SalesRankEntry;

import java.util.List;

/**
 * Draws the two chartable reports. Implementations return the finished
 * drawing; printing it is the caller's business.
 */
public interface ChartRenderer {

    /** Line chart of a product's daily mean rating. */
    String renderRatingTrend(String asin, List<RatingTrendPoint> points);

    /** Horizontal bars of the best-selling products, grouped by product group. */
    String renderSalesRankByGroup(List<SalesRankEntry> entries);
}
