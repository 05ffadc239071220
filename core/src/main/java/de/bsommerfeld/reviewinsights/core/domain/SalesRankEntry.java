package de.bsommerfeld.reviewinsights.core.domain;

/**
 * One bar of the grouped sales-rank chart.
 */
public record SalesRankEntry(String group, String asin, int salesrank) {
}
