package de.bsommerfeld.reviewinsights.core.domain;

/**
 * Directed similarity edge ({@code similare}): {@code similarAsin} is listed
 * as similar to {@code productAsin}. The reverse edge is not implied.
 */
public record Similarity(String productAsin, String similarAsin) {
}
