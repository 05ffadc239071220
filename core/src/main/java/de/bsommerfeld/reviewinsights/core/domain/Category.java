package de.bsommerfeld.reviewinsights.core.domain;

/**
 * A product category as stored in {@code categoria}.
 */
public record Category(int id, String description) {
}
