package de.bsommerfeld.reviewinsights.core.domain;

/**
 * Membership of a product in a category ({@code produto_categoria}).
 */
public record ProductCategory(String asin, int categoryId) {
}
