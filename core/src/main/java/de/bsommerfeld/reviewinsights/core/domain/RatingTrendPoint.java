package de.bsommerfeld.reviewinsights.core.domain;

import java.time.LocalDate;

/**
 * One point of a product's daily rating trend: the mean rating of all reviews
 * written on {@code date}.
 */
public record RatingTrendPoint(LocalDate date, double averageRating) {
}
