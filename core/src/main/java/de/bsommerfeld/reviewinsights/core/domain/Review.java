package de.bsommerfeld.reviewinsights.core.domain;

import java.time.LocalDate;

/**
 * A single customer review as stored in {@code review}.
 *
 * @param asin     reviewed product
 * @param customer reviewing customer's identifier
 * @param rating   star rating, 1 to 5
 * @param votes    total votes cast on the review
 * @param helpful  votes marking the review as helpful, never more than {@code votes}
 * @param date     day the review was written
 */
public record Review(String asin, String customer, int rating, int votes, int helpful, LocalDate date) {
}
