package de.bsommerfeld.reviewinsights.core.util;

import de.bsommerfeld.reviewinsights.core.domain.Category;
import de.bsommerfeld.reviewinsights.core.domain.Product;
import de.bsommerfeld.reviewinsights.core.domain.ProductCategory;
import de.bsommerfeld.reviewinsights.core.domain.Review;
import de.bsommerfeld.reviewinsights.core.domain.SampleDataset;
import de.bsommerfeld.reviewinsights.core.domain.Similarity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Generates a plausible product/review dataset for TEST mode, so every report
 * has something to show without access to the production store.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Products</strong>: ASINs {@code B000000001} upwards, spread over
 * five groups; roughly one in ten is unranked ({@code salesrank = 0}), the
 * rest have ranks 1 to 500000</li>
 * <li><strong>Reviews</strong>: 0 to 25 per product, dated within 60 days of
 * {@code 2005-01-01}, drawn from a pool of 40 customers so the customer
 * activity report has repeat reviewers; {@code helpful <= votes} and about a
 * third of the reviews have no helpful votes at all</li>
 * <li><strong>Categories</strong>: fixed pool, 1 to 3 per product</li>
 * <li><strong>Similarities</strong>: up to 5 outgoing edges per product, never
 * a self-edge</li>
 * </ul>
 *
 * <p>
 * Output depends only on the arguments: the same seed yields the same dataset.
 */
public final class SampleDataGenerator {

    private static final String[] GROUPS = { "Book", "DVD", "Music", "Toy", "Video" };

    private static final String[] CATEGORY_DESCRIPTIONS = { "Literature & Fiction", "Science", "Children's Books",
            "Rock", "Jazz", "Classical", "Action & Adventure", "Comedy", "Drama", "Games", "Education",
            "Health, Mind & Body" };

    private static final LocalDate FIRST_REVIEW_DAY = LocalDate.of(2005, 1, 1);
    private static final int CUSTOMER_POOL = 40;

    private SampleDataGenerator() {
    }

    public static SampleDataset generate(int productCount, long seed) {
        if (productCount < 0) {
            throw new IllegalArgumentException("productCount must not be negative: " + productCount);
        }
        Random rnd = new Random(seed);

        List<Product> products = new ArrayList<>(productCount);
        for (int i = 1; i <= productCount; i++) {
            String group = GROUPS[rnd.nextInt(GROUPS.length)];
            int salesrank = rnd.nextInt(10) == 0 ? 0 : 1 + rnd.nextInt(500_000);
            products.add(new Product(asin(i), group, salesrank));
        }

        List<Category> categories = new ArrayList<>();
        for (int i = 0; i < CATEGORY_DESCRIPTIONS.length; i++) {
            categories.add(new Category(i + 1, CATEGORY_DESCRIPTIONS[i]));
        }

        List<ProductCategory> memberships = new ArrayList<>();
        List<Review> reviews = new ArrayList<>();
        List<Similarity> similarities = new ArrayList<>();

        for (Product product : products) {
            Set<Integer> categoryIds = new HashSet<>();
            int categoryCount = 1 + rnd.nextInt(3);
            while (categoryIds.size() < categoryCount) {
                categoryIds.add(1 + rnd.nextInt(categories.size()));
            }
            categoryIds.stream().sorted()
                    .forEach(id -> memberships.add(new ProductCategory(product.asin(), id)));

            int reviewCount = rnd.nextInt(26);
            for (int r = 0; r < reviewCount; r++) {
                reviews.add(review(product.asin(), rnd));
            }

            if (productCount > 1) {
                Set<String> targets = new HashSet<>();
                int edgeCount = rnd.nextInt(Math.min(5, productCount - 1) + 1);
                while (targets.size() < edgeCount) {
                    String target = asin(1 + rnd.nextInt(productCount));
                    if (!target.equals(product.asin())) {
                        targets.add(target);
                    }
                }
                targets.stream().sorted()
                        .forEach(target -> similarities.add(new Similarity(product.asin(), target)));
            }
        }

        return new SampleDataset(products, reviews, categories, memberships, similarities);
    }

    private static Review review(String asin, Random rnd) {
        String customer = String.format("A%07d", 1 + rnd.nextInt(CUSTOMER_POOL));
        int rating = 1 + rnd.nextInt(5);
        int votes = rnd.nextInt(40);
        int helpful = rnd.nextInt(3) == 0 ? 0 : rnd.nextInt(votes + 1);
        LocalDate date = FIRST_REVIEW_DAY.plusDays(rnd.nextInt(60));
        return new Review(asin, customer, rating, votes, helpful, date);
    }

    private static String asin(int index) {
        return String.format("B%09d", index);
    }
}
