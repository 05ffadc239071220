package de.bsommerfeld.reviewinsights.core.domain;

import java.util.List;

/**
 * A complete, self-consistent copy of the dataset's five relations, used to
 * seed the TEST-mode database.
 */
public record SampleDataset(
        List<Product> products,
        List<Review> reviews,
        List<Category> categories,
        List<ProductCategory> productCategories,
        List<Similarity> similarities) {

    public SampleDataset {
        products = List.copyOf(products);
        reviews = List.copyOf(reviews);
        categories = List.copyOf(categories);
        productCategories = List.copyOf(productCategories);
        similarities = List.copyOf(similarities);
    }
}
