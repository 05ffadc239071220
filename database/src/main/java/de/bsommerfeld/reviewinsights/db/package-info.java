/**
 * Read-only access to the product/review dataset.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [analytics: QueryCatalog]
 *        │
 *        ▼
 *   RelationalExecutor        ← interface, the only fault surface of the reports
 *        │
 *        ▼
 *   JdbcRelationalExecutor    ← connection per call, SQL from sql/*.sql
 *    ┌───┴────────┐
 *    │            │
 *  PostgreSQL   SQLite (SampleDatabase, TEST mode / tests)
 * </pre>
 *
 * <h2>Dataset Layout</h2>
 *
 * <pre>
 * produto            (asin PK, grp, salesrank)          salesrank &lt;= 0 = unranked
 * review             (asin → produto, customer, rating 1..5, votes, helpful, dt)
 * categoria          (id_cat PK, description)
 * produto_categoria  (asin → produto, id_cat → categoria)
 * similare           (asin_product → produto, asin_similar)  directed edge
 * </pre>
 *
 * The table and column names belong to the existing dataset and are used
 * verbatim by every statement.
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code select-top-rated-reviews.sql} /
 * {@code select-low-rated-reviews.sql}: reviews of one product by rating, then helpful votes</li>
 * <li>{@code select-similar-cheaper-products.sql}: similarity edges to better
 * selling products</li>
 * <li>{@code select-daily-rating-averages.sql}: {@code AVG(rating)} per day</li>
 * <li>{@code select-ranked-products.sql}: per-group ranking candidates</li>
 * <li>{@code select-product-helpfulness.sql} /
 * {@code select-category-helpfulness.sql}: {@code AVG(helpful)} over
 * {@code helpful > 0}</li>
 * <li>{@code select-customer-review-counts.sql}: per-group ranking
 * candidates</li>
 * <li>{@code ping.sql}: connectivity check</li>
 * <li>{@code insert-*.sql}: TEST-mode seeding only</li>
 * </ul>
 */
package de.bsommerfeld.reviewinsights.db;
