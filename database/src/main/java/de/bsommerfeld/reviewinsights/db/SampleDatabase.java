package de.bsommerfeld.reviewinsights.db;

import de.bsommerfeld.reviewinsights.core.domain.Category;
import de.bsommerfeld.reviewinsights.core.domain.Product;
import de.bsommerfeld.reviewinsights.core.domain.ProductCategory;
import de.bsommerfeld.reviewinsights.core.domain.Review;
import de.bsommerfeld.reviewinsights.core.domain.SampleDataset;
import de.bsommerfeld.reviewinsights.core.domain.Similarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A SQLite copy of the dataset layout, used in TEST mode and by integration
 * tests. {@link #create} applies {@code schema.sql}, {@link #seed} bulk-loads
 * a {@link SampleDataset}; afterwards the file is only ever read, through a
 * {@link JdbcRelationalExecutor} on {@link #jdbcUrl()}.
 *
 * <h3>Transaction boundaries</h3>
 * Schema application and seeding each run in one transaction with
 * rollback-on-failure, so a half-seeded database is never left behind.
 */
public final class SampleDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SampleDatabase.class);

    private final String jdbcUrl;

    private SampleDatabase(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * Creates (or opens) the SQLite file at {@code file} and applies the
     * schema. Tables that already exist are left untouched.
     */
    public static SampleDatabase create(Path file) throws SQLException {
        SampleDatabase db = new SampleDatabase("jdbc:sqlite:" + file.toAbsolutePath());
        try (Connection conn = db.getConnection()) {
            applySchema(conn);
        }
        LOG.info("Sample database ready at {}", file.toAbsolutePath());
        return db;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /** A read-side executor on this database. */
    public JdbcRelationalExecutor executor() {
        return new JdbcRelationalExecutor(jdbcUrl);
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    /**
     * Inserts every relation of {@code dataset}. Products and categories go
     * first so the join tables never reference missing rows.
     */
    public void seed(SampleDataset dataset) throws SQLException {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                insertProducts(conn, dataset);
                insertCategories(conn, dataset);
                insertProductCategories(conn, dataset);
                insertSimilarities(conn, dataset);
                insertReviews(conn, dataset);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        LOG.info("Seeded {} products, {} reviews, {} categories, {} similarities",
                dataset.products().size(), dataset.reviews().size(),
                dataset.categories().size(), dataset.similarities().size());
    }

    private static void applySchema(Connection conn) throws SQLException {
        String schemaSql = readSchema();
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                String statement = SqlLoader.stripComments(sql);
                if (!statement.isEmpty()) {
                    stmt.execute(statement);
                }
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    private static String readSchema() throws SQLException {
        try (InputStream in = SampleDatabase.class.getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null) {
                throw new IllegalStateException("schema.sql not found on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }
    }

    private void insertProducts(Connection conn, SampleDataset dataset) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-product"))) {
            for (Product p : dataset.products()) {
                ps.setString(1, p.asin());
                ps.setString(2, p.group());
                ps.setInt(3, p.salesrank());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertCategories(Connection conn, SampleDataset dataset) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-category"))) {
            for (Category c : dataset.categories()) {
                ps.setInt(1, c.id());
                ps.setString(2, c.description());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertProductCategories(Connection conn, SampleDataset dataset) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-product-category"))) {
            for (ProductCategory pc : dataset.productCategories()) {
                ps.setString(1, pc.asin());
                ps.setInt(2, pc.categoryId());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertSimilarities(Connection conn, SampleDataset dataset) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-similarity"))) {
            for (Similarity s : dataset.similarities()) {
                ps.setString(1, s.productAsin());
                ps.setString(2, s.similarAsin());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertReviews(Connection conn, SampleDataset dataset) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-review"))) {
            for (Review r : dataset.reviews()) {
                ps.setString(1, r.asin());
                ps.setString(2, r.customer());
                ps.setInt(3, r.rating());
                ps.setInt(4, r.votes());
                ps.setInt(5, r.helpful());
                ps.setString(6, r.date().toString());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }
}
