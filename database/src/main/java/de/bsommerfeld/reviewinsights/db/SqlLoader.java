package de.bsommerfeld.reviewinsights.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads SQL statements from classpath resources under {@code sql/}, one
 * statement per file, named after {@link QueryId#resourceName()} (e.g.
 * {@code sql/select-ranked-products.sql}).
 *
 * <p>
 * Full-line {@code --} comments are stripped so files can document
 * themselves; the remaining text is trimmed and cached for the lifetime of
 * the JVM.
 */
public final class SqlLoader {

    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /** The statement for a catalog query. */
    public static String load(QueryId queryId) {
        return load(queryId.resourceName());
    }

    /**
     * The statement in {@code sql/<name>.sql}.
     *
     * @throws IllegalStateException if the resource is missing, unreadable or empty
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            String sql = stripComments(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            if (sql.isEmpty()) {
                throw new IllegalStateException("SQL resource is empty: " + path);
            }
            return sql;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }

    static String stripComments(String sql) {
        return sql.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"))
                .trim();
    }
}
