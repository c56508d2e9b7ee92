package de.bsommerfeld.wbm.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-tweet.sql}, {@code select-tweet-by-id.sql}.
 *
 * @see SqlTweetIndex
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath.
     * The result is trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, n -> readResource("sql/" + n + ".sql"));
    }

    /**
     * Returns the DDL from {@code schema.sql} at the classpath root. Not
     * cached; it is read once per database open.
     */
    public static String loadSchema() {
        return readResource("schema.sql");
    }

    /**
     * Splits a multi-statement script on statement-terminating semicolons.
     * Blank fragments are dropped.
     */
    public static List<String> statements(String script) {
        return Arrays.stream(script.split(";\\s*(\\r?\\n|$)"))
                .map(String::trim)
                .filter(sql -> !sql.isEmpty())
                .collect(Collectors.toList());
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
