package de.bsommerfeld.sqlcontents.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Statement cache for the {@code sql/<name>.sql} classpath resources used by
 * the stores.
 *
 * <p>
 * Files may open with {@code --} comment lines describing their parameters;
 * those lines are dropped when the statement is loaded. Every file is read
 * once per JVM.
 *
 * @see SqlDatabase
 */
final class SqlLoader {

    private static final Map<String, String> STATEMENTS = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * @param name file stem, e.g. {@code insert-file}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, SqlLoader::read);
    }

    private static String read(String name) {
        String resource = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("SQL resource not found: " + resource);
            String raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return raw.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"))
                    .trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + resource, e);
        }
    }
}
