package de.bsommerfeld.pseat.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classpath access to the store's SQL. Single statements live in
 * {@code sql/<operation>-<entity>.sql} (e.g. {@code insert-config.sql}) and
 * are cached after the first read. Multi-statement scripts such as
 * {@code schema.sql} live at the classpath root and are split into
 * statements on every call.
 *
 * @see SqlDatabaseService
 */
public final class SqlLoader {

    private static final Map<String, String> STATEMENTS = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement from {@code sql/<name>.sql}.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, n -> read("sql/" + n + ".sql"));
    }

    /**
     * Returns the statements of a script at {@code path}, in file order. Lines
     * starting with {@code --} are dropped and statements end at a semicolon
     * that closes its line.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    static List<String> loadScript(String path) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : read(path).split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("--"))
                continue;
            current.append(line).append('\n');
            if (trimmed.endsWith(";")) {
                addStatement(statements, current);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder buffer) {
        String sql = buffer.toString().trim();
        if (sql.endsWith(";"))
            sql = sql.substring(0, sql.length() - 1).trim();
        if (!sql.isEmpty())
            statements.add(sql);
        buffer.setLength(0);
    }

    private static String read(String path) {
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
