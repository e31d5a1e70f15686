package com.funnelduck.generator;

import java.util.Locale;
import java.util.Set;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Request values never reach SQL text: they are bound as parameters. Quoting
 * covers identifiers (column aliases such as {@code $session_id_1}, table names
 * from configuration) and the few literals the compiler chooses itself, such as
 * JSON paths built from property keys.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("latest_0");      // latest_0
 *   SQLQuoting.quoteIdentifierIfNeeded("timestamp");     // "timestamp"
 *   SQLQuoting.quoteIdentifierIfNeeded("$group_0");      // "$group_0"
 *   SQLQuoting.quoteLiteral("O'Reilly");                 // 'O''Reilly'
 * </pre>
 */
public final class SQLQuoting {

    private static final Set<String> RESERVED_WORDS = Set.of(
        "SELECT", "FROM", "WHERE", "GROUP", "BY", "ORDER", "HAVING",
        "JOIN", "LEFT", "RIGHT", "INNER", "OUTER", "FULL", "CROSS", "ON", "USING",
        "AS", "AND", "OR", "NOT", "IN", "EXISTS",
        "CASE", "WHEN", "THEN", "ELSE", "END",
        "NULL", "TRUE", "FALSE",
        "UNION", "INTERSECT", "EXCEPT", "LIMIT", "OFFSET", "ALL", "DISTINCT",
        "IS", "BETWEEN", "LIKE", "ILIKE", "ASC", "DESC", "NULLS", "FIRST", "LAST",
        "OVER", "PARTITION", "ROWS", "WINDOW", "INTERVAL", "TIMESTAMP", "DEFAULT");

    private SQLQuoting() {
    }

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes an identifier only if needed.
     *
     * <p>Simple identifiers that follow standard naming conventions and are not
     * reserved words are left bare, which keeps the generated SQL readable.
     *
     * @param identifier the identifier to conditionally quote
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier) : identifier;
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Uses single quotes and escapes internal quotes according to SQL standard.
     * Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Builds a JSON path selecting a top-level key, e.g. {@code $."$browser"}.
     *
     * <p>The key is always quoted so that keys containing dots, dollars or spaces
     * select the literal key rather than a nested path.
     *
     * @param key the property key
     * @return the JSON path (not yet a SQL literal)
     */
    public static String jsonKeyPath(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Property key cannot be null or empty");
        }
        return "$.\"" + key.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return true;
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!(c < 128 && (Character.isLetterOrDigit(c) || c == '_'))) {
                return true;
            }
        }
        return RESERVED_WORDS.contains(identifier.toUpperCase(Locale.ROOT));
    }
}
