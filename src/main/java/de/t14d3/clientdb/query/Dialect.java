package de.t14d3.clientdb.query;

/**
 * SQL database dialects for identifier quoting, payload column types and the few
 * vendor-specific statements the cache store needs.
 */
public enum Dialect {
    GENERIC,
    MYSQL,
    POSTGRESQL,
    SQLITE,
    H2;

    /**
     * Quote an identifier based on the dialect.
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.trim().isEmpty()) {
            return identifier;
        }

        return switch (this) {
            case MYSQL -> "`" + identifier.replace("`", "``") + "`";
            case POSTGRESQL, SQLITE -> "\"" + identifier.replace("\"", "\"\"") + "\"";
            case H2 -> ("\"" + identifier.replace("\"", "\"\"") + "\"").toUpperCase();
            default ->
                // No quoting for generic
                    identifier;
        };
    }

    /**
     * Column type used for serialized JSON payloads and setting values.
     */
    public String textType() {
        return switch (this) {
            case MYSQL -> "LONGTEXT";
            case H2 -> "CLOB";
            default -> "TEXT";
        };
    }

    /**
     * SQL text expression reading a top-level field out of a JSON text column, or {@code null}
     * when the dialect has no JSON functions and the caller must filter rows itself.
     */
    public String jsonFieldExpression(String column, String field) {
        if (!isPlainFieldName(field)) {
            return null;
        }
        String quoted = quoteIdentifier(column);
        return switch (this) {
            case SQLITE -> "CAST(json_extract(" + quoted + ", '$." + field + "') AS TEXT)";
            case MYSQL -> "JSON_UNQUOTE(JSON_EXTRACT(" + quoted + ", '$." + field + "'))";
            case POSTGRESQL -> "(" + quoted + "::json ->> '" + field + "')";
            default -> null;
        };
    }

    /**
     * Statement that gives freed pages back to the file system after a full wipe, or
     * {@code null} if the dialect has none. Must run outside a transaction.
     */
    public String compactStatement(String table) {
        return switch (this) {
            case SQLITE, POSTGRESQL -> "VACUUM";
            case H2 -> "CHECKPOINT";
            case MYSQL -> "OPTIMIZE TABLE " + quoteIdentifier(table);
            default -> null;
        };
    }

    /**
     * Detect dialect from JDBC URL.
     */
    public static Dialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) return GENERIC;

        String lowerUrl = jdbcUrl.toLowerCase();
        if (lowerUrl.contains("mysql")) return MYSQL;
        if (lowerUrl.contains("postgresql") || lowerUrl.contains("postgres")) return POSTGRESQL;
        if (lowerUrl.contains("sqlite")) return SQLITE;
        if (lowerUrl.contains("h2")) return H2;

        return GENERIC;
    }

    private static boolean isPlainFieldName(String field) {
        if (field == null || field.isEmpty()) {
            return false;
        }
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }
}
