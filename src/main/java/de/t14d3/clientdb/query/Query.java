package de.t14d3.clientdb.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SQL statement builder for the cache tables.
 * Identifiers are quoted through the {@link Dialect}; values are always bound as parameters.
 */
public class Query {
    private final String sql;
    private final List<Object> parameters;

    private Query(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = new ArrayList<>(parameters);
    }

    /**
     * Wrap a literal statement, mostly DDL.
     */
    public static Query of(String sql, Object... parameters) {
        return new Query(sql, Arrays.asList(parameters));
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return new ArrayList<>(parameters);
    }

    public static SelectBuilder select(Dialect dialect, String... columns) {
        return new SelectBuilder(dialect).select(columns);
    }

    public static InsertBuilder insertInto(Dialect dialect, String table) {
        return new InsertBuilder(dialect).into(table);
    }

    public static UpdateBuilder update(Dialect dialect, String table) {
        return new UpdateBuilder(dialect).table(table);
    }

    public static DeleteBuilder deleteFrom(Dialect dialect, String table) {
        return new DeleteBuilder(dialect).from(table);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }

    /**
     * Shared WHERE handling; conditions are joined with AND.
     */
    abstract static class FilteredBuilder<B extends FilteredBuilder<B>> {
        protected final Dialect dialect;
        protected final StringBuilder whereClause = new StringBuilder();
        protected final List<Object> whereParameters = new ArrayList<>();

        FilteredBuilder(Dialect dialect) {
            this.dialect = dialect;
        }

        protected abstract B self();

        public B where(String condition, Object... params) {
            if (!whereClause.isEmpty()) {
                whereClause.append(" AND ");
            }
            whereClause.append(condition);
            if (params != null && params.length > 0) {
                whereParameters.addAll(Arrays.asList(params));
            }
            return self();
        }

        /**
         * {@code column = ?} with the column quoted for the dialect.
         */
        public B whereEquals(String column, Object value) {
            return where(dialect.quoteIdentifier(column) + " = ?", value);
        }

        /**
         * {@code column NOT IN (?, ...)}; a no-op for an empty collection.
         */
        public B whereNotIn(String column, Collection<?> values) {
            if (values == null || values.isEmpty()) {
                return self();
            }
            String placeholders = values.stream().map(v -> "?").collect(Collectors.joining(", "));
            return where(dialect.quoteIdentifier(column) + " NOT IN (" + placeholders + ")", values.toArray());
        }

        protected void appendWhere(StringBuilder sql) {
            if (!whereClause.isEmpty()) {
                sql.append(" WHERE ").append(whereClause);
            }
        }
    }

    // ========================================================================
    // SELECT QUERY BUILDER
    // ========================================================================

    public static class SelectBuilder extends FilteredBuilder<SelectBuilder> {
        private final List<String> columns = new ArrayList<>();
        private String fromTable;
        private String groupBy;
        private String limit;

        public SelectBuilder(Dialect dialect) {
            super(dialect);
        }

        @Override
        protected SelectBuilder self() {
            return this;
        }

        public SelectBuilder select(String... columns) {
            this.columns.addAll(Arrays.asList(columns));
            return this;
        }

        public SelectBuilder from(String table) {
            this.fromTable = table;
            return this;
        }

        public SelectBuilder groupBy(String column) {
            this.groupBy = column;
            return this;
        }

        public SelectBuilder limit(String limit) {
            this.limit = limit;
            return this;
        }

        public Query build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("SELECT query must specify columns");
            }
            if (fromTable == null) {
                throw new IllegalStateException("SELECT query must specify a table");
            }

            StringBuilder sql = new StringBuilder("SELECT ");
            sql.append(columns.stream().map(this::quoteColumn).collect(Collectors.joining(", ")));
            sql.append(" FROM ").append(dialect.quoteIdentifier(fromTable));
            appendWhere(sql);

            if (groupBy != null && !groupBy.trim().isEmpty()) {
                sql.append(" GROUP BY ").append(quoteColumn(groupBy));
            }

            if (limit != null && !limit.trim().isEmpty()) {
                sql.append(" LIMIT ").append(limit);
            }

            return new Query(sql.toString(), whereParameters);
        }

        private String quoteColumn(String col) {
            if (col == null) return "";
            String trimmed = col.trim();
            // wildcards, function calls and aliased expressions are left as-is
            if ("*".equals(trimmed) || trimmed.contains("(") || trimmed.toUpperCase().contains(" AS ")) {
                return trimmed;
            }
            return dialect.quoteIdentifier(trimmed);
        }
    }

    // ========================================================================
    // INSERT QUERY BUILDER
    // ========================================================================

    public static class InsertBuilder {
        private final Dialect dialect;
        private String table;
        private final List<String> columns = new ArrayList<>();
        private final List<Object> parameters = new ArrayList<>();

        public InsertBuilder(Dialect dialect) {
            this.dialect = dialect;
        }

        public InsertBuilder into(String table) {
            this.table = table;
            return this;
        }

        public InsertBuilder columns(String... columns) {
            if (columns == null || columns.length == 0) {
                throw new IllegalArgumentException("columns must not be null or empty");
            }
            this.columns.clear();
            this.columns.addAll(Arrays.asList(columns));
            return this;
        }

        public InsertBuilder values(Object... values) {
            if (values == null) {
                throw new IllegalArgumentException("values must not be null");
            }
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Number of values must match number of columns");
            }
            parameters.addAll(Arrays.asList(values));
            return this;
        }

        public Query build() {
            if (table == null) {
                throw new IllegalStateException("INSERT query must specify a table");
            }
            if (columns.isEmpty()) {
                throw new IllegalStateException("INSERT query must specify columns");
            }
            if (parameters.isEmpty()) {
                throw new IllegalStateException("INSERT query must specify values");
            }

            String sql = "INSERT INTO " + dialect.quoteIdentifier(table) +
                    " (" + columns.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", ")) +
                    ") VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
            return new Query(sql, parameters);
        }
    }

    // ========================================================================
    // UPDATE QUERY BUILDER
    // ========================================================================

    public static class UpdateBuilder extends FilteredBuilder<UpdateBuilder> {
        private String table;
        private final StringBuilder setClause = new StringBuilder();
        private final List<Object> setParameters = new ArrayList<>();

        public UpdateBuilder(Dialect dialect) {
            super(dialect);
        }

        @Override
        protected UpdateBuilder self() {
            return this;
        }

        public UpdateBuilder table(String table) {
            this.table = table;
            return this;
        }

        public UpdateBuilder set(String column, Object value) {
            if (!setClause.isEmpty()) {
                setClause.append(", ");
            }
            setClause.append(dialect.quoteIdentifier(column)).append(" = ?");
            setParameters.add(value);
            return this;
        }

        public Query build() {
            if (table == null) {
                throw new IllegalStateException("UPDATE query must specify a table");
            }
            if (setParameters.isEmpty()) {
                throw new IllegalStateException("UPDATE query must specify at least one SET clause");
            }

            StringBuilder sql = new StringBuilder("UPDATE ");
            sql.append(dialect.quoteIdentifier(table));
            sql.append(" SET ").append(setClause);
            appendWhere(sql);

            List<Object> parameters = new ArrayList<>(setParameters);
            parameters.addAll(whereParameters);
            return new Query(sql.toString(), parameters);
        }
    }

    // ========================================================================
    // DELETE QUERY BUILDER
    // ========================================================================

    public static class DeleteBuilder extends FilteredBuilder<DeleteBuilder> {
        private String table;

        public DeleteBuilder(Dialect dialect) {
            super(dialect);
        }

        @Override
        protected DeleteBuilder self() {
            return this;
        }

        public DeleteBuilder from(String table) {
            this.table = table;
            return this;
        }

        public Query build() {
            if (table == null) {
                throw new IllegalStateException("DELETE query must specify a table");
            }

            StringBuilder sql = new StringBuilder("DELETE FROM ");
            sql.append(dialect.quoteIdentifier(table));
            appendWhere(sql);

            return new Query(sql.toString(), whereParameters);
        }
    }
}
