package org.finos.legend.sqldialect.sql.ast;

/**
 * Represents items in the FROM clause.
 *
 * Supports:
 * - Simple table references: FROM table, FROM schema.table
 * - Table aliases: FROM table AS t
 * - Subqueries: FROM (SELECT ...) AS sub
 * - JOINs: FROM a JOIN b ON condition
 */
public sealed interface FromItem extends SQLNode
        permits FromItem.TableRef, FromItem.SubQuery, FromItem.JoinedTable {

    /**
     * Reference to a table: schema.table AS alias
     */
    record TableRef(String schema, String table, String alias) implements FromItem {
        public static TableRef of(String table) {
            return new TableRef(null, table, null);
        }

        public boolean hasSchema() {
            return schema != null;
        }

        public boolean hasAlias() {
            return alias != null;
        }
    }

    /**
     * Subquery in FROM: (SELECT ...) AS alias
     */
    record SubQuery(SelectStatement query, String alias) implements FromItem {
        public SubQuery {
            if (alias == null || alias.isBlank()) {
                throw new IllegalArgumentException("Subquery must have an alias");
            }
        }
    }

    /**
     * Joined tables: a JOIN b ON condition
     */
    record JoinedTable(FromItem left, JoinType joinType, FromItem right, Expression condition) implements FromItem {

        public enum JoinType {
            INNER("INNER JOIN"),
            LEFT_OUTER("LEFT OUTER JOIN"),
            RIGHT_OUTER("RIGHT OUTER JOIN"),
            FULL_OUTER("FULL OUTER JOIN"),
            CROSS("CROSS JOIN");

            private final String sql;

            JoinType(String sql) {
                this.sql = sql;
            }

            public String toSql() {
                return sql;
            }
        }
    }
}
