package org.finos.legend.sqldialect.sql.ast;

import java.util.List;

/**
 * Represents a SQL SELECT statement.
 *
 * @param distinct    Whether DISTINCT was specified
 * @param selectItems The projection list (may contain * for all columns)
 * @param from        The FROM clause items, empty for SELECT without FROM
 * @param where       Optional WHERE condition
 * @param groupBy     Optional GROUP BY columns
 * @param having      Optional HAVING condition
 * @param orderBy     Optional ORDER BY specifications
 * @param limit       Optional LIMIT value, an unsigned 64-bit count
 * @param offset      Optional OFFSET value, an unsigned 64-bit count
 */
public record SelectStatement(
        boolean distinct,
        List<SelectItem> selectItems,
        List<FromItem> from,
        Expression where,
        List<Expression> groupBy,
        Expression having,
        List<OrderSpec> orderBy,
        Long limit,
        Long offset) implements SQLNode {

    /**
     * Creates a simple SELECT statement with just projections and FROM.
     */
    public static SelectStatement simple(List<SelectItem> items, List<FromItem> from) {
        return new SelectStatement(false, items, from, null, List.of(), null, List.of(), null, null);
    }

    public boolean hasFrom() {
        return from != null && !from.isEmpty();
    }

    public boolean hasWhere() {
        return where != null;
    }

    public boolean hasGroupBy() {
        return groupBy != null && !groupBy.isEmpty();
    }

    public boolean hasHaving() {
        return having != null;
    }

    public boolean hasOrderBy() {
        return orderBy != null && !orderBy.isEmpty();
    }

    public boolean hasLimit() {
        return limit != null;
    }

    public boolean hasOffset() {
        return offset != null;
    }
}
