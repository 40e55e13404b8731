package org.finos.legend.sqldialect.sql.ast;

/**
 * ORDER BY specification: expr [ASC|DESC] [NULLS FIRST|LAST], or
 * ORDER BY ALL [ASC|DESC] when {@code expression} is null.
 */
public record OrderSpec(
        Expression expression,
        Direction direction,
        NullsOrder nullsOrder) implements SQLNode {

    public enum Direction {
        ASC, DESC
    }

    public enum NullsOrder {
        NULLS_FIRST, NULLS_LAST, DEFAULT
    }

    public static OrderSpec asc(Expression expr) {
        return new OrderSpec(expr, Direction.ASC, NullsOrder.DEFAULT);
    }

    public static OrderSpec desc(Expression expr) {
        return new OrderSpec(expr, Direction.DESC, NullsOrder.DEFAULT);
    }

    /**
     * ORDER BY ALL: order by every projected column, left to right.
     */
    public static OrderSpec all(Direction direction) {
        return new OrderSpec(null, direction, NullsOrder.DEFAULT);
    }

    public boolean isAll() {
        return expression == null;
    }
}
