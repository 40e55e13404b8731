package org.finos.legend.sqldialect.sql.ast;

import org.finos.legend.sqldialect.time.CanonicalFormat;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Represents an SQL expression.
 *
 * Expressions can be used in SELECT, WHERE, HAVING, ON, and other clauses.
 */
public sealed interface Expression extends SQLNode
        permits Expression.ColumnRef, Expression.Literal, Expression.BinaryOp,
        Expression.UnaryOp, Expression.FunctionCall, Expression.CaseExpr,
        Expression.ExistsExpr, Expression.InExpr, Expression.BetweenExpr,
        Expression.IsNullExpr, Expression.CastExpr, Expression.SubqueryExpr,
        Expression.JsonExtract, Expression.TemporalConversion, Expression.TimeFormatLiteral {

    // ==================== Factory Methods ====================

    static Expression.ColumnRef column(String name) {
        return new ColumnRef(null, name);
    }

    static Expression.ColumnRef column(String table, String name) {
        return new ColumnRef(table, name);
    }

    static Expression.Literal stringLiteral(String value) {
        return new Literal(LiteralType.STRING, value);
    }

    static Expression.Literal byteStringLiteral(String value) {
        return new Literal(LiteralType.BYTE_STRING, value);
    }

    static Expression.Literal intLiteral(long value) {
        return new Literal(LiteralType.INTEGER, value);
    }

    static Expression.Literal decimalLiteral(BigDecimal value) {
        return new Literal(LiteralType.DECIMAL, value);
    }

    static Expression.Literal boolLiteral(boolean value) {
        return new Literal(LiteralType.BOOLEAN, value);
    }

    static Expression.Literal nullLiteral() {
        return new Literal(LiteralType.NULL, null);
    }

    // ==================== AST Node Types ====================

    /**
     * Column reference: table.column or just column
     */
    record ColumnRef(String tableAlias, String columnName) implements Expression {
        public boolean isQualified() {
            return tableAlias != null;
        }
    }

    /**
     * Literal value: 'string', e'bytes', 123, 45.67, TRUE, NULL
     */
    record Literal(LiteralType type, Object value) implements Expression {
        public boolean isString() {
            return type == LiteralType.STRING;
        }
    }

    enum LiteralType {
        STRING, BYTE_STRING, INTEGER, DECIMAL, BOOLEAN, NULL
    }

    /**
     * Binary operation: left op right
     * e.g., a = 1, x + y, name LIKE '%test%'
     */
    record BinaryOp(Expression left, BinaryOperator operator, Expression right) implements Expression {
    }

    enum BinaryOperator {
        // Comparison
        EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">="),
        LIKE("LIKE"),

        // Logical
        AND("AND"), OR("OR"),

        // Arithmetic
        PLUS("+"), MINUS("-"), MULTIPLY("*"), DIVIDE("/"), INT_DIVIDE("DIV"), MODULO("%"),

        // String
        CONCAT("||");

        private final String sql;

        BinaryOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }
    }

    /**
     * Unary operation: op expr
     * e.g., NOT condition, -value
     */
    record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
    }

    enum UnaryOperator {
        NOT("NOT"), MINUS("-"), PLUS("+");

        private final String sql;

        UnaryOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }
    }

    /**
     * Function call: functionName(arg1, arg2, ...)
     * e.g., UPPER(name), COUNT(*), SUM(salary)
     */
    record FunctionCall(String functionName, List<Expression> arguments, boolean distinct) implements Expression {
        public static FunctionCall of(String name, Expression... args) {
            return new FunctionCall(name, List.of(args), false);
        }

        public static FunctionCall distinct(String name, Expression arg) {
            return new FunctionCall(name, List.of(arg), true);
        }
    }

    /**
     * CASE expression:
     * CASE WHEN cond1 THEN val1 WHEN cond2 THEN val2 ELSE default END
     */
    record CaseExpr(List<WhenClause> whenClauses, Expression elseExpr) implements Expression {
    }

    record WhenClause(Expression condition, Expression result) {
    }

    /**
     * EXISTS (subquery)
     */
    record ExistsExpr(SelectStatement subquery, boolean negated) implements Expression {
    }

    /**
     * expr IN (val1, val2, ...) or expr IN (subquery)
     */
    record InExpr(Expression expr, List<Expression> values, SelectStatement subquery, boolean negated)
            implements Expression {
        public boolean hasSubquery() {
            return subquery != null;
        }
    }

    /**
     * expr BETWEEN low AND high
     */
    record BetweenExpr(Expression expr, Expression low, Expression high, boolean negated) implements Expression {
    }

    /**
     * expr IS NULL or expr IS NOT NULL
     */
    record IsNullExpr(Expression expr, boolean negated) implements Expression {
    }

    /**
     * CAST(expr AS type), expr :> type, or the non-failing expr !:> type
     */
    record CastExpr(Expression expr, DataType type, boolean safe) implements Expression {
        public static CastExpr of(Expression expr, DataType type) {
            return new CastExpr(expr, type, false);
        }

        public static CastExpr tryCast(Expression expr, DataType type) {
            return new CastExpr(expr, type, true);
        }
    }

    /**
     * Subquery as expression: (SELECT ...)
     */
    record SubqueryExpr(SelectStatement subquery) implements Expression {
    }

    /**
     * Key lookup in a JSON value: col::key, col::$key, col::%key
     */
    record JsonExtract(Expression json, String key, JsonResult result) implements Expression {
    }

    enum JsonResult {
        JSON, STRING, DOUBLE
    }

    /**
     * A date/time conversion carrying a format argument.
     *
     * @param op     The kind of conversion
     * @param value  The value being parsed or formatted
     * @param format A {@link TimeFormatLiteral}, any other expression when the
     *               format is not a literal, or null when absent
     */
    record TemporalConversion(TemporalOp op, Expression value, Expression format) implements Expression {
        public TemporalConversion {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(value, "value");
        }

        public boolean hasFormat() {
            return format != null;
        }
    }

    /**
     * A literal date/time format, held in canonical form so it can be
     * written back in any dialect's vocabulary.
     */
    record TimeFormatLiteral(CanonicalFormat format) implements Expression {
        public TimeFormatLiteral {
            Objects.requireNonNull(format, "format");
        }
    }
}
