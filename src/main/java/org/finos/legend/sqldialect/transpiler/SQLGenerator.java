package org.finos.legend.sqldialect.transpiler;

import org.finos.legend.sqldialect.sql.ast.Expression;
import org.finos.legend.sqldialect.sql.ast.FromItem;
import org.finos.legend.sqldialect.sql.ast.OrderSpec;
import org.finos.legend.sqldialect.sql.ast.SelectItem;
import org.finos.legend.sqldialect.sql.ast.SelectStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a parsed SELECT statement as SQL text for a target dialect.
 *
 * Date/time conversions are rewritten through the target's
 * {@link TemporalRewrites}, so a format decoded from one dialect's tokens
 * comes out in the target's tokens. Constructs the target cannot express are
 * handled per {@link GeneratorOptions#unsupportedLevel()}.
 */
public final class SQLGenerator {

    private static final Logger log = LoggerFactory.getLogger(SQLGenerator.class);

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    // Binding strength, loosest first
    private static final int PREC_OR = 1;
    private static final int PREC_AND = 2;
    private static final int PREC_NOT = 3;
    private static final int PREC_COMPARISON = 4;
    private static final int PREC_ADDITIVE = 5;
    private static final int PREC_MULTIPLICATIVE = 6;
    private static final int PREC_UNARY = 7;
    private static final int PREC_ATOM = 8;

    private final SQLDialect dialect;
    private final GeneratorOptions options;

    public SQLGenerator(SQLDialect dialect) {
        this(dialect, GeneratorOptions.DEFAULT);
    }

    public SQLGenerator(SQLDialect dialect, GeneratorOptions options) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    /**
     * Generates SQL for a statement.
     *
     * @throws UnsupportedSyntaxException when the dialect cannot express a
     *         construct and the options say to raise
     * @throws org.finos.legend.sqldialect.time.UnmappedDirectiveException when a
     *         date/time format uses a directive the dialect has no token for
     */
    public String generate(SelectStatement statement) {
        var sb = new StringBuilder("SELECT ");
        if (statement.distinct()) {
            sb.append("DISTINCT ");
        }
        sb.append(statement.selectItems().stream()
                .map(this::generateSelectItem)
                .collect(Collectors.joining(", ")));

        if (statement.hasFrom()) {
            sb.append(" FROM ");
            sb.append(statement.from().stream()
                    .map(this::generateFromItem)
                    .collect(Collectors.joining(", ")));
        }
        if (statement.hasWhere()) {
            sb.append(" WHERE ").append(generateExpression(statement.where()));
        }
        if (statement.hasGroupBy()) {
            sb.append(" GROUP BY ");
            sb.append(statement.groupBy().stream()
                    .map(this::generateExpression)
                    .collect(Collectors.joining(", ")));
        }
        if (statement.hasHaving()) {
            sb.append(" HAVING ").append(generateExpression(statement.having()));
        }
        if (statement.hasOrderBy()) {
            sb.append(" ORDER BY ");
            sb.append(statement.orderBy().stream()
                    .map(this::generateOrderSpec)
                    .collect(Collectors.joining(", ")));
        }
        if (statement.hasLimit()) {
            sb.append(" LIMIT ").append(Long.toUnsignedString(statement.limit()));
        } else if (statement.hasOffset() && dialect.unboundedLimit() != null) {
            sb.append(" LIMIT ").append(dialect.unboundedLimit());
        }
        if (statement.hasOffset()) {
            sb.append(" OFFSET ").append(Long.toUnsignedString(statement.offset()));
        }
        return sb.toString();
    }

    /**
     * Generates SQL for a single expression.
     */
    public String generateExpression(Expression expression) {
        if (expression instanceof Expression.ColumnRef col) {
            return generateColumnRef(col);
        }
        if (expression instanceof Expression.Literal lit) {
            return generateLiteral(lit);
        }
        if (expression instanceof Expression.BinaryOp op) {
            return generateBinaryOp(op);
        }
        if (expression instanceof Expression.UnaryOp op) {
            return generateUnaryOp(op);
        }
        if (expression instanceof Expression.FunctionCall fn) {
            return generateFunctionCall(fn);
        }
        if (expression instanceof Expression.CaseExpr caseExpr) {
            return generateCase(caseExpr);
        }
        if (expression instanceof Expression.ExistsExpr exists) {
            return (exists.negated() ? "NOT EXISTS (" : "EXISTS (") + generate(exists.subquery()) + ")";
        }
        if (expression instanceof Expression.InExpr in) {
            return generateIn(in);
        }
        if (expression instanceof Expression.BetweenExpr between) {
            return operand(between.expr(), PREC_COMPARISON)
                    + (between.negated() ? " NOT BETWEEN " : " BETWEEN ")
                    + operand(between.low(), PREC_COMPARISON) + " AND " + operand(between.high(), PREC_COMPARISON);
        }
        if (expression instanceof Expression.IsNullExpr isNull) {
            return operand(isNull.expr(), PREC_COMPARISON) + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
        }
        if (expression instanceof Expression.CastExpr cast) {
            return generateCast(cast);
        }
        if (expression instanceof Expression.SubqueryExpr sub) {
            return "(" + generate(sub.subquery()) + ")";
        }
        if (expression instanceof Expression.JsonExtract json) {
            return dialect.formatJsonExtract(operand(json.json(), PREC_ATOM), json.key(), json.result());
        }
        if (expression instanceof Expression.TemporalConversion conversion) {
            return generateFunctionCall(dialect.temporalRewrites().toFunctionCall(conversion));
        }
        if (expression instanceof Expression.TimeFormatLiteral format) {
            // Only reached outside a conversion; emit the canonical form
            return dialect.quoteStringLiteral(format.format().toString());
        }
        throw new IllegalArgumentException("Unknown expression type: " + expression.getClass().getSimpleName());
    }

    // ==================== Clauses ====================

    private String generateSelectItem(SelectItem item) {
        if (item instanceof SelectItem.AllColumns all) {
            return all.isQualified() ? identifier(all.tableQualifier()) + ".*" : "*";
        }
        SelectItem.ExpressionItem expr = (SelectItem.ExpressionItem) item;
        String sql = generateExpression(expr.expression());
        return expr.hasAlias() ? sql + " AS " + identifier(expr.alias()) : sql;
    }

    private String generateFromItem(FromItem item) {
        if (item instanceof FromItem.TableRef table) {
            String sql = table.hasSchema()
                    ? identifier(table.schema()) + "." + identifier(table.table())
                    : identifier(table.table());
            return table.hasAlias() ? sql + " AS " + identifier(table.alias()) : sql;
        }
        if (item instanceof FromItem.SubQuery sub) {
            return "(" + generate(sub.query()) + ") AS " + identifier(sub.alias());
        }
        FromItem.JoinedTable join = (FromItem.JoinedTable) item;
        String sql = generateFromItem(join.left()) + " " + join.joinType().toSql() + " " + generateFromItem(join.right());
        if (join.condition() != null) {
            sql += " ON " + generateExpression(join.condition());
        }
        return sql;
    }

    private String generateOrderSpec(OrderSpec spec) {
        String sql;
        if (spec.isAll()) {
            if (!dialect.supportsOrderByAll()) {
                unsupported("ORDER BY ALL");
            }
            sql = "ALL";
        } else {
            sql = generateExpression(spec.expression());
        }
        if (spec.direction() == OrderSpec.Direction.DESC) {
            sql += " DESC";
        }
        if (spec.nullsOrder() != OrderSpec.NullsOrder.DEFAULT && !dialect.supportsNullsOrdering()) {
            // Dropped: the dialect has no syntax for it
            unsupported("NULLS FIRST/LAST");
            return sql;
        }
        switch (spec.nullsOrder()) {
            case NULLS_FIRST -> sql += " NULLS FIRST";
            case NULLS_LAST -> sql += " NULLS LAST";
            case DEFAULT -> {
            }
        }
        return sql;
    }

    // ==================== Expressions ====================

    private String generateColumnRef(Expression.ColumnRef col) {
        // COUNT(*) argument
        if ("*".equals(col.columnName())) {
            return "*";
        }
        if (col.isQualified()) {
            return identifier(col.tableAlias()) + "." + identifier(col.columnName());
        }
        return identifier(col.columnName());
    }

    private String generateLiteral(Expression.Literal literal) {
        return switch (literal.type()) {
            case STRING -> dialect.quoteStringLiteral((String) literal.value());
            case BYTE_STRING -> dialect.formatByteString((String) literal.value());
            case INTEGER -> String.valueOf(literal.value());
            case DECIMAL -> ((BigDecimal) literal.value()).toPlainString();
            case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
            case NULL -> dialect.formatNull();
        };
    }

    private String generateBinaryOp(Expression.BinaryOp op) {
        int prec = precedence(op);
        // Comparisons do not chain, so an equal-strength child needs parentheses on either side
        String left = prec == PREC_COMPARISON ? operandStrict(op.left(), prec) : operand(op.left(), prec);
        String right = operandStrict(op.right(), prec);
        if (op.operator() == Expression.BinaryOperator.CONCAT) {
            return dialect.formatConcat(left, right);
        }
        return left + " " + op.operator().toSql() + " " + right;
    }

    private String generateUnaryOp(Expression.UnaryOp op) {
        if (op.operator() == Expression.UnaryOperator.NOT) {
            return "NOT " + operand(op.operand(), PREC_NOT);
        }
        String inner = operand(op.operand(), PREC_UNARY);
        // Keep "- -x" from becoming a comment marker
        String sep = inner.startsWith("-") || inner.startsWith("+") ? " " : "";
        return op.operator().toSql() + sep + inner;
    }

    private String generateFunctionCall(Expression.FunctionCall fn) {
        String args = fn.arguments().stream()
                .map(this::generateExpression)
                .collect(Collectors.joining(", "));
        return fn.functionName() + "(" + (fn.distinct() ? "DISTINCT " : "") + args + ")";
    }

    private String generateCase(Expression.CaseExpr caseExpr) {
        var sb = new StringBuilder("CASE");
        for (Expression.WhenClause when : caseExpr.whenClauses()) {
            sb.append(" WHEN ").append(generateExpression(when.condition()));
            sb.append(" THEN ").append(generateExpression(when.result()));
        }
        if (caseExpr.elseExpr() != null) {
            sb.append(" ELSE ").append(generateExpression(caseExpr.elseExpr()));
        }
        sb.append(" END");
        return sb.toString();
    }

    private String generateIn(Expression.InExpr in) {
        String values = in.hasSubquery()
                ? generate(in.subquery())
                : in.values().stream().map(this::generateExpression).collect(Collectors.joining(", "));
        return operand(in.expr(), PREC_COMPARISON) + (in.negated() ? " NOT IN (" : " IN (") + values + ")";
    }

    private String generateCast(Expression.CastExpr cast) {
        String type = dialect.formatCastType(cast.type());
        if (cast.safe()) {
            if (dialect.supportsTryCast()) {
                return dialect.formatTryCast(operand(cast.expr(), PREC_ATOM), type);
            }
            unsupported("TRY_CAST");
        }
        return "CAST(" + generateExpression(cast.expr()) + " AS " + type + ")";
    }

    // ==================== Helpers ====================

    /**
     * Quotes an identifier when asked to, when it is a reserved word, or when
     * it is not a plain identifier.
     */
    String identifier(String name) {
        if (options.identify() || dialect.isReservedKeyword(name) || !SAFE_IDENTIFIER.matcher(name).matches()) {
            return dialect.quoteIdentifier(name);
        }
        return name;
    }

    private String operand(Expression expr, int parentPrecedence) {
        String sql = generateExpression(expr);
        return precedence(expr) < parentPrecedence ? "(" + sql + ")" : sql;
    }

    private String operandStrict(Expression expr, int parentPrecedence) {
        String sql = generateExpression(expr);
        return precedence(expr) <= parentPrecedence ? "(" + sql + ")" : sql;
    }

    private static int precedence(Expression expr) {
        if (expr instanceof Expression.BinaryOp op) {
            return switch (op.operator()) {
                case OR -> PREC_OR;
                case AND -> PREC_AND;
                case EQ, NE, LT, LE, GT, GE, LIKE -> PREC_COMPARISON;
                case PLUS, MINUS, CONCAT -> PREC_ADDITIVE;
                case MULTIPLY, DIVIDE, INT_DIVIDE, MODULO -> PREC_MULTIPLICATIVE;
            };
        }
        if (expr instanceof Expression.UnaryOp op) {
            return op.operator() == Expression.UnaryOperator.NOT ? PREC_NOT : PREC_UNARY;
        }
        if (expr instanceof Expression.InExpr || expr instanceof Expression.BetweenExpr
                || expr instanceof Expression.IsNullExpr) {
            return PREC_COMPARISON;
        }
        if (expr instanceof Expression.Literal lit && lit.value() instanceof Number n && isNegative(n)) {
            return PREC_UNARY;
        }
        return PREC_ATOM;
    }

    private static boolean isNegative(Number n) {
        return n instanceof BigDecimal d ? d.signum() < 0 : n.longValue() < 0;
    }

    private void unsupported(String construct) {
        String message = construct + " is not supported by " + dialect.name();
        switch (options.unsupportedLevel()) {
            case RAISE -> throw new UnsupportedSyntaxException(message);
            case WARN -> log.warn(message);
            case IGNORE -> log.debug(message);
        }
    }
}
