package org.finos.legend.sqldialect.sql;

import org.finos.legend.sqldialect.sql.ast.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.finos.legend.sqldialect.sql.Token.*;

/**
 * Recursive descent parser for SELECT statements and expressions.
 *
 * Combines patterns from:
 * - JOOQ: check()/consumeIf() for clean lookahead
 * - Alibaba Druid: SavePoint for backtracking
 *
 * Dialect differences are delegated to a {@link DialectGrammar}: tokenizer
 * settings, function builders (e.g. date/time functions whose format
 * argument is decoded here), type aliases and optional syntax.
 */
public final class SelectParser {

    private final Lexer lexer;
    private final DialectGrammar grammar;

    public SelectParser(String sql, DialectGrammar grammar) {
        this.grammar = grammar;
        this.lexer = new Lexer(sql, grammar.tokenizerSettings());
    }

    // ==================== Token Helpers (JOOQ-style) ====================

    private Token current() {
        return lexer.token();
    }

    private String stringVal() {
        return lexer.stringVal();
    }

    private boolean check(Token t) {
        return current() == t;
    }

    private void advance() {
        lexer.nextToken();
    }

    private boolean consumeIf(Token t) {
        if (check(t)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(Token t) {
        if (!check(t)) {
            throw error("Expected " + t + ", got " + current());
        }
        advance();
    }

    private String expectIdentifier() {
        if (check(IDENTIFIER) || check(QUOTED_IDENTIFIER)) {
            String val = stringVal();
            advance();
            return val;
        }
        // Allow some keywords as identifiers
        if (current().isKeyword() && !isReserved(current())) {
            String val = stringVal();
            advance();
            return val;
        }
        throw error("Expected identifier");
    }

    /**
     * Reads a row count. MySQL accepts counts up to 2^64-1, so the value is
     * held as an unsigned long.
     */
    private long expectRowCount() {
        if (!check(INTEGER)) {
            throw error("Expected integer");
        }
        long val;
        try {
            val = Long.parseUnsignedLong(stringVal());
        } catch (NumberFormatException e) {
            throw error("Row count out of range: " + stringVal());
        }
        advance();
        return val;
    }

    private SQLParseException error(String message) {
        return new SQLParseException(message + " at " + lexer.info(), lexer.tokenPos());
    }

    // ==================== List Parsing ====================

    private <T> List<T> parseList(Supplier<T> parser) {
        List<T> items = new ArrayList<>();
        do {
            items.add(parser.get());
        } while (consumeIf(COMMA));
        return items;
    }

    // ==================== Entry Points ====================

    /**
     * Parses a complete SELECT statement; an optional trailing semicolon is
     * accepted.
     */
    public SelectStatement parseStatement() {
        SelectStatement statement = parseSelect();
        consumeIf(SEMICOLON);
        if (!check(EOF)) {
            throw error("Unexpected trailing input");
        }
        return statement;
    }

    /**
     * Parses a single expression that must span the whole input.
     */
    public Expression parseStandaloneExpression() {
        Expression expr = parseExpression();
        if (!check(EOF)) {
            throw error("Unexpected trailing input");
        }
        return expr;
    }

    // ==================== SELECT Statement ====================

    private SelectStatement parseSelect() {
        expect(SELECT);

        boolean distinct = consumeIf(DISTINCT);
        if (!distinct)
            consumeIf(ALL);

        List<SelectItem> items = parseSelectList();

        List<FromItem> fromItems = List.of();
        if (consumeIf(FROM)) {
            fromItems = parseList(this::parseFromItem);
        }

        Expression where = null;
        if (consumeIf(WHERE)) {
            where = parseExpression();
        }

        List<Expression> groupBy = List.of();
        if (consumeIf(GROUP)) {
            expect(BY);
            groupBy = parseList(this::parseExpression);
        }

        Expression having = null;
        if (consumeIf(HAVING)) {
            having = parseExpression();
        }

        List<OrderSpec> orderBy = List.of();
        if (consumeIf(ORDER)) {
            expect(BY);
            orderBy = parseOrderBy();
        }

        Long limit = null;
        Long offset = null;
        if (consumeIf(LIMIT)) {
            limit = expectRowCount();
            // MySQL: LIMIT offset, count
            if (consumeIf(COMMA)) {
                offset = limit;
                limit = expectRowCount();
            }
        }

        if (consumeIf(OFFSET)) {
            offset = expectRowCount();
        }

        return new SelectStatement(distinct, items, fromItems, where, groupBy, having, orderBy, limit, offset);
    }

    // ==================== SELECT List ====================

    private List<SelectItem> parseSelectList() {
        if (consumeIf(STAR)) {
            List<SelectItem> items = new ArrayList<>();
            items.add(SelectItem.AllColumns.unqualified());
            while (consumeIf(COMMA)) {
                items.add(parseSelectItem());
            }
            return items;
        }
        return parseList(this::parseSelectItem);
    }

    private SelectItem parseSelectItem() {
        // Check for table.*
        Lexer.SavePoint mark = lexer.mark();
        if (check(IDENTIFIER) || check(QUOTED_IDENTIFIER)) {
            String name = stringVal();
            advance();
            if (consumeIf(DOT) && consumeIf(STAR)) {
                return SelectItem.AllColumns.qualified(name);
            }
            lexer.reset(mark);
        }

        Expression expr = parseExpression();
        String alias = parseOptionalAlias();
        return new SelectItem.ExpressionItem(expr, alias);
    }

    private String parseOptionalAlias() {
        if (consumeIf(AS)) {
            return expectIdentifier();
        }
        if (check(IDENTIFIER) || check(QUOTED_IDENTIFIER)) {
            return expectIdentifier();
        }
        // Also allow non-reserved keywords as aliases (e.g., "first", "last")
        if (current().isKeyword() && !isReserved(current())) {
            String val = stringVal();
            advance();
            return val;
        }
        return null;
    }

    private boolean isReserved(Token t) {
        return t == FROM || t == WHERE || t == GROUP || t == HAVING ||
                t == ORDER || t == LIMIT || t == OFFSET ||
                t == JOIN || t == LEFT || t == RIGHT || t == INNER ||
                t == FULL || t == CROSS || t == ON ||
                t == UNION || t == INTERSECT || t == EXCEPT ||
                t == AND || t == OR || t == AS || t == SELECT ||
                t == DIV || t == LIKE || t == IS || t == IN || t == NOT || t == BETWEEN;
    }

    // ==================== FROM Clause ====================

    private FromItem parseFromItem() {
        FromItem item = parseFromPrimary();

        // Handle JOINs
        while (isJoinKeyword()) {
            FromItem.JoinedTable.JoinType joinType = parseJoinType();
            FromItem right = parseFromPrimary();
            Expression condition = null;
            if (consumeIf(ON)) {
                condition = parseExpression();
            }
            item = new FromItem.JoinedTable(item, joinType, right, condition);
        }

        return item;
    }

    private FromItem parseFromPrimary() {
        // Subquery: (SELECT ...)
        if (check(LPAREN)) {
            Lexer.SavePoint mark = lexer.mark();
            advance();
            if (check(SELECT)) {
                SelectStatement subquery = parseSelect();
                expect(RPAREN);
                String alias = parseOptionalFromAlias();
                if (alias == null)
                    throw error("Subquery must have an alias");
                return new FromItem.SubQuery(subquery, alias);
            }
            lexer.reset(mark);
        }

        return parseTableRef();
    }

    private FromItem.TableRef parseTableRef() {
        String first = expectIdentifier();
        String schema = null;
        String table = first;

        if (consumeIf(DOT)) {
            schema = first;
            table = expectIdentifier();
        }

        String alias = parseOptionalFromAlias();
        return new FromItem.TableRef(schema, table, alias);
    }

    private String parseOptionalFromAlias() {
        if (consumeIf(AS)) {
            return expectIdentifier();
        }
        if (check(IDENTIFIER) || check(QUOTED_IDENTIFIER)) {
            return expectIdentifier();
        }
        return null;
    }

    private boolean isJoinKeyword() {
        return check(JOIN) || check(INNER) || check(LEFT) ||
                check(RIGHT) || check(FULL) || check(CROSS);
    }

    private FromItem.JoinedTable.JoinType parseJoinType() {
        if (consumeIf(INNER)) {
            expect(JOIN);
            return FromItem.JoinedTable.JoinType.INNER;
        }
        if (consumeIf(LEFT)) {
            consumeIf(OUTER);
            expect(JOIN);
            return FromItem.JoinedTable.JoinType.LEFT_OUTER;
        }
        if (consumeIf(RIGHT)) {
            consumeIf(OUTER);
            expect(JOIN);
            return FromItem.JoinedTable.JoinType.RIGHT_OUTER;
        }
        if (consumeIf(FULL)) {
            consumeIf(OUTER);
            expect(JOIN);
            return FromItem.JoinedTable.JoinType.FULL_OUTER;
        }
        if (consumeIf(CROSS)) {
            expect(JOIN);
            return FromItem.JoinedTable.JoinType.CROSS;
        }
        if (consumeIf(JOIN)) {
            return FromItem.JoinedTable.JoinType.INNER;
        }
        throw error("Expected JOIN keyword");
    }

    // ==================== ORDER BY ====================

    private List<OrderSpec> parseOrderBy() {
        if (check(ALL)) {
            if (!grammar.supportsOrderByAll()) {
                throw error("ORDER BY ALL is not supported by this dialect");
            }
            advance();
            return List.of(OrderSpec.all(parseDirection()));
        }
        return parseList(this::parseOrderSpec);
    }

    private OrderSpec parseOrderSpec() {
        Expression expr = parseExpression();
        OrderSpec.Direction dir = parseDirection();

        OrderSpec.NullsOrder nulls = OrderSpec.NullsOrder.DEFAULT;
        if (consumeIf(NULLS)) {
            if (consumeIf(FIRST))
                nulls = OrderSpec.NullsOrder.NULLS_FIRST;
            else if (consumeIf(LAST))
                nulls = OrderSpec.NullsOrder.NULLS_LAST;
            else
                throw error("Expected FIRST or LAST after NULLS");
        }

        return new OrderSpec(expr, dir, nulls);
    }

    private OrderSpec.Direction parseDirection() {
        if (consumeIf(DESC))
            return OrderSpec.Direction.DESC;
        consumeIf(ASC);
        return OrderSpec.Direction.ASC;
    }

    // ==================== Expressions ====================

    public Expression parseExpression() {
        return parseOrExpr();
    }

    private Expression parseOrExpr() {
        Expression left = parseAndExpr();
        while (consumeIf(OR)) {
            Expression right = parseAndExpr();
            left = new Expression.BinaryOp(left, Expression.BinaryOperator.OR, right);
        }
        return left;
    }

    private Expression parseAndExpr() {
        Expression left = parseNotExpr();
        while (consumeIf(AND)) {
            Expression right = parseNotExpr();
            left = new Expression.BinaryOp(left, Expression.BinaryOperator.AND, right);
        }
        return left;
    }

    private Expression parseNotExpr() {
        if (consumeIf(NOT)) {
            return new Expression.UnaryOp(Expression.UnaryOperator.NOT, parseNotExpr());
        }
        return parseComparisonExpr();
    }

    private Expression parseComparisonExpr() {
        Expression left = parseAddExpr();

        // IS NULL / IS NOT NULL
        if (consumeIf(IS)) {
            boolean negated = consumeIf(NOT);
            expect(NULL);
            return new Expression.IsNullExpr(left, negated);
        }

        // BETWEEN
        if (check(BETWEEN) || (check(NOT) && peekIs(BETWEEN))) {
            boolean negated = consumeIf(NOT);
            expect(BETWEEN);
            Expression low = parseAddExpr();
            expect(AND);
            Expression high = parseAddExpr();
            return new Expression.BetweenExpr(left, low, high, negated);
        }

        // IN
        if (check(IN) || (check(NOT) && peekIs(IN))) {
            boolean negated = consumeIf(NOT);
            expect(IN);
            expect(LPAREN);
            if (check(SELECT)) {
                SelectStatement subquery = parseSelect();
                expect(RPAREN);
                return new Expression.InExpr(left, null, subquery, negated);
            }
            List<Expression> values = parseList(this::parseExpression);
            expect(RPAREN);
            return new Expression.InExpr(left, values, null, negated);
        }

        // LIKE / NOT LIKE
        if (check(LIKE) || (check(NOT) && peekIs(LIKE))) {
            boolean negated = consumeIf(NOT);
            expect(LIKE);
            Expression like = new Expression.BinaryOp(left, Expression.BinaryOperator.LIKE, parseAddExpr());
            return negated ? new Expression.UnaryOp(Expression.UnaryOperator.NOT, like) : like;
        }

        // Comparison operators
        if (current().isComparisonOp()) {
            Expression.BinaryOperator op = switch (current()) {
                case EQ -> Expression.BinaryOperator.EQ;
                case NE -> Expression.BinaryOperator.NE;
                case LT -> Expression.BinaryOperator.LT;
                case LE -> Expression.BinaryOperator.LE;
                case GT -> Expression.BinaryOperator.GT;
                case GE -> Expression.BinaryOperator.GE;
                default -> throw error("Unexpected comparison operator");
            };
            advance();
            return new Expression.BinaryOp(left, op, parseAddExpr());
        }

        return left;
    }

    private boolean peekIs(Token t) {
        Lexer.SavePoint mark = lexer.mark();
        advance();
        boolean result = check(t);
        lexer.reset(mark);
        return result;
    }

    private Expression parseAddExpr() {
        Expression left = parseMulExpr();
        while (check(PLUS) || check(MINUS) || check(CONCAT)) {
            Expression.BinaryOperator op = switch (current()) {
                case PLUS -> Expression.BinaryOperator.PLUS;
                case MINUS -> Expression.BinaryOperator.MINUS;
                case CONCAT -> Expression.BinaryOperator.CONCAT;
                default -> throw error("Unexpected");
            };
            advance();
            left = new Expression.BinaryOp(left, op, parseMulExpr());
        }
        return left;
    }

    private Expression parseMulExpr() {
        Expression left = parseUnaryExpr();
        while (check(STAR) || check(SLASH) || check(PERCENT) || check(DIV)) {
            Expression.BinaryOperator op = switch (current()) {
                case STAR -> Expression.BinaryOperator.MULTIPLY;
                case SLASH -> Expression.BinaryOperator.DIVIDE;
                case PERCENT -> Expression.BinaryOperator.MODULO;
                case DIV -> Expression.BinaryOperator.INT_DIVIDE;
                default -> throw error("Unexpected");
            };
            advance();
            left = new Expression.BinaryOp(left, op, parseUnaryExpr());
        }
        return left;
    }

    private Expression parseUnaryExpr() {
        if (consumeIf(MINUS)) {
            return new Expression.UnaryOp(Expression.UnaryOperator.MINUS, parseUnaryExpr());
        }
        if (consumeIf(PLUS)) {
            return new Expression.UnaryOp(Expression.UnaryOperator.PLUS, parseUnaryExpr());
        }
        return parsePostfixExpr(parsePrimaryExpr());
    }

    /**
     * Dialect postfix operators: expr :> type, expr !:> type, json::key,
     * json::$key, json::%key.
     */
    private Expression parsePostfixExpr(Expression expr) {
        while (true) {
            if (consumeIf(COLON_GT)) {
                expr = Expression.CastExpr.of(expr, parseDataType());
            } else if (consumeIf(NCOLON_GT)) {
                expr = Expression.CastExpr.tryCast(expr, parseDataType());
            } else if (consumeIf(DCOLON_DOLLAR)) {
                expr = new Expression.JsonExtract(expr, expectIdentifier(), Expression.JsonResult.STRING);
            } else if (consumeIf(DCOLON_PERCENT)) {
                expr = new Expression.JsonExtract(expr, expectIdentifier(), Expression.JsonResult.DOUBLE);
            } else if (check(DOUBLE_COLON)) {
                if (!grammar.supportsJsonColonAccess()) {
                    throw error("'::' is not supported by this dialect");
                }
                advance();
                expr = new Expression.JsonExtract(expr, expectIdentifier(), Expression.JsonResult.JSON);
            } else {
                return expr;
            }
        }
    }

    private Expression parsePrimaryExpr() {
        // EXISTS
        if (consumeIf(EXISTS)) {
            expect(LPAREN);
            SelectStatement subquery = parseSelect();
            expect(RPAREN);
            return new Expression.ExistsExpr(subquery, false);
        }

        // CASE
        if (check(CASE)) {
            return parseCaseExpr();
        }

        // CAST
        if (consumeIf(CAST)) {
            expect(LPAREN);
            Expression expr = parseExpression();
            expect(AS);
            DataType type = parseDataType();
            expect(RPAREN);
            return Expression.CastExpr.of(expr, type);
        }

        // Parenthesized expression or subquery
        if (consumeIf(LPAREN)) {
            if (check(SELECT)) {
                SelectStatement subquery = parseSelect();
                expect(RPAREN);
                return new Expression.SubqueryExpr(subquery);
            }
            Expression expr = parseExpression();
            expect(RPAREN);
            return expr;
        }

        // Literals
        if (check(STRING)) {
            String val = stringVal();
            advance();
            return Expression.stringLiteral(val);
        }
        if (check(BYTE_STRING)) {
            String val = stringVal();
            advance();
            return Expression.byteStringLiteral(val);
        }
        if (check(INTEGER)) {
            long val;
            try {
                val = Long.parseLong(stringVal());
            } catch (NumberFormatException e) {
                throw error("Integer literal out of range: " + stringVal());
            }
            advance();
            return Expression.intLiteral(val);
        }
        if (check(DECIMAL)) {
            BigDecimal val = new BigDecimal(stringVal());
            advance();
            return Expression.decimalLiteral(val);
        }
        if (consumeIf(TRUE))
            return Expression.boolLiteral(true);
        if (consumeIf(FALSE))
            return Expression.boolLiteral(false);
        if (consumeIf(NULL))
            return Expression.nullLiteral();

        // Identifier, function call, or column reference
        return parseIdentifierExpr();
    }

    private Expression parseIdentifierExpr() {
        String name = expectIdentifier();

        // Function call
        if (consumeIf(LPAREN)) {
            // COUNT(*)
            if (name.equalsIgnoreCase("COUNT") && consumeIf(STAR)) {
                expect(RPAREN);
                return new Expression.FunctionCall(name, List.of(Expression.column("*")), false);
            }

            boolean distinct = consumeIf(DISTINCT);
            List<Expression> args = check(RPAREN) ? List.of() : parseList(this::parseExpression);
            expect(RPAREN);

            if (!distinct) {
                Expression built;
                try {
                    built = grammar.buildFunction(name, args);
                } catch (IllegalArgumentException e) {
                    throw error(e.getMessage());
                }
                if (built != null) {
                    return built;
                }
            }
            return new Expression.FunctionCall(name, args, distinct);
        }

        // Qualified column: table.column
        if (consumeIf(DOT)) {
            String column = expectIdentifier();
            return Expression.column(name, column);
        }

        return Expression.column(name);
    }

    private DataType parseDataType() {
        String name = grammar.canonicalTypeName(expectIdentifier());
        List<Integer> params = List.of();
        if (consumeIf(LPAREN)) {
            params = parseList(this::expectInteger);
            expect(RPAREN);
        }
        return new DataType(name, params);
    }

    private Expression.CaseExpr parseCaseExpr() {
        expect(CASE);
        List<Expression.WhenClause> whenClauses = new ArrayList<>();

        while (consumeIf(WHEN)) {
            Expression condition = parseExpression();
            expect(THEN);
            Expression result = parseExpression();
            whenClauses.add(new Expression.WhenClause(condition, result));
        }
        if (whenClauses.isEmpty()) {
            throw error("CASE requires at least one WHEN clause");
        }

        Expression elseExpr = null;
        if (consumeIf(ELSE)) {
            elseExpr = parseExpression();
        }

        expect(END);
        return new Expression.CaseExpr(whenClauses, elseExpr);
    }
}
