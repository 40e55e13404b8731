package org.finos.legend.sqldialect.sql;

import org.finos.legend.sqldialect.sql.ast.*;
import org.finos.legend.sqldialect.sql.ast.Expression.*;
import org.finos.legend.sqldialect.sql.ast.FromItem.*;
import org.finos.legend.sqldialect.sql.ast.SelectItem.*;
import org.finos.legend.sqldialect.time.TimeDirective;
import org.finos.legend.sqldialect.transpiler.MySQLDialect;
import org.finos.legend.sqldialect.transpiler.SingleStoreDialect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SelectParser Tests")
class SelectParserTest {

    private static final DialectGrammar ANSI = () -> TokenizerSettings.ANSI;

    private static SelectStatement parse(String sql) {
        return new SelectParser(sql, ANSI).parseStatement();
    }

    private static Expression expr(String sql, DialectGrammar grammar) {
        return new SelectParser(sql, grammar).parseStandaloneExpression();
    }

    // ==================== SELECT ====================

    @Nested
    @DisplayName("SELECT Statement")
    class SelectTests {

        @Test
        @DisplayName("SELECT * FROM table")
        void testSelectStar() {
            SelectStatement stmt = parse("SELECT * FROM employees");

            assertEquals(1, stmt.selectItems().size());
            assertInstanceOf(AllColumns.class, stmt.selectItems().get(0));
            TableRef table = assertInstanceOf(TableRef.class, stmt.from().get(0));
            assertEquals("employees", table.table());
        }

        @Test
        @DisplayName("Columns with aliases, qualified star")
        void testAliases() {
            SelectStatement stmt = parse("SELECT e.*, name AS n, salary s FROM hr.employees e");

            AllColumns star = assertInstanceOf(AllColumns.class, stmt.selectItems().get(0));
            assertEquals("e", star.tableQualifier());
            assertEquals("n", ((ExpressionItem) stmt.selectItems().get(1)).alias());
            assertEquals("s", ((ExpressionItem) stmt.selectItems().get(2)).alias());

            TableRef table = (TableRef) stmt.from().get(0);
            assertEquals("hr", table.schema());
            assertEquals("e", table.alias());
        }

        @Test
        @DisplayName("SELECT without FROM")
        void testNoFrom() {
            SelectStatement stmt = parse("SELECT 1");
            assertFalse(stmt.hasFrom());
        }

        @Test
        @DisplayName("All clauses")
        void testAllClauses() {
            SelectStatement stmt = parse("SELECT DISTINCT dept, COUNT(*) FROM emp WHERE salary > 10 "
                    + "GROUP BY dept HAVING COUNT(*) > 1 ORDER BY dept DESC NULLS LAST LIMIT 5 OFFSET 10;");

            assertTrue(stmt.distinct());
            assertTrue(stmt.hasWhere());
            assertEquals(1, stmt.groupBy().size());
            assertTrue(stmt.hasHaving());
            OrderSpec order = stmt.orderBy().get(0);
            assertEquals(OrderSpec.Direction.DESC, order.direction());
            assertEquals(OrderSpec.NullsOrder.NULLS_LAST, order.nullsOrder());
            assertEquals(5L, stmt.limit());
            assertEquals(10L, stmt.offset());
        }

        @Test
        @DisplayName("LIMIT offset, count")
        void testMySqlLimit() {
            SelectStatement stmt = parse("SELECT a FROM t LIMIT 20, 10");
            assertEquals(10L, stmt.limit());
            assertEquals(20L, stmt.offset());
        }

        @Test
        @DisplayName("Row counts are unsigned 64-bit")
        void testUnsignedRowCount() {
            SelectStatement stmt = parse("SELECT a FROM t LIMIT 5, 18446744073709551615");
            assertEquals("18446744073709551615", Long.toUnsignedString(stmt.limit()));
            assertEquals(5L, stmt.offset());
        }

        @Test
        @DisplayName("Oversized numbers are parse errors")
        void testNumberOutOfRange() {
            assertThrows(SQLParseException.class, () -> parse("SELECT a FROM t OFFSET 99999999999999999999"));
            assertThrows(SQLParseException.class, () -> parse("SELECT 9223372036854775808"));
        }

        @Test
        @DisplayName("Joins and subqueries")
        void testJoins() {
            SelectStatement stmt = parse("SELECT * FROM a LEFT JOIN (SELECT id FROM b) AS sb ON a.id = sb.id CROSS JOIN c");

            JoinedTable outer = assertInstanceOf(JoinedTable.class, stmt.from().get(0));
            assertEquals(JoinedTable.JoinType.CROSS, outer.joinType());
            assertNull(outer.condition());
            JoinedTable inner = assertInstanceOf(JoinedTable.class, outer.left());
            assertEquals(JoinedTable.JoinType.LEFT_OUTER, inner.joinType());
            assertInstanceOf(SubQuery.class, inner.right());
        }

        @Test
        @DisplayName("Trailing input is rejected")
        void testTrailingInput() {
            assertThrows(SQLParseException.class, () -> parse("SELECT a FROM t t2 t3"));
        }

        @Test
        @DisplayName("Reserved keyword cannot be a bare column")
        void testReservedKeyword() {
            assertThrows(SQLParseException.class, () -> parse("SELECT FROM FROM t"));
        }
    }

    // ==================== Expressions ====================

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        @Test
        @DisplayName("AND binds tighter than OR")
        void testPrecedence() {
            BinaryOp or = assertInstanceOf(BinaryOp.class, expr("a = 1 OR b = 2 AND c = 3", ANSI));
            assertEquals(BinaryOperator.OR, or.operator());
            assertEquals(BinaryOperator.AND, ((BinaryOp) or.right()).operator());
        }

        @Test
        @DisplayName("NOT LIKE, NOT IN, NOT BETWEEN, IS NOT NULL")
        void testNegations() {
            UnaryOp notLike = assertInstanceOf(UnaryOp.class, expr("name NOT LIKE 'a%'", ANSI));
            assertEquals(BinaryOperator.LIKE, ((BinaryOp) notLike.operand()).operator());
            assertTrue(((InExpr) expr("x NOT IN (1, 2)", ANSI)).negated());
            assertTrue(((BetweenExpr) expr("x NOT BETWEEN 1 AND 2", ANSI)).negated());
            assertTrue(((IsNullExpr) expr("x IS NOT NULL", ANSI)).negated());
        }

        @Test
        @DisplayName("Literals")
        void testLiterals() {
            assertEquals(Expression.decimalLiteral(new BigDecimal("1.50")), expr("1.50", ANSI));
            assertEquals(Expression.intLiteral(42), expr("42", ANSI));
            assertEquals(Expression.boolLiteral(true), expr("TRUE", ANSI));
            assertEquals(Expression.nullLiteral(), expr("NULL", ANSI));
        }

        @Test
        @DisplayName("CAST with parameterised type")
        void testCast() {
            CastExpr cast = assertInstanceOf(CastExpr.class, expr("CAST(x AS DECIMAL(10, 2))", ANSI));
            assertEquals(DataType.of("DECIMAL", 10, 2), cast.type());
            assertFalse(cast.safe());
        }

        @Test
        @DisplayName("CASE, EXISTS, scalar subquery")
        void testCaseAndSubqueries() {
            CaseExpr c = assertInstanceOf(CaseExpr.class, expr("CASE WHEN a > 1 THEN 'x' ELSE 'y' END", ANSI));
            assertEquals(1, c.whenClauses().size());
            assertInstanceOf(ExistsExpr.class, expr("EXISTS (SELECT 1 FROM t)", ANSI));
            assertInstanceOf(SubqueryExpr.class, expr("(SELECT MAX(a) FROM t)", ANSI));
        }

        @Test
        @DisplayName("Unknown functions stay plain calls")
        void testPlainFunction() {
            FunctionCall fn = assertInstanceOf(FunctionCall.class, expr("UPPER(name)", ANSI));
            assertEquals("UPPER", fn.functionName());
            FunctionCall distinct = assertInstanceOf(FunctionCall.class, expr("COUNT(DISTINCT a)", ANSI));
            assertTrue(distinct.distinct());
        }
    }

    // ==================== Dialect Syntax ====================

    @Nested
    @DisplayName("SingleStore Syntax")
    class SingleStoreSyntaxTests {

        private final DialectGrammar grammar = SingleStoreDialect.INSTANCE;

        @Test
        @DisplayName(":> and !:> casts")
        void testCastOperators() {
            CastExpr cast = assertInstanceOf(CastExpr.class, expr("a :> BIGINT", grammar));
            assertFalse(cast.safe());
            assertEquals(DataType.of("BIGINT"), cast.type());

            CastExpr tryCast = assertInstanceOf(CastExpr.class, expr("a !:> TIME(6)", grammar));
            assertTrue(tryCast.safe());
            assertEquals(DataType.time(6), tryCast.type());
        }

        @Test
        @DisplayName("BSON is read as JSONB")
        void testBsonAlias() {
            CastExpr cast = assertInstanceOf(CastExpr.class, expr("CAST(j AS bson)", grammar));
            assertEquals("JSONB", cast.type().name());
        }

        @Test
        @DisplayName("JSON key access")
        void testJsonAccess() {
            JsonExtract json = assertInstanceOf(JsonExtract.class, expr("doc::a", grammar));
            assertEquals(JsonResult.JSON, json.result());
            assertEquals("a", json.key());

            JsonExtract chained = assertInstanceOf(JsonExtract.class, expr("doc::a::$b", grammar));
            assertEquals(JsonResult.STRING, chained.result());
            assertInstanceOf(JsonExtract.class, chained.json());

            assertEquals(JsonResult.DOUBLE, ((JsonExtract) expr("doc::%n", grammar)).result());
        }

        @Test
        @DisplayName("Byte string literal")
        void testByteString() {
            assertEquals(Expression.byteStringLiteral("abc"), expr("e'abc'", grammar));
        }

        @Test
        @DisplayName("ORDER BY ALL")
        void testOrderByAll() {
            SelectStatement stmt = new SelectParser("SELECT a, b FROM t ORDER BY ALL DESC", grammar).parseStatement();
            OrderSpec order = stmt.orderBy().get(0);
            assertTrue(order.isAll());
            assertEquals(OrderSpec.Direction.DESC, order.direction());
        }

        @Test
        @DisplayName("TO_DATE builds a temporal conversion with a decoded format")
        void testTemporalFunction() {
            TemporalConversion conv = assertInstanceOf(TemporalConversion.class,
                    expr("TO_DATE(d, 'YYYY-MM-DD')", grammar));
            assertEquals(TemporalOp.TS_OR_DS_TO_DATE, conv.op());
            TimeFormatLiteral format = assertInstanceOf(TimeFormatLiteral.class, conv.format());
            assertEquals("%Y-%m-%d", format.format().toString());
            assertEquals(EnumSet.of(TimeDirective.YEAR, TimeDirective.MONTH, TimeDirective.DAY_OF_MONTH),
                    format.format().directives());
        }

        @Test
        @DisplayName("Temporal function with too many arguments is a parse error")
        void testTemporalArity() {
            SQLParseException e = assertThrows(SQLParseException.class,
                    () -> expr("TO_DATE(a, 'YYYY', 'x')", grammar));
            assertTrue(e.getMessage().contains("TO_DATE"));
        }

        @Test
        @DisplayName("DIV integer division")
        void testDiv() {
            BinaryOp div = assertInstanceOf(BinaryOp.class, expr("a DIV 2", grammar));
            assertEquals(BinaryOperator.INT_DIVIDE, div.operator());
        }
    }

    @Nested
    @DisplayName("MySQL Syntax")
    class MySqlSyntaxTests {

        private final DialectGrammar grammar = MySQLDialect.INSTANCE;

        @Test
        @DisplayName("ORDER BY ALL is rejected")
        void testOrderByAllRejected() {
            assertThrows(SQLParseException.class,
                    () -> new SelectParser("SELECT a FROM t ORDER BY ALL", grammar).parseStatement());
        }

        @Test
        @DisplayName(":: is rejected")
        void testColonAccessRejected() {
            assertThrows(SQLParseException.class, () -> expr("doc::a", grammar));
        }

        @Test
        @DisplayName("TO_DATE is an ordinary function")
        void testNoSingleStoreFunctions() {
            assertInstanceOf(FunctionCall.class, expr("TO_DATE(d, 'YYYY')", grammar));
        }

        @Test
        @DisplayName("STR_TO_DATE decodes MySQL specifiers")
        void testStrToDate() {
            TemporalConversion conv = assertInstanceOf(TemporalConversion.class,
                    expr("STR_TO_DATE(d, '%d/%m/%Y')", grammar));
            assertEquals(TemporalOp.STR_TO_DATE, conv.op());
            assertEquals("%d/%m/%Y", ((TimeFormatLiteral) conv.format()).format().toString());
        }
    }
}
