package org.finos.legend.sqldialect.transpiler;

import org.finos.legend.sqldialect.sql.SelectParser;
import org.finos.legend.sqldialect.sql.ast.DataType;
import org.finos.legend.sqldialect.sql.ast.Expression;
import org.finos.legend.sqldialect.sql.ast.Expression.*;
import org.finos.legend.sqldialect.sql.ast.TemporalOp;
import org.finos.legend.sqldialect.time.UnmappedDirectiveException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SingleStoreDialect Tests")
class SingleStoreDialectTest {

    private final SingleStoreDialect dialect = SingleStoreDialect.INSTANCE;

    private Expression parse(String sql) {
        return new SelectParser(sql, dialect).parseStandaloneExpression();
    }

    private String roundTrip(String sql) {
        return new SQLGenerator(dialect).generateExpression(parse(sql));
    }

    @Nested
    @DisplayName("Temporal functions")
    class TemporalTests {

        @Test
        @DisplayName("TIME_FORMAT casts its value to TIME(6)")
        void testTimeFormatStructure() {
            TemporalConversion conv = assertInstanceOf(TemporalConversion.class,
                    parse("TIME_FORMAT('12:05:47', '%s, %i, %h')"));

            assertEquals(TemporalOp.TIME_TO_STR, conv.op());
            assertEquals(CastExpr.of(Expression.stringLiteral("12:05:47"), DataType.time(6)), conv.value());
            assertEquals("%S, %M, %I", ((TimeFormatLiteral) conv.format()).format().toString());
        }

        @Test
        @DisplayName("TIME_FORMAT is written as DATE_FORMAT")
        void testTimeFormatRendering() {
            assertEquals("DATE_FORMAT(CAST('12:05:47' AS TIME(6)), '%s, %i, %h')",
                    roundTrip("TIME_FORMAT('12:05:47', '%s, %i, %h')"));
        }

        @Test
        @DisplayName("TIME_FORMAT wraps even values that are already times")
        void testTimeFormatAlwaysCasts() {
            assertEquals("DATE_FORMAT(CAST(CAST(t AS TIME) AS TIME(6)), '%H')",
                    roundTrip("TIME_FORMAT(t :> TIME, '%H')"));
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "TO_DATE(d, 'YYYY-MM-DD')                   | TO_DATE(d, 'YYYY-MM-DD')",
                "TO_TIMESTAMP(d, 'YYYY-MM-DD HH24:MI:SS')   | TO_TIMESTAMP(d, 'YYYY-MM-DD HH24:MI:SS')",
                "TO_CHAR(d, 'HH:MI PM')                     | TO_CHAR(d, 'HH12:MI AM')",
                "TO_CHAR(d, 'DD-MON-RR')                    | TO_CHAR(d, 'DD-MON-YY')",
                "STR_TO_DATE(d, '%d/%m/%Y')                 | STR_TO_DATE(d, '%d/%m/%Y')",
                "DATE_FORMAT(d, '%I:%S')                    | DATE_FORMAT(d, '%h:%s')",
                "to_date(d)                                 | TO_DATE(d)",
        })
        @DisplayName("SingleStore to SingleStore")
        void testRoundTrip(String input, String expected) {
            assertEquals(expected, roundTrip(input));
        }

        @Test
        @DisplayName("ISO weekday from TO_CHAR cannot be written as DATE_FORMAT")
        void testIsoWeekdayToMySql() {
            Expression parsed = parse("TO_CHAR(d, 'D')");
            SQLGenerator mysql = new SQLGenerator(MySQLDialect.INSTANCE);
            UnmappedDirectiveException e = assertThrows(UnmappedDirectiveException.class,
                    () -> mysql.generateExpression(parsed));
            assertEquals("mysql", e.getTableName());
        }
    }

    @Nested
    @DisplayName("Syntax")
    class SyntaxTests {

        @Test
        @DisplayName(":> is written as CAST, !:> is kept")
        void testCasts() {
            assertEquals("CAST(a AS DATE)", roundTrip("a :> DATE"));
            assertEquals("a !:> DATE", roundTrip("a !:> DATE"));
            assertEquals("(a + 1) !:> DATE", roundTrip("(a + 1) !:> DATE"));
        }

        @Test
        @DisplayName("BSON and GEOGRAPHYPOINT keep their names")
        void testTypes() {
            assertEquals("CAST(j AS BSON)", roundTrip("CAST(j AS BSON)"));
            assertEquals("CAST(j AS BSON)", roundTrip("j :> JSONB"));
            assertEquals("CAST(p AS GEOGRAPHYPOINT)", roundTrip("p :> GEOGRAPHYPOINT"));
        }

        @Test
        @DisplayName("JSON access operators")
        void testJson() {
            assertEquals("doc::a", roundTrip("doc::a"));
            assertEquals("doc::a::$b", roundTrip("doc::a::$b"));
            assertEquals("doc::%n + 1", roundTrip("doc::%n + 1"));
        }

        @Test
        @DisplayName("Byte strings")
        void testByteString() {
            assertEquals("e'abc'", roundTrip("E'abc'"));
        }

        @Test
        @DisplayName("Integer division")
        void testDiv() {
            assertEquals("a DIV 2", roundTrip("a DIV 2"));
        }
    }

    @Test
    @DisplayName("Reserved words include SingleStore-specific ones")
    void testReservedKeywords() {
        assertTrue(dialect.isReservedKeyword("ACTION"));
        assertTrue(dialect.isReservedKeyword("aggregator"));
        assertTrue(dialect.isReservedKeyword("select"));
        assertFalse(dialect.isReservedKeyword("customer_id"));
    }

    @Test
    @DisplayName("Dialect flags")
    void testFlags() {
        assertEquals("SingleStore", dialect.name());
        assertTrue(dialect.supportsOrderByAll());
        assertTrue(dialect.supportsTryCast());
        assertTrue(dialect.supportsJsonColonAccess());
    }
}
