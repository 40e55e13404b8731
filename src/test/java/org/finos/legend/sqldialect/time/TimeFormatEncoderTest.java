package org.finos.legend.sqldialect.time;

import org.finos.legend.sqldialect.transpiler.MySQLDialect;
import org.finos.legend.sqldialect.transpiler.SingleStoreDialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.finos.legend.sqldialect.time.TimeDirective.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeFormatEncoder Tests")
class TimeFormatEncoderTest {

    @Test
    @DisplayName("Directives use the primary token, literals are copied")
    void testEncode() {
        CanonicalFormat format = CanonicalFormat.of(
                FormatElement.directive(HOUR_12),
                FormatElement.literal(":"),
                FormatElement.directive(MINUTE),
                FormatElement.literal(" "),
                FormatElement.directive(AM_PM));

        assertEquals("HH12:MI AM", TimeFormatEncoder.encode(format, SingleStoreDialect.TIME_MAPPING));
        assertEquals("%h:%i %p", TimeFormatEncoder.encode(format, MySQLDialect.TIME_MAPPING));
    }

    @Test
    @DisplayName("Empty format encodes to the empty string")
    void testEmpty() {
        assertEquals("", TimeFormatEncoder.encode(CanonicalFormat.empty(), MySQLDialect.TIME_MAPPING));
    }

    @Test
    @DisplayName("Missing directive raises UnmappedDirectiveException")
    void testUnmapped() {
        CanonicalFormat format = CanonicalFormat.of(FormatElement.directive(WEEKDAY_ISO));

        UnmappedDirectiveException e = assertThrows(UnmappedDirectiveException.class,
                () -> TimeFormatEncoder.encode(format, MySQLDialect.TIME_MAPPING));
        assertEquals(WEEKDAY_ISO, e.getDirective());
        assertEquals("mysql", e.getTableName());
        assertTrue(e.getMessage().contains("%u"));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"YYYY-MM-DD", "HH24:MI:SS", "DD MON YY", "HH12:MI AM", "DAY, D MONTH", "SS.FF6", "DY"})
    @DisplayName("SingleStore primary tokens round-trip")
    void testSingleStoreRoundTrip(String format) {
        DirectiveTable table = SingleStoreDialect.TIME_MAPPING;
        assertEquals(format, TimeFormatEncoder.encode(TimeFormatDecoder.decode(format, table), table));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"%Y-%m-%d %H:%i:%s", "%a %b %e %c", "%h:%i %p", "%W %w %U %u %j", "%k %l %f", "%T %r %%"})
    @DisplayName("MySQL primary specifiers round-trip")
    void testMySqlRoundTrip(String format) {
        DirectiveTable table = MySQLDialect.TIME_MAPPING;
        assertEquals(format, TimeFormatEncoder.encode(TimeFormatDecoder.decode(format, table), table));
    }

    @Test
    @DisplayName("Aliases re-encode to the primary token")
    void testAliasNormalised() {
        DirectiveTable ss = SingleStoreDialect.TIME_MAPPING;
        assertEquals("HH12:MI AM", TimeFormatEncoder.encode(TimeFormatDecoder.decode("HH:MI PM", ss), ss));
        assertEquals("YY", TimeFormatEncoder.encode(TimeFormatDecoder.decode("RR", ss), ss));

        DirectiveTable mysql = MySQLDialect.TIME_MAPPING;
        assertEquals("%h:%i:%s", TimeFormatEncoder.encode(TimeFormatDecoder.decode("%I:%i:%S", mysql), mysql));
    }
}
