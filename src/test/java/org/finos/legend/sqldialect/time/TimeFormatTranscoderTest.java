package org.finos.legend.sqldialect.time;

import org.finos.legend.sqldialect.transpiler.MySQLDialect;
import org.finos.legend.sqldialect.transpiler.SingleStoreDialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.finos.legend.sqldialect.time.TimeDirective.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeFormatTranscoder Tests")
class TimeFormatTranscoderTest {

    @Test
    @DisplayName("SingleStore to MySQL")
    void testSingleStoreToMySql() {
        DirectiveTable trimmed = DirectiveTable.builder("singlestore-no-iso")
                .map("YYYY", YEAR)
                .map("MM", MONTH)
                .map("DD", DAY_OF_MONTH)
                .map("HH24", HOUR_24)
                .map("MI", MINUTE)
                .map("SS", SECOND)
                .build();
        TimeFormatTranscoder transcoder = new TimeFormatTranscoder(trimmed, MySQLDialect.TIME_MAPPING);

        assertEquals("%Y-%m-%d", transcoder.transcode("YYYY-MM-DD"));
        assertEquals("%Y-%m-%d %H:%i:%s", transcoder.transcode("YYYY-MM-DD HH24:MI:SS"));
    }

    @Test
    @DisplayName("MySQL to SingleStore fails: SingleStore lacks unpadded and week tokens")
    void testMySqlToSingleStoreRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new TimeFormatTranscoder(MySQLDialect.TIME_MAPPING, SingleStoreDialect.TIME_MAPPING));
        assertTrue(e.getMessage().contains("singlestore"));
    }

    @Test
    @DisplayName("Full SingleStore table cannot target MySQL: no ISO weekday")
    void testIsoWeekdayUnavailable() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new TimeFormatTranscoder(SingleStoreDialect.TIME_MAPPING, MySQLDialect.TIME_MAPPING));
        assertTrue(e.getMessage().contains("%u"));
    }

    @Test
    @DisplayName("A table can always transcode into itself")
    void testIdentity() {
        TimeFormatTranscoder transcoder =
                new TimeFormatTranscoder(SingleStoreDialect.TIME_MAPPING, SingleStoreDialect.TIME_MAPPING);
        assertEquals("HH12:MI", transcoder.transcode("HH:MI"));
    }
}
