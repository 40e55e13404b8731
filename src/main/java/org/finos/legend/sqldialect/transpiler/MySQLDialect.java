package org.finos.legend.sqldialect.transpiler;

import org.finos.legend.sqldialect.sql.Token;
import org.finos.legend.sqldialect.sql.TokenizerSettings;
import org.finos.legend.sqldialect.sql.ast.DataType;
import org.finos.legend.sqldialect.sql.ast.Expression;
import org.finos.legend.sqldialect.sql.ast.TemporalOp;
import org.finos.legend.sqldialect.time.DirectiveTable;

import java.util.Map;
import java.util.Set;

import static org.finos.legend.sqldialect.time.TimeDirective.*;

/**
 * SQL dialect implementation for MySQL.
 * MySQL uses backticks for identifiers and single or double quotes for
 * strings. Date/time formats use {@code %} specifiers, e.g. {@code %Y-%m-%d}.
 */
public class MySQLDialect implements SQLDialect {

    /**
     * MySQL DATE_FORMAT / STR_TO_DATE specifiers.
     * MySQL has no ISO weekday (1-7) specifier, so %u (canonical) cannot be
     * encoded here.
     */
    public static final DirectiveTable TIME_MAPPING = DirectiveTable.builder("mysql")
            .map("%a", WEEKDAY_ABBR)
            .map("%b", MONTH_ABBR)
            .map("%c", MONTH_UNPADDED)
            .map("%d", DAY_OF_MONTH)
            .map("%e", DAY_OF_MONTH_UNPADDED)
            .map("%f", MICROSECOND)
            .map("%H", HOUR_24)
            .map("%h", HOUR_12)
            .alias("%I", HOUR_12)
            .map("%i", MINUTE)
            .map("%j", DAY_OF_YEAR)
            .map("%k", HOUR_24_UNPADDED)
            .map("%l", HOUR_12_UNPADDED)
            .map("%M", MONTH_NAME)
            .map("%m", MONTH)
            .map("%p", AM_PM)
            .map("%r", TIME_12)
            .map("%s", SECOND)
            .alias("%S", SECOND)
            .map("%T", TIME_24)
            .map("%U", WEEK_SUNDAY_FIRST)
            .map("%u", WEEK_MONDAY_FIRST)
            .map("%W", WEEKDAY_NAME)
            .map("%w", WEEKDAY_SUNDAY_ZERO)
            .map("%Y", YEAR)
            .map("%y", YEAR_TWO_DIGIT)
            .map("%%", PERCENT)
            .build();

    static final TokenizerSettings TOKENIZER_SETTINGS = TokenizerSettings.builder()
            .identifierQuote('`')
            .stringQuote('\'')
            .stringQuote('"')
            .keyword("DIV", Token.DIV)
            .build();

    static final TemporalRewrites TEMPORAL_REWRITES = TemporalRewrites.builder("MySQL")
            .parse("STR_TO_DATE", TemporalOp.STR_TO_DATE, TIME_MAPPING)
            .parse("DATE_FORMAT", TemporalOp.TIME_TO_STR, TIME_MAPPING)
            .render(TemporalOp.STR_TO_DATE, "STR_TO_DATE", TIME_MAPPING)
            .render(TemporalOp.STR_TO_TIME, "STR_TO_DATE", TIME_MAPPING)
            .render(TemporalOp.TIME_TO_STR, "DATE_FORMAT", TIME_MAPPING)
            .render(TemporalOp.TO_CHAR, "DATE_FORMAT", TIME_MAPPING)
            .render(TemporalOp.TS_OR_DS_TO_DATE, "STR_TO_DATE", TIME_MAPPING, "DATE")
            .build();

    /**
     * CAST only accepts a handful of target types in MySQL.
     */
    private static final Map<String, String> CAST_MAPPING = Map.of(
            "BIGINT", "SIGNED",
            "BOOLEAN", "SIGNED",
            "GEOGRAPHYPOINT", "POINT",
            "INT", "SIGNED",
            "INTEGER", "SIGNED",
            "JSONB", "JSON",
            "TEXT", "CHAR",
            "UBIGINT", "UNSIGNED",
            "VARCHAR", "CHAR");

    private static final Set<String> RESERVED_KEYWORDS =
            ReservedKeywords.load("dialects/mysql-reserved-keywords.txt");

    public static final MySQLDialect INSTANCE = new MySQLDialect();

    protected MySQLDialect() {
        // Singleton; subclassed by dialects built on MySQL
    }

    @Override
    public String name() {
        return "MySQL";
    }

    @Override
    public TokenizerSettings tokenizerSettings() {
        return TOKENIZER_SETTINGS;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        // Escape any existing backticks by doubling them
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public String quoteStringLiteral(String value) {
        // Escape any existing single quotes by doubling them
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public DirectiveTable timeMapping() {
        return TIME_MAPPING;
    }

    @Override
    public Set<String> reservedKeywords() {
        return RESERVED_KEYWORDS;
    }

    @Override
    public TemporalRewrites temporalRewrites() {
        return TEMPORAL_REWRITES;
    }

    @Override
    public String formatCastType(DataType type) {
        String mapped = CAST_MAPPING.get(type.name());
        if (mapped == null) {
            return SQLDialect.super.formatCastType(type);
        }
        // SIGNED/UNSIGNED take no length
        return "CHAR".equals(mapped)
                ? SQLDialect.super.formatCastType(type.withName(mapped))
                : mapped;
    }

    @Override
    public String formatConcat(String left, String right) {
        // || is logical OR unless PIPES_AS_CONCAT is set
        return "CONCAT(" + left + ", " + right + ")";
    }

    @Override
    public boolean supportsNullsOrdering() {
        return false;
    }

    @Override
    public String unboundedLimit() {
        return "18446744073709551615";
    }

    @Override
    public String formatJsonExtract(String json, String key, Expression.JsonResult result) {
        String extract = "JSON_EXTRACT(" + json + ", " + quoteStringLiteral("$." + key) + ")";
        return switch (result) {
            case JSON -> extract;
            case STRING -> "JSON_UNQUOTE(" + extract + ")";
            case DOUBLE -> "CAST(" + extract + " AS DOUBLE)";
        };
    }
}
