package org.finos.legend.sqldialect.transpiler;

import org.finos.legend.sqldialect.sql.Token;
import org.finos.legend.sqldialect.sql.TokenizerSettings;
import org.finos.legend.sqldialect.sql.ast.DataType;
import org.finos.legend.sqldialect.sql.ast.Expression;
import org.finos.legend.sqldialect.sql.ast.TemporalOp;
import org.finos.legend.sqldialect.time.DirectiveTable;

import java.util.Locale;
import java.util.Set;

import static org.finos.legend.sqldialect.time.TimeDirective.*;

/**
 * SQL dialect implementation for SingleStore.
 *
 * SingleStore is wire-compatible with MySQL and accepts MySQL's
 * DATE_FORMAT/STR_TO_DATE, but adds Oracle-style TO_DATE/TO_TIMESTAMP/TO_CHAR
 * with their own format tokens ({@code YYYY-MM-DD HH24:MI:SS}), the
 * {@code :>} and {@code !:>} cast operators, {@code ::} JSON access, and
 * {@code e'...'} byte strings.
 */
public class SingleStoreDialect extends MySQLDialect {

    /**
     * TO_DATE / TO_TIMESTAMP / TO_CHAR format tokens.
     */
    public static final DirectiveTable TIME_MAPPING = DirectiveTable.builder("singlestore")
            .map("D", WEEKDAY_ISO)
            .map("DD", DAY_OF_MONTH)
            .map("DY", WEEKDAY_ABBR)
            .map("DAY", WEEKDAY_NAME)
            .alias("HH", HOUR_12)
            .map("HH12", HOUR_12)
            .map("HH24", HOUR_24)
            .map("MI", MINUTE)
            .map("MM", MONTH)
            .map("MON", MONTH_ABBR)
            .map("MONTH", MONTH_NAME)
            .map("SS", SECOND)
            .alias("RR", YEAR_TWO_DIGIT)
            .map("YY", YEAR_TWO_DIGIT)
            .map("YYYY", YEAR)
            .map("FF6", MICROSECOND)
            .map("AM", AM_PM)
            .alias("PM", AM_PM)
            .build();

    static final TokenizerSettings TOKENIZER_SETTINGS = MySQLDialect.TOKENIZER_SETTINGS.toBuilder()
            .operator(":>", Token.COLON_GT)
            .operator("!:>", Token.NCOLON_GT)
            .operator("::$", Token.DCOLON_DOLLAR)
            .operator("::%", Token.DCOLON_PERCENT)
            .byteStringPrefix('e')
            .byteStringPrefix('E')
            .build();

    static final TemporalRewrites TEMPORAL_REWRITES = MySQLDialect.TEMPORAL_REWRITES.toBuilder("SingleStore")
            .parse("TO_DATE", TemporalOp.TS_OR_DS_TO_DATE, TIME_MAPPING)
            .parse("TO_TIMESTAMP", TemporalOp.STR_TO_TIME, TIME_MAPPING)
            .parse("TO_CHAR", TemporalOp.TO_CHAR, TIME_MAPPING)
            .parse("STR_TO_DATE", TemporalOp.STR_TO_DATE, MySQLDialect.TIME_MAPPING)
            .parse("DATE_FORMAT", TemporalOp.TIME_TO_STR, MySQLDialect.TIME_MAPPING)
            // TIME_FORMAT only accepts time values; DATE_FORMAT over TIME(6) is equivalent
            .parse("TIME_FORMAT", TemporalOp.TIME_TO_STR, MySQLDialect.TIME_MAPPING, DataType.time(6))
            .render(TemporalOp.TS_OR_DS_TO_DATE, "TO_DATE", TIME_MAPPING)
            .render(TemporalOp.STR_TO_TIME, "TO_TIMESTAMP", TIME_MAPPING)
            .render(TemporalOp.TO_CHAR, "TO_CHAR", TIME_MAPPING)
            .render(TemporalOp.STR_TO_DATE, "STR_TO_DATE", MySQLDialect.TIME_MAPPING)
            .render(TemporalOp.TIME_TO_STR, "DATE_FORMAT", MySQLDialect.TIME_MAPPING)
            .build();

    private static final Set<String> RESERVED_KEYWORDS =
            ReservedKeywords.load("dialects/singlestore-reserved-keywords.txt");

    public static final SingleStoreDialect INSTANCE = new SingleStoreDialect();

    protected SingleStoreDialect() {
    }

    @Override
    public String name() {
        return "SingleStore";
    }

    @Override
    public TokenizerSettings tokenizerSettings() {
        return TOKENIZER_SETTINGS;
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
    public String canonicalTypeName(String typeName) {
        return "BSON".equals(typeName.toUpperCase(Locale.ROOT)) ? "JSONB" : typeName;
    }

    @Override
    public String formatCastType(DataType type) {
        return switch (type.name()) {
            case "JSONB" -> "BSON";
            case "GEOGRAPHYPOINT" -> "GEOGRAPHYPOINT";
            default -> super.formatCastType(type);
        };
    }

    @Override
    public boolean supportsOrderByAll() {
        return true;
    }

    @Override
    public boolean supportsJsonColonAccess() {
        return true;
    }

    @Override
    public boolean supportsTryCast() {
        return true;
    }

    @Override
    public String formatTryCast(String expression, String type) {
        return expression + " !:> " + type;
    }

    @Override
    public String formatByteString(String value) {
        return "e" + quoteStringLiteral(value);
    }

    @Override
    public String formatJsonExtract(String json, String key, Expression.JsonResult result) {
        String op = switch (result) {
            case JSON -> "::";
            case STRING -> "::$";
            case DOUBLE -> "::%";
        };
        return json + op + key;
    }
}
