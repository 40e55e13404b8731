package org.finos.legend.sqldialect.transpiler;

import org.finos.legend.sqldialect.sql.DialectGrammar;
import org.finos.legend.sqldialect.sql.ast.DataType;
import org.finos.legend.sqldialect.sql.ast.Expression;
import org.finos.legend.sqldialect.time.DirectiveTable;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines, on the way
 * in (through {@link DialectGrammar}) and on the way out (rendering hooks
 * used by {@link SQLGenerator}).
 */
public interface SQLDialect extends DialectGrammar {

    /**
     * @return The dialect name (e.g., "MySQL", "SingleStore")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    String quoteStringLiteral(String value);

    /**
     * Format a boolean literal.
     *
     * @param value The boolean value
     * @return The SQL boolean representation
     */
    String formatBoolean(boolean value);

    /**
     * Format a NULL literal.
     *
     * @return The SQL NULL representation
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * Format a byte string literal. Dialects without byte strings emit a
     * plain string.
     */
    default String formatByteString(String value) {
        return quoteStringLiteral(value);
    }

    /**
     * @return The table describing this dialect's own date/time format tokens
     */
    DirectiveTable timeMapping();

    /**
     * @return Lower-case words that must be quoted when used as identifiers
     */
    Set<String> reservedKeywords();

    /**
     * Case-insensitive reserved word test.
     */
    default boolean isReservedKeyword(String identifier) {
        return reservedKeywords().contains(identifier.toLowerCase(Locale.ROOT));
    }

    /**
     * @return The date/time function parse and render rules
     */
    TemporalRewrites temporalRewrites();

    @Override
    default Expression buildFunction(String name, List<Expression> arguments) {
        return temporalRewrites().parse(name, arguments);
    }

    /**
     * Render a cast target type. Defaults to the canonical name followed by
     * its parameters, e.g. {@code TIME(6)}.
     */
    default String formatCastType(DataType type) {
        if (!type.hasParameters()) {
            return type.name();
        }
        return type.name() + type.parameters().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    /**
     * Render string concatenation of two rendered operands.
     */
    default String formatConcat(String left, String right) {
        return left + " || " + right;
    }

    /**
     * @return The LIMIT value meaning "no limit", for dialects that require a
     *         LIMIT before OFFSET, or null when OFFSET may stand alone
     */
    default String unboundedLimit() {
        return null;
    }

    /**
     * @return Whether ORDER BY accepts NULLS FIRST / NULLS LAST
     */
    default boolean supportsNullsOrdering() {
        return true;
    }

    /**
     * @return Whether the dialect has a non-failing cast
     */
    default boolean supportsTryCast() {
        return false;
    }

    /**
     * Render a non-failing cast. Only called when {@link #supportsTryCast()}.
     */
    default String formatTryCast(String expression, String type) {
        return "TRY_CAST(" + expression + " AS " + type + ")";
    }

    /**
     * Render a JSON key lookup.
     *
     * @param json   Rendered JSON expression
     * @param key    Key name
     * @param result Requested result type
     */
    String formatJsonExtract(String json, String key, Expression.JsonResult result);
}
