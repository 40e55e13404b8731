package org.finos.legend.sqldialect.transpiler;

import org.finos.legend.sqldialect.sql.ast.DataType;
import org.finos.legend.sqldialect.sql.ast.Expression;
import org.finos.legend.sqldialect.sql.ast.TemporalOp;
import org.finos.legend.sqldialect.time.DirectiveTable;
import org.finos.legend.sqldialect.time.TimeFormatDecoder;
import org.finos.legend.sqldialect.time.TimeFormatEncoder;
import org.finos.legend.sqldialect.time.TimeFormatTranscoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A dialect's date/time function rewrites.
 *
 * Parse rules turn a SQL function call such as {@code TO_DATE(x, 'YYYY-MM-DD')}
 * into a {@link Expression.TemporalConversion} whose literal format is decoded
 * into canonical form. Render rules turn a conversion back into the function
 * call the dialect emits, encoding the format with the rule's table, which
 * need not be the table it was decoded with.
 *
 * Rules are validated when built: every parsed operation must be renderable,
 * and the render table must encode every directive the parse table decodes.
 */
public final class TemporalRewrites {

    private static final Logger log = LoggerFactory.getLogger(TemporalRewrites.class);

    /**
     * @param functionName  SQL function recognised by the parser
     * @param op            Conversion produced
     * @param formatTable   Vocabulary of the function's format argument
     * @param valueCoercion Type the value argument is cast to, or null
     */
    public record ParseRule(String functionName, TemporalOp op, DirectiveTable formatTable, DataType valueCoercion) {
        public ParseRule {
            Objects.requireNonNull(functionName, "functionName");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(formatTable, "formatTable");
        }
    }

    /**
     * @param op                    Conversion rendered
     * @param functionName          SQL function emitted
     * @param formatTable           Vocabulary the format is encoded in
     * @param functionWithoutFormat Function emitted when there is no format, or null to use functionName
     */
    public record RenderRule(TemporalOp op, String functionName, DirectiveTable formatTable,
                             String functionWithoutFormat) {
        public RenderRule {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(functionName, "functionName");
            Objects.requireNonNull(formatTable, "formatTable");
        }
    }

    private final String dialectName;
    private final Map<String, ParseRule> parseRules;
    private final Map<TemporalOp, RenderRule> renderRules;

    private TemporalRewrites(String dialectName, Map<String, ParseRule> parseRules,
                             Map<TemporalOp, RenderRule> renderRules) {
        this.dialectName = dialectName;
        this.parseRules = Collections.unmodifiableMap(new LinkedHashMap<>(parseRules));
        this.renderRules = Collections.unmodifiableMap(new EnumMap<>(renderRules));
    }

    public static Builder builder(String dialectName) {
        return new Builder(dialectName);
    }

    /**
     * Starts a builder holding these rules, for a dialect extending another.
     */
    public Builder toBuilder(String newDialectName) {
        Builder b = new Builder(newDialectName);
        b.parseRules.putAll(parseRules);
        b.renderRules.putAll(renderRules);
        return b;
    }

    public Map<String, ParseRule> parseRules() {
        return parseRules;
    }

    public Map<TemporalOp, RenderRule> renderRules() {
        return renderRules;
    }

    // ==================== Parse ====================

    /**
     * Builds the conversion for a recognised function, or returns null.
     *
     * @throws IllegalArgumentException on a wrong number of arguments
     */
    public Expression parse(String functionName, List<Expression> arguments) {
        ParseRule rule = parseRules.get(functionName.toUpperCase(Locale.ROOT));
        if (rule == null) {
            return null;
        }
        if (arguments.isEmpty() || arguments.size() > 2) {
            throw new IllegalArgumentException(rule.functionName() + " expects a value and an optional format, got "
                    + arguments.size() + " arguments");
        }

        Expression value = arguments.get(0);
        if (rule.valueCoercion() != null) {
            value = Expression.CastExpr.of(value, rule.valueCoercion());
        }

        Expression format = arguments.size() > 1 ? decodeFormat(rule, arguments.get(1)) : null;
        return new Expression.TemporalConversion(rule.op(), value, format);
    }

    private Expression decodeFormat(ParseRule rule, Expression format) {
        if (format instanceof Expression.Literal lit && lit.isString()) {
            return new Expression.TimeFormatLiteral(TimeFormatDecoder.decode((String) lit.value(), rule.formatTable()));
        }
        log.debug("{}: format argument of {} is not a literal, passing it through", dialectName, rule.functionName());
        return format;
    }

    // ==================== Render ====================

    /**
     * Rewrites a conversion into the function call this dialect emits.
     *
     * @throws org.finos.legend.sqldialect.time.UnmappedDirectiveException if the
     *         format uses a directive the render table cannot encode
     * @throws UnsupportedSyntaxException if no render rule exists for the operation
     */
    public Expression.FunctionCall toFunctionCall(Expression.TemporalConversion conversion) {
        RenderRule rule = renderRules.get(conversion.op());
        if (rule == null) {
            throw new UnsupportedSyntaxException(dialectName + " cannot render " + conversion.op());
        }

        List<Expression> args = new ArrayList<>(2);
        args.add(conversion.value());
        if (!conversion.hasFormat()) {
            String fn = rule.functionWithoutFormat() != null ? rule.functionWithoutFormat() : rule.functionName();
            return new Expression.FunctionCall(fn, args, false);
        }

        if (conversion.format() instanceof Expression.TimeFormatLiteral tf) {
            args.add(Expression.stringLiteral(TimeFormatEncoder.encode(tf.format(), rule.formatTable())));
        } else {
            args.add(conversion.format());
        }
        return new Expression.FunctionCall(rule.functionName(), args, false);
    }

    public static final class Builder {
        private final String dialectName;
        private final Map<String, ParseRule> parseRules = new LinkedHashMap<>();
        private final Map<TemporalOp, RenderRule> renderRules = new EnumMap<>(TemporalOp.class);

        private Builder(String dialectName) {
            this.dialectName = dialectName;
        }

        public Builder parse(String functionName, TemporalOp op, DirectiveTable formatTable) {
            return parse(functionName, op, formatTable, null);
        }

        /**
         * Parse rule that also casts the value argument, for functions whose
         * rendered counterpart expects a differently typed value.
         */
        public Builder parse(String functionName, TemporalOp op, DirectiveTable formatTable, DataType valueCoercion) {
            String key = functionName.toUpperCase(Locale.ROOT);
            parseRules.put(key, new ParseRule(key, op, formatTable, valueCoercion));
            return this;
        }

        public Builder render(TemporalOp op, String functionName, DirectiveTable formatTable) {
            return render(op, functionName, formatTable, null);
        }

        public Builder render(TemporalOp op, String functionName, DirectiveTable formatTable,
                              String functionWithoutFormat) {
            renderRules.put(op, new RenderRule(op, functionName, formatTable, functionWithoutFormat));
            return this;
        }

        /**
         * @throws IllegalStateException if a parsed operation has no render rule
         *         or its render table cannot encode what the parse table decodes
         */
        public TemporalRewrites build() {
            for (ParseRule parse : parseRules.values()) {
                RenderRule render = renderRules.get(parse.op());
                if (render == null) {
                    throw new IllegalStateException(dialectName + ": " + parse.functionName()
                            + " parses to " + parse.op() + " which has no render rule");
                }
                try {
                    new TimeFormatTranscoder(parse.formatTable(), render.formatTable());
                } catch (IllegalStateException e) {
                    throw new IllegalStateException(dialectName + ": " + parse.functionName() + " -> "
                            + render.functionName() + ": " + e.getMessage(), e);
                }
            }
            log.debug("{}: {} temporal parse rules, {} render rules", dialectName, parseRules.size(), renderRules.size());
            return new TemporalRewrites(dialectName, parseRules, renderRules);
        }
    }
}
