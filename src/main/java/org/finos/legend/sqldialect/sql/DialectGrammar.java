package org.finos.legend.sqldialect.sql;

import org.finos.legend.sqldialect.sql.ast.Expression;

import java.util.List;

/**
 * Parse-time hooks a dialect contributes to the {@link Lexer} and
 * {@link SelectParser}.
 */
public interface DialectGrammar {

    /**
     * @return Lexical settings: extra keywords/operators, quoting characters
     */
    TokenizerSettings tokenizerSettings();

    /**
     * Builds the AST node for a function call. Returning null keeps the call
     * as a plain {@link Expression.FunctionCall}.
     *
     * @param name      Function name as written
     * @param arguments Parsed arguments
     */
    default Expression buildFunction(String name, List<Expression> arguments) {
        return null;
    }

    /**
     * Maps a dialect type spelling to its canonical name, e.g. BSON to JSONB.
     */
    default String canonicalTypeName(String typeName) {
        return typeName;
    }

    /**
     * @return Whether ORDER BY ALL is accepted
     */
    default boolean supportsOrderByAll() {
        return false;
    }

    /**
     * @return Whether {@code json::key} is a JSON key lookup
     */
    default boolean supportsJsonColonAccess() {
        return false;
    }
}
