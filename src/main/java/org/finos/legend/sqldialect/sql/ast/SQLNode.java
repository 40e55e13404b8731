package org.finos.legend.sqldialect.sql.ast;

/**
 * Base sealed interface for all SQL AST nodes.
 *
 * The AST is dialect-neutral: dialect-specific spellings are resolved by the
 * parser on the way in and by the generator on the way out.
 */
public sealed interface SQLNode
        permits SelectStatement, Expression, SelectItem, FromItem, OrderSpec {
}
