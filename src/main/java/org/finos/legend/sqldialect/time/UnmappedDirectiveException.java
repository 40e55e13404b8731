package org.finos.legend.sqldialect.time;

/**
 * Thrown when a format is encoded into a table that has no token for one
 * of its directives. This indicates incomplete table coverage, not bad
 * input data.
 */
public class UnmappedDirectiveException extends RuntimeException {

    private final TimeDirective directive;
    private final String tableName;

    public UnmappedDirectiveException(TimeDirective directive, String tableName) {
        super("Format directive " + directive.code() + " has no token in table '" + tableName + "'");
        this.directive = directive;
        this.tableName = tableName;
    }

    public TimeDirective getDirective() {
        return directive;
    }

    public String getTableName() {
        return tableName;
    }
}
