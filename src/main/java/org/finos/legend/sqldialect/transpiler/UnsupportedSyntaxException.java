package org.finos.legend.sqldialect.transpiler;

/**
 * Thrown when a construct cannot be expressed in the target dialect.
 */
public class UnsupportedSyntaxException extends RuntimeException {

    public UnsupportedSyntaxException(String message) {
        super(message);
    }
}
