package org.finos.legend.sqldialect.sql.ast;

/**
 * Kinds of string/date/time conversion that carry a date/time format.
 */
public enum TemporalOp {
    /** Parse a string into a DATE. */
    STR_TO_DATE,
    /** Parse a string into a TIMESTAMP. */
    STR_TO_TIME,
    /** Format a date/time value as a string. */
    TIME_TO_STR,
    /** Convert a string or timestamp to a DATE, optionally with a format. */
    TS_OR_DS_TO_DATE,
    /** Format a value with an explicit format (TO_CHAR). */
    TO_CHAR
}
