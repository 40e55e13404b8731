package org.finos.legend.sqldialect.time;

/**
 * Canonical, dialect-neutral date/time format directives.
 *
 * Codes follow strftime conventions so a decoded format can be printed
 * and compared without reference to any SQL dialect.
 */
public enum TimeDirective {
    // Weekday
    WEEKDAY_ABBR("%a"),
    WEEKDAY_NAME("%A"),
    WEEKDAY_SUNDAY_ZERO("%w"),     // 0-6, Sunday = 0
    WEEKDAY_ISO("%u"),             // 1-7, Monday = 1

    // Day
    DAY_OF_MONTH("%d"),            // 01-31
    DAY_OF_MONTH_UNPADDED("%-d"),  // 1-31
    DAY_OF_YEAR("%j"),             // 001-366

    // Month
    MONTH_ABBR("%b"),
    MONTH_NAME("%B"),
    MONTH("%m"),                   // 01-12
    MONTH_UNPADDED("%-m"),         // 1-12

    // Year
    YEAR_TWO_DIGIT("%y"),
    YEAR("%Y"),

    // Week
    WEEK_SUNDAY_FIRST("%U"),
    WEEK_MONDAY_FIRST("%W"),

    // Time of day
    HOUR_24("%H"),
    HOUR_24_UNPADDED("%-H"),
    HOUR_12("%I"),
    HOUR_12_UNPADDED("%-I"),
    AM_PM("%p"),
    MINUTE("%M"),
    SECOND("%S"),
    MICROSECOND("%f"),
    TIME_24("%T"),                 // hh:mm:ss
    TIME_12("%r"),                 // hh:mm:ss AM

    PERCENT("%%");

    private final String code;

    TimeDirective(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
