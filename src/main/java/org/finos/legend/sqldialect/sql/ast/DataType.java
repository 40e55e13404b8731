package org.finos.legend.sqldialect.sql.ast;

import java.util.List;
import java.util.Locale;

/**
 * A SQL data type as written in a cast target: name plus optional numeric
 * parameters, e.g. {@code TIME(6)} or {@code DECIMAL(10, 2)}.
 *
 * @param name       Canonical upper-case type name
 * @param parameters Precision/scale/length parameters, possibly empty
 */
public record DataType(String name, List<Integer> parameters) {

    public DataType {
        name = name.toUpperCase(Locale.ROOT);
        parameters = List.copyOf(parameters);
    }

    public static DataType of(String name, Integer... parameters) {
        return new DataType(name, List.of(parameters));
    }

    /**
     * Fixed-precision time of day, e.g. TIME(6).
     */
    public static DataType time(int precision) {
        return of("TIME", precision);
    }

    public boolean hasParameters() {
        return !parameters.isEmpty();
    }

    public DataType withName(String newName) {
        return new DataType(newName, parameters);
    }
}
