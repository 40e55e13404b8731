package org.finos.legend.sqldialect.transpiler;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Registry of the built-in dialects, looked up by name.
 */
public final class Dialects {

    private static final Map<String, SQLDialect> BY_NAME;

    static {
        Map<String, SQLDialect> dialects = new LinkedHashMap<>();
        dialects.put("mysql", MySQLDialect.INSTANCE);
        dialects.put("singlestore", SingleStoreDialect.INSTANCE);
        BY_NAME = Collections.unmodifiableMap(dialects);
    }

    private Dialects() {
    }

    /**
     * @param name Dialect name, case-insensitive (e.g. "mysql", "SingleStore")
     * @throws IllegalArgumentException if no dialect has that name
     */
    public static SQLDialect forName(String name) {
        SQLDialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown dialect: " + name + " (known: " + BY_NAME.keySet() + ")");
        }
        return dialect;
    }

    public static Collection<SQLDialect> all() {
        return BY_NAME.values();
    }
}
