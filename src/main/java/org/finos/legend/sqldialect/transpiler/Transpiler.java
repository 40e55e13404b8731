package org.finos.legend.sqldialect.transpiler;

import org.finos.legend.sqldialect.sql.SelectParser;
import org.finos.legend.sqldialect.sql.ast.SelectStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a SELECT statement in one dialect and writes it in another.
 *
 * <pre>
 * Transpiler.transpile("SELECT TO_DATE(d, 'YYYY-MM-DD') FROM t", "singlestore", "mysql")
 *   // SELECT STR_TO_DATE(d, '%Y-%m-%d') FROM t
 * </pre>
 */
public final class Transpiler {

    private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

    private Transpiler() {
    }

    public static String transpile(String sql, String readDialect, String writeDialect) {
        return transpile(sql, Dialects.forName(readDialect), Dialects.forName(writeDialect));
    }

    public static String transpile(String sql, SQLDialect read, SQLDialect write) {
        return transpile(sql, read, write, GeneratorOptions.DEFAULT);
    }

    /**
     * @throws org.finos.legend.sqldialect.sql.SQLParseException if the input does not parse
     * @throws UnsupportedSyntaxException if the output dialect cannot express
     *         the statement and the options say to raise
     * @throws org.finos.legend.sqldialect.time.UnmappedDirectiveException if a
     *         date/time format cannot be written in the output dialect
     */
    public static String transpile(String sql, SQLDialect read, SQLDialect write, GeneratorOptions options) {
        SelectStatement statement = new SelectParser(sql, read).parseStatement();
        String out = new SQLGenerator(write, options).generate(statement);
        log.debug("{} -> {}: {}", read.name(), write.name(), out);
        return out;
    }
}
