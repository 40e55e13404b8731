package org.finos.legend.sqldialect.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decodes dialect format strings into {@link CanonicalFormat}s.
 *
 * Tries are built lazily, once per table, and cached by table identity.
 */
public final class TimeFormatDecoder {

    private static final Logger log = LoggerFactory.getLogger(TimeFormatDecoder.class);

    private static final Map<DirectiveTable, DirectiveTrie> TRIES = new ConcurrentHashMap<>();

    private TimeFormatDecoder() {
    }

    /**
     * Decodes a format string written in the table's vocabulary. Never fails:
     * unknown characters are kept as literals.
     *
     * @param format The dialect format string, e.g. {@code YYYY-MM-DD}
     * @param source The table describing the format's vocabulary
     * @return The canonical format
     */
    public static CanonicalFormat decode(String format, DirectiveTable source) {
        Objects.requireNonNull(format, "format");
        return trieFor(source).tokenize(format);
    }

    /**
     * @return The cached trie for the table, building it on first use
     */
    public static DirectiveTrie trieFor(DirectiveTable table) {
        Objects.requireNonNull(table, "table");
        return TRIES.computeIfAbsent(table, t -> {
            log.debug("Building format trie for table '{}' ({} tokens)", t.name(), t.tokens().size());
            return DirectiveTrie.of(t);
        });
    }
}
