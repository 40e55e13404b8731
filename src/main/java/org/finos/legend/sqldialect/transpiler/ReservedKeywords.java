package org.finos.legend.sqldialect.transpiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Loads a dialect's reserved-word list from the classpath.
 *
 * Files hold one keyword per line; blank lines and {@code #} comments are
 * skipped. Keywords are stored lower-case.
 */
public final class ReservedKeywords {

    private static final Logger log = LoggerFactory.getLogger(ReservedKeywords.class);

    private ReservedKeywords() {
    }

    /**
     * @param resource Classpath resource, e.g. {@code dialects/mysql-reserved-keywords.txt}
     * @return An immutable lower-case keyword set
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static Set<String> load(String resource) {
        InputStream in = ReservedKeywords.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Reserved keyword resource not found: " + resource);
        }
        Set<String> keywords = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String keyword = line.trim();
                if (keyword.isEmpty() || keyword.startsWith("#")) {
                    continue;
                }
                keywords.add(keyword.toLowerCase(Locale.ROOT));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read reserved keywords from " + resource, e);
        }
        log.debug("Loaded {} reserved keywords from {}", keywords.size(), resource);
        return Collections.unmodifiableSet(keywords);
    }
}
