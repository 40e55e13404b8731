package org.finos.legend.sqldialect.sql;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dialect-specific lexical configuration consumed by the {@link Lexer}.
 *
 * @param keywords           Extra keywords, keyed by upper-case text
 * @param operators          Extra multi-character operators, keyed by literal text
 * @param identifierQuotes   Characters that open and close a quoted identifier
 * @param stringQuotes       Characters that open and close a string literal
 * @param byteStringPrefixes Characters that, directly followed by a single quote, open a byte string
 */
public record TokenizerSettings(
        Map<String, Token> keywords,
        Map<String, Token> operators,
        Set<Character> identifierQuotes,
        Set<Character> stringQuotes,
        Set<Character> byteStringPrefixes) {

    /**
     * ANSI behaviour: double-quoted identifiers, single-quoted strings.
     */
    public static final TokenizerSettings ANSI = builder()
            .identifierQuote('"')
            .stringQuote('\'')
            .build();

    public TokenizerSettings {
        keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
        operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
        identifierQuotes = Collections.unmodifiableSet(new LinkedHashSet<>(identifierQuotes));
        stringQuotes = Collections.unmodifiableSet(new LinkedHashSet<>(stringQuotes));
        byteStringPrefixes = Collections.unmodifiableSet(new LinkedHashSet<>(byteStringPrefixes));
        for (Character q : identifierQuotes) {
            if (stringQuotes.contains(q)) {
                throw new IllegalArgumentException("Quote character " + q + " cannot delimit both identifiers and strings");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated with these settings, for dialects that
     * extend another dialect's tokenizer.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.keywords.putAll(keywords);
        b.operators.putAll(operators);
        b.identifierQuotes.addAll(identifierQuotes);
        b.stringQuotes.addAll(stringQuotes);
        b.byteStringPrefixes.addAll(byteStringPrefixes);
        return b;
    }

    /**
     * Operators ordered longest first, so that the first match at a position
     * is the longest one.
     */
    public List<String> operatorsLongestFirst() {
        return operators.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());
    }

    public static final class Builder {
        private final Map<String, Token> keywords = new LinkedHashMap<>();
        private final Map<String, Token> operators = new LinkedHashMap<>();
        private final Set<Character> identifierQuotes = new LinkedHashSet<>();
        private final Set<Character> stringQuotes = new LinkedHashSet<>();
        private final Set<Character> byteStringPrefixes = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder keyword(String text, Token token) {
            keywords.put(text.toUpperCase(Locale.ROOT), token);
            return this;
        }

        public Builder operator(String text, Token token) {
            if (text.length() < 2) {
                throw new IllegalArgumentException("Dialect operators must be multi-character: '" + text + "'");
            }
            operators.put(text, token);
            return this;
        }

        public Builder identifierQuote(char quote) {
            identifierQuotes.add(quote);
            return this;
        }

        public Builder stringQuote(char quote) {
            stringQuotes.add(quote);
            return this;
        }

        public Builder byteStringPrefix(char prefix) {
            byteStringPrefixes.add(prefix);
            return this;
        }

        public TokenizerSettings build() {
            return new TokenizerSettings(keywords, operators, identifierQuotes, stringQuotes, byteStringPrefixes);
        }
    }
}
