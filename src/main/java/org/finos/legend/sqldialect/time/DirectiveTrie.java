package org.finos.legend.sqldialect.time;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prefix tree over the tokens of a {@link DirectiveTable}, used to split a
 * format string into directives and literals by greedy longest match.
 *
 * Immutable once built; safe to share between threads.
 */
public final class DirectiveTrie {

    private final Node root = new Node();
    private final String tableName;

    private DirectiveTrie(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Builds a trie from every token (primary and alias) of the table.
     */
    public static DirectiveTrie of(DirectiveTable table) {
        DirectiveTrie trie = new DirectiveTrie(table.name());
        for (String token : table.tokens()) {
            trie.insert(token, table.lookupReverse(token).orElseThrow());
        }
        return trie;
    }

    public String tableName() {
        return tableName;
    }

    private void insert(String token, TimeDirective directive) {
        Node node = root;
        for (int i = 0; i < token.length(); i++) {
            node = node.children.computeIfAbsent(token.charAt(i), c -> new Node());
        }
        node.directive = directive;
    }

    /**
     * Longest token starting at {@code start}, or null when no token matches
     * there.
     */
    public Match longestMatch(String input, int start) {
        Node node = root;
        Match best = null;
        for (int i = start; i < input.length(); i++) {
            node = node.children.get(input.charAt(i));
            if (node == null) {
                break;
            }
            if (node.directive != null) {
                best = new Match(node.directive, i + 1 - start);
            }
        }
        return best;
    }

    /**
     * Splits the input into directives and coalesced literal fragments.
     * Total: characters that start no token become literals.
     */
    public CanonicalFormat tokenize(String input) {
        List<FormatElement> elements = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int pos = 0;
        while (pos < input.length()) {
            Match match = longestMatch(input, pos);
            if (match == null) {
                literal.append(input.charAt(pos));
                pos++;
                continue;
            }
            if (literal.length() > 0) {
                elements.add(FormatElement.literal(literal.toString()));
                literal.setLength(0);
            }
            elements.add(FormatElement.directive(match.directive()));
            pos += match.length();
        }
        if (literal.length() > 0) {
            elements.add(FormatElement.literal(literal.toString()));
        }
        return new CanonicalFormat(elements);
    }

    /**
     * A token match: the directive and the number of characters consumed.
     */
    public record Match(TimeDirective directive, int length) {
    }

    private static final class Node {
        private final Map<Character, Node> children = new HashMap<>();
        private TimeDirective directive;
    }
}
