package org.finos.legend.sqldialect.time;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping between a dialect's date/time format tokens and the
 * canonical {@link TimeDirective}s.
 *
 * Every token decodes to exactly one directive. Primary tokens are also
 * used to encode their directive; alias tokens are decode-only, which lets
 * a table accept several spellings (e.g. HH and HH12) while still encoding
 * deterministically.
 *
 * Tables are compared by identity.
 */
public final class DirectiveTable {

    private final String name;
    private final Map<String, TimeDirective> reverse;
    private final Map<TimeDirective, String> forward;

    private DirectiveTable(String name, Map<String, TimeDirective> reverse, Map<TimeDirective, String> forward) {
        this.name = name;
        this.reverse = Collections.unmodifiableMap(new LinkedHashMap<>(reverse));
        this.forward = forward.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(forward));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * @return The token this table emits for the directive, if any
     */
    public Optional<String> lookupForward(TimeDirective directive) {
        return Optional.ofNullable(forward.get(directive));
    }

    /**
     * @return The directive the token decodes to, if the token is known
     */
    public Optional<TimeDirective> lookupReverse(String token) {
        return Optional.ofNullable(reverse.get(token));
    }

    /**
     * @return All tokens (primary and alias) in registration order
     */
    public Set<String> tokens() {
        return reverse.keySet();
    }

    /**
     * @return Every directive a format decoded with this table can contain
     */
    public Set<TimeDirective> directives() {
        Set<TimeDirective> result = EnumSet.noneOf(TimeDirective.class);
        result.addAll(reverse.values());
        return result;
    }

    /**
     * @return Whether every given directive has a forward token in this table
     */
    public boolean covers(Collection<TimeDirective> directives) {
        return forward.keySet().containsAll(directives);
    }

    /**
     * @return The given directives that have no forward token in this table
     */
    public Set<TimeDirective> missing(Collection<TimeDirective> directives) {
        Set<TimeDirective> result = EnumSet.noneOf(TimeDirective.class);
        for (TimeDirective d : directives) {
            if (!forward.containsKey(d)) {
                result.add(d);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "DirectiveTable[" + name + ", " + reverse.size() + " tokens]";
    }

    public static final class Builder {
        private final String name;
        private final Map<String, TimeDirective> reverse = new LinkedHashMap<>();
        private final Map<TimeDirective, String> forward = new EnumMap<>(TimeDirective.class);

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Table name cannot be null");
        }

        /**
         * Registers a primary token: decodes to the directive and is the
         * token emitted when encoding it.
         */
        public Builder map(String token, TimeDirective directive) {
            register(token, directive);
            String existing = forward.get(directive);
            if (existing != null && !existing.equals(token)) {
                throw new IllegalArgumentException("Table '" + name + "': directive " + directive.code()
                        + " already has primary token '" + existing + "', cannot add '" + token + "'");
            }
            forward.put(directive, token);
            return this;
        }

        /**
         * Registers a decode-only token.
         */
        public Builder alias(String token, TimeDirective directive) {
            register(token, directive);
            return this;
        }

        private void register(String token, TimeDirective directive) {
            Objects.requireNonNull(directive, "directive");
            if (token == null || token.isEmpty()) {
                throw new IllegalArgumentException("Table '" + name + "': format token must not be empty");
            }
            TimeDirective existing = reverse.get(token);
            if (existing != null && existing != directive) {
                throw new IllegalArgumentException("Table '" + name + "': token '" + token
                        + "' is mapped to both " + existing.code() + " and " + directive.code());
            }
            reverse.put(token, directive);
        }

        public DirectiveTable build() {
            return new DirectiveTable(name, reverse, forward);
        }
    }
}
