package org.finos.legend.sqldialect.time;

import java.util.Objects;

/**
 * One element of a {@link CanonicalFormat}: either a canonical directive
 * or a run of verbatim characters.
 */
public sealed interface FormatElement permits FormatElement.Directive, FormatElement.Literal {

    static Directive directive(TimeDirective directive) {
        return new Directive(directive);
    }

    static Literal literal(String text) {
        return new Literal(text);
    }

    /**
     * Canonical form of this element (directive code or the literal text).
     */
    String canonical();

    record Directive(TimeDirective directive) implements FormatElement {
        public Directive {
            Objects.requireNonNull(directive, "directive");
        }

        @Override
        public String canonical() {
            return directive.code();
        }
    }

    record Literal(String text) implements FormatElement {
        public Literal {
            if (text == null || text.isEmpty()) {
                throw new IllegalArgumentException("Literal fragment must not be empty");
            }
        }

        @Override
        public String canonical() {
            return text;
        }
    }
}
