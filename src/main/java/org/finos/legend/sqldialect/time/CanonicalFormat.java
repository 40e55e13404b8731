package org.finos.legend.sqldialect.time;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A date/time format expressed as an ordered sequence of canonical
 * directives and literal fragments.
 *
 * Adjacent literal fragments are always coalesced, so two formats that
 * render the same canonical string are equal.
 *
 * @param elements The ordered elements
 */
public record CanonicalFormat(List<FormatElement> elements) {

    public CanonicalFormat {
        elements = coalesce(elements);
    }

    public static CanonicalFormat of(FormatElement... elements) {
        return new CanonicalFormat(List.of(elements));
    }

    public static CanonicalFormat empty() {
        return new CanonicalFormat(List.of());
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * @return The distinct directives used by this format
     */
    public Set<TimeDirective> directives() {
        Set<TimeDirective> result = EnumSet.noneOf(TimeDirective.class);
        for (FormatElement element : elements) {
            if (element instanceof FormatElement.Directive d) {
                result.add(d.directive());
            }
        }
        return result;
    }

    /**
     * Renders the format with strftime codes, e.g. {@code %Y-%m-%d}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (FormatElement element : elements) {
            sb.append(element.canonical());
        }
        return sb.toString();
    }

    private static List<FormatElement> coalesce(List<FormatElement> input) {
        List<FormatElement> out = new ArrayList<>(input.size());
        StringBuilder pending = new StringBuilder();
        for (FormatElement element : input) {
            if (element instanceof FormatElement.Literal lit) {
                pending.append(lit.text());
                continue;
            }
            if (pending.length() > 0) {
                out.add(new FormatElement.Literal(pending.toString()));
                pending.setLength(0);
            }
            out.add(element);
        }
        if (pending.length() > 0) {
            out.add(new FormatElement.Literal(pending.toString()));
        }
        return Collections.unmodifiableList(out);
    }
}
