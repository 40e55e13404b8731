package org.finos.legend.sqldialect.time;

/**
 * Renders a {@link CanonicalFormat} in a target table's vocabulary.
 */
public final class TimeFormatEncoder {

    private TimeFormatEncoder() {
    }

    /**
     * Encodes each directive with the target's primary token. Literal
     * fragments are copied verbatim.
     *
     * @throws UnmappedDirectiveException if the target has no token for a directive
     */
    public static String encode(CanonicalFormat format, DirectiveTable target) {
        StringBuilder sb = new StringBuilder();
        for (FormatElement element : format.elements()) {
            if (element instanceof FormatElement.Directive d) {
                String token = target.lookupForward(d.directive())
                        .orElseThrow(() -> new UnmappedDirectiveException(d.directive(), target.name()));
                sb.append(token);
            } else {
                sb.append(((FormatElement.Literal) element).text());
            }
        }
        return sb.toString();
    }
}
