package org.finos.legend.sqldialect.time;

import java.util.Objects;
import java.util.Set;

/**
 * Rewrites format strings from one table's vocabulary into another's.
 *
 * Construction fails when the target cannot encode some directive the
 * source can decode, so a transcoder that exists never loses a directive.
 *
 * @param source Vocabulary of the input format strings
 * @param target Vocabulary of the output format strings
 */
public record TimeFormatTranscoder(DirectiveTable source, DirectiveTable target) {

    public TimeFormatTranscoder {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Set<TimeDirective> missing = target.missing(source.directives());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Table '" + target.name() + "' cannot encode directives "
                    + missing + " produced by table '" + source.name() + "'");
        }
    }

    public String transcode(String format) {
        return TimeFormatEncoder.encode(TimeFormatDecoder.decode(format, source), target);
    }
}
