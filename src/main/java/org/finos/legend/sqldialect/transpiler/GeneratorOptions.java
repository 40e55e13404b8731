package org.finos.legend.sqldialect.transpiler;

import java.util.Objects;

/**
 * Settings for {@link SQLGenerator}.
 *
 * @param identify         Quote every identifier, not only those that need it
 * @param unsupportedLevel What to do with constructs the target dialect lacks
 */
public record GeneratorOptions(boolean identify, UnsupportedLevel unsupportedLevel) {

    public static final GeneratorOptions DEFAULT = new GeneratorOptions(false, UnsupportedLevel.WARN);

    public enum UnsupportedLevel {
        /** Emit the closest rendering silently */
        IGNORE,
        /** Emit the closest rendering and log a warning */
        WARN,
        /** Throw {@link UnsupportedSyntaxException} */
        RAISE
    }

    public GeneratorOptions {
        Objects.requireNonNull(unsupportedLevel, "unsupportedLevel");
    }

    public GeneratorOptions withIdentify(boolean identify) {
        return new GeneratorOptions(identify, unsupportedLevel);
    }

    public GeneratorOptions withUnsupportedLevel(UnsupportedLevel level) {
        return new GeneratorOptions(identify, level);
    }
}
