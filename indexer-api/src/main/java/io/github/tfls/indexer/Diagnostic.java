package io.github.tfls.indexer;

import org.jetbrains.annotations.Nullable;

/** A problem reported by a parser or decoder. A null range means the problem applies to the whole file. */
public record Diagnostic(Severity severity, String message, @Nullable SourceRange range) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public static Diagnostic error(String message, @Nullable SourceRange range) {
        return new Diagnostic(Severity.ERROR, message, range);
    }

    public static Diagnostic warning(String message, @Nullable SourceRange range) {
        return new Diagnostic(Severity.WARNING, message, range);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
