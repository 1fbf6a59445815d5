package io.github.tfls.indexer;

import java.util.List;

/** Output of {@link Parser#parse}. The tree is always present, possibly partial when diagnostics contain errors. */
public record ParseResult(SyntaxTree tree, List<Diagnostic> diagnostics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
