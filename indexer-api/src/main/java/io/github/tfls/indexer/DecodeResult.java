package io.github.tfls.indexer;

import java.util.List;

public record DecodeResult(List<Symbol> symbols, List<ModuleCall> moduleCalls, List<Diagnostic> diagnostics) {

    public static final DecodeResult EMPTY = new DecodeResult(List.of(), List.of(), List.of());

    public DecodeResult {
        symbols = List.copyOf(symbols);
        moduleCalls = List.copyOf(moduleCalls);
        diagnostics = List.copyOf(diagnostics);
    }
}
