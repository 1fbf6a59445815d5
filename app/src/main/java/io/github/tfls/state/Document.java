package io.github.tfls.state;

import io.github.tfls.indexer.Diagnostic;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.ModuleCall;
import io.github.tfls.indexer.ParseResult;
import io.github.tfls.indexer.Symbol;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable view of one document. Jobs read a snapshot, compute without locks, and install a {@link DocumentUpdate}
 * built from the {@code with*} methods.
 *
 * @param version editor version while open; {@link #NO_VERSION} for closed, disk-tracked documents
 * @param text latest known text; null until the document has been read from disk or opened
 * @param indexingFailure message of the last failed parse/decode job, null when the last one succeeded
 */
public record Document(
        DocumentId id,
        boolean open,
        int version,
        @Nullable String text,
        @Nullable ParseResult parse,
        List<Symbol> symbols,
        List<ModuleCall> moduleCalls,
        List<Diagnostic> diagnostics,
        @Nullable String indexingFailure) {

    public static final int NO_VERSION = -1;

    public Document {
        symbols = List.copyOf(symbols);
        moduleCalls = List.copyOf(moduleCalls);
        diagnostics = List.copyOf(diagnostics);
    }

    static Document discovered(DocumentId id) {
        return new Document(id, false, NO_VERSION, null, null, List.of(), List.of(), List.of(), null);
    }

    Document opened(String newText, int newVersion) {
        return new Document(id, true, newVersion, newText, parse, symbols, moduleCalls, diagnostics, indexingFailure);
    }

    Document closed() {
        return new Document(id, false, NO_VERSION, text, parse, symbols, moduleCalls, diagnostics, indexingFailure);
    }

    Document withDiskText(String diskText) {
        return new Document(id, open, version, diskText, parse, symbols, moduleCalls, diagnostics, indexingFailure);
    }

    Document withParse(ParseResult newParse) {
        return new Document(id, open, version, text, newParse, symbols, moduleCalls, diagnostics, indexingFailure);
    }

    Document withDecoded(List<Symbol> newSymbols, List<ModuleCall> newModuleCalls, List<Diagnostic> newDiagnostics) {
        return new Document(id, open, version, text, parse, newSymbols, newModuleCalls, newDiagnostics, null);
    }

    Document withFailure(String failure, boolean clearSymbols) {
        return new Document(
                id,
                open,
                version,
                text,
                parse,
                clearSymbols ? List.of() : symbols,
                clearSymbols ? List.of() : moduleCalls,
                diagnostics,
                failure);
    }

    public boolean hasFailed() {
        return indexingFailure != null;
    }
}
