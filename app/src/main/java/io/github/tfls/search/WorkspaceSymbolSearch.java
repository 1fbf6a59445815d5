package io.github.tfls.search;

import io.github.tfls.indexer.SourceRange;
import io.github.tfls.indexer.Symbol;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

/**
 * Fuzzy search over the symbols currently indexed. Reads a snapshot and never waits for indexing, so results reflect
 * whatever has been installed so far.
 */
public final class WorkspaceSymbolSearch {
    private static final Logger logger = LogManager.getLogger(WorkspaceSymbolSearch.class);

    private final Supplier<List<Symbol>> symbols;

    /** @param symbols supplies every symbol in canonical document order */
    public WorkspaceSymbolSearch(Supplier<List<Symbol>> symbols) {
        this.symbols = symbols;
    }

    /**
     * Matches sorted by score, ties kept in canonical order. A blank query returns every symbol with score 0.
     */
    public List<SymbolMatch> search(String query) {
        var matcher = new FuzzyMatcher(query);
        var matches = new ArrayList<SymbolMatch>();
        for (var symbol : symbols.get()) {
            int score = matcher.score(symbol.name());
            if (score != Integer.MAX_VALUE) {
                matches.add(new SymbolMatch(symbol, score));
            }
        }
        // List.sort is stable
        matches.sort(Comparator.comparingInt(SymbolMatch::score));
        logger.debug("Query '{}' matched {} symbols", query, matches.size());
        return matches;
    }

    /** {@link #search} formatted for a {@code workspace/symbol} response. */
    public List<WorkspaceSymbol> searchWorkspaceSymbols(String query) {
        return search(query).stream().map(m -> toWorkspaceSymbol(m.symbol())).toList();
    }

    static WorkspaceSymbol toWorkspaceSymbol(Symbol symbol) {
        var uri = symbol.document().toUri().toString();
        return new WorkspaceSymbol(
                symbol.name(), toLspKind(symbol), Either.forLeft(new Location(uri, toLspRange(symbol.range()))));
    }

    static SymbolKind toLspKind(Symbol symbol) {
        return switch (symbol.kind()) {
            case BLOCK -> SymbolKind.Class;
            case ATTRIBUTE -> SymbolKind.Property;
        };
    }

    static Range toLspRange(SourceRange range) {
        return new Range(
                new Position(range.start().line(), range.start().character()),
                new Position(range.end().line(), range.end().character()));
    }
}
