package io.github.tfls.hcl;

import io.github.tfls.indexer.DecodeResult;
import io.github.tfls.indexer.Decoder;
import io.github.tfls.indexer.Diagnostic;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.ModuleCall;
import io.github.tfls.indexer.Symbol;
import io.github.tfls.indexer.SymbolKind;
import io.github.tfls.indexer.SyntaxTree;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Turns a syntax tree into workspace symbols and module calls. Top-level blocks become {@link SymbolKind#BLOCK}
 * symbols named as they read in source ({@code provider "github"}); top-level attributes, which only occur in variable
 * files, become {@link SymbolKind#ATTRIBUTE} symbols. Symbols come out in source order.
 */
public final class BlockDecoder implements Decoder {

    static final String MODULE_BLOCK = "module";
    static final String SOURCE_ATTRIBUTE = "source";

    @Override
    public DecodeResult decode(DocumentId document, SyntaxTree tree) {
        var symbols = new ArrayList<Symbol>();
        var moduleCalls = new ArrayList<ModuleCall>();
        var diagnostics = new ArrayList<Diagnostic>();

        for (var attribute : tree.attributes()) {
            symbols.add(new Symbol(attribute.name(), SymbolKind.ATTRIBUTE, attribute.range(), document));
        }
        for (var block : tree.blocks()) {
            symbols.add(new Symbol(block.displayName(), SymbolKind.BLOCK, block.range(), document));

            if (!block.type().equals(MODULE_BLOCK) || block.labels().size() != 1) {
                continue;
            }
            var name = block.labels().get(0);
            var source = block.attribute(SOURCE_ATTRIBUTE).orElse(null);
            if (source == null) {
                diagnostics.add(Diagnostic.warning("Module \"" + name + "\" has no source", block.range()));
                continue;
            }
            var literal = source.literalValue();
            if (literal == null) {
                diagnostics.add(
                        Diagnostic.warning("Module \"" + name + "\" source must be a literal string", source.range()));
            } else {
                moduleCalls.add(new ModuleCall(name, literal, block.range()));
            }
        }
        symbols.sort(Comparator.comparing(s -> s.range().start()));
        return new DecodeResult(symbols, moduleCalls, diagnostics);
    }
}
