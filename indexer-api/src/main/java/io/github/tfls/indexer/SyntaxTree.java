package io.github.tfls.indexer;

import java.util.List;

/** Top-level body of a configuration file. */
public record SyntaxTree(List<Attribute> attributes, List<Block> blocks) {

    public static final SyntaxTree EMPTY = new SyntaxTree(List.of(), List.of());

    public SyntaxTree {
        attributes = List.copyOf(attributes);
        blocks = List.copyOf(blocks);
    }
}
