package io.github.tfls.indexer;

import java.util.List;
import java.util.Optional;

/** A block {@code type "label"... { body }}. The range spans from the type keyword to the closing brace. */
public record Block(String type, List<String> labels, List<Attribute> attributes, List<Block> blocks, SourceRange range) {

    public Block {
        labels = List.copyOf(labels);
        attributes = List.copyOf(attributes);
        blocks = List.copyOf(blocks);
    }

    public Optional<Attribute> attribute(String name) {
        return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    /** Display name as it reads in source, e.g. {@code resource "aws_instance" "web"}. */
    public String displayName() {
        var sb = new StringBuilder(type);
        for (var label : labels) {
            sb.append(" \"").append(label).append('"');
        }
        return sb.toString();
    }
}
