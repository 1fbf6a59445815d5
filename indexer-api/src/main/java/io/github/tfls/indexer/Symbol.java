package io.github.tfls.indexer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One indexed declaration. The range is expressed against the document text the decoder consumed; symbols are never
 * mutated, a document's symbol list is replaced as a whole.
 */
public record Symbol(
        @JsonProperty("name") String name,
        @JsonProperty("kind") SymbolKind kind,
        @JsonProperty("range") SourceRange range,
        @JsonProperty("document") DocumentId document) {

    public Symbol {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    @Override
    public String toString() {
        return name + " @ " + document + range;
    }
}
