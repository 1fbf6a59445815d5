package io.github.tfls.indexer;

/**
 * Turns file content into a syntax tree. Implementations must be pure and thread-safe: the indexing pipeline calls
 * them concurrently from several workers. Syntax problems are reported as diagnostics, never thrown.
 */
public interface Parser {

    ParseResult parse(DocumentId document, String content);
}
