package io.github.tfls.indexer;

/** Turns a syntax tree into symbols and module references. Same purity and thread-safety contract as {@link Parser}. */
public interface Decoder {

    DecodeResult decode(DocumentId document, SyntaxTree tree);
}
