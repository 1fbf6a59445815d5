package io.github.tfls.indexer;

/** Stable classification tag for an indexed declaration. */
public enum SymbolKind {
    /** A block such as {@code provider "github" { ... }}. */
    BLOCK,
    /** A top-level attribute such as {@code region = "eu-west-1"} in a variables file. */
    ATTRIBUTE
}
