package io.github.tfls.search;

import io.github.tfls.indexer.Symbol;

/** A search hit. {@code score} follows {@link FuzzyMatcher}: lower is better. */
public record SymbolMatch(Symbol symbol, int score) {}
