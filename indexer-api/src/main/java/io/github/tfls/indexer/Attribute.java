package io.github.tfls.indexer;

import org.jetbrains.annotations.Nullable;

/**
 * An attribute assignment {@code name = expression}. The expression is kept as source text; {@code literalValue} holds
 * the unquoted value when the expression is a plain string literal without interpolation, and null otherwise.
 */
public record Attribute(String name, String expression, @Nullable String literalValue, SourceRange range) {}
