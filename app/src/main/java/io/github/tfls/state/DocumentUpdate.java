package io.github.tfls.state;

/**
 * A state fragment computed by a job, applied to whatever the document looks like at install time. Returning the
 * argument unchanged leaves the document alone.
 */
@FunctionalInterface
public interface DocumentUpdate {
    Document apply(Document current);
}
