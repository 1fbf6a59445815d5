package io.github.tfls.exception;

/** A parse or decode step failed for reasons other than a syntax error in the document. */
public class IndexingException extends RuntimeException {
    public IndexingException(String activity, Throwable error) {
        super("Indexing error while " + activity + ": " + error.getMessage(), error);
    }
}
