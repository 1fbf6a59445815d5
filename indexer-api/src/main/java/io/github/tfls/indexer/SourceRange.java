package io.github.tfls.indexer;

/** A half-open range: {@code start} is inclusive, {@code end} exclusive. */
public record SourceRange(SourcePos start, SourcePos end) {

    public SourceRange {
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Range end " + end + " precedes start " + start);
        }
    }

    public static SourceRange of(int startLine, int startChar, int endLine, int endChar) {
        return new SourceRange(new SourcePos(startLine, startChar), new SourcePos(endLine, endChar));
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + ")";
    }
}
