package io.github.tfls.indexer;

/** Zero-based line and character offset within a document's text. */
public record SourcePos(int line, int character) implements Comparable<SourcePos> {

    public SourcePos {
        if (line < 0 || character < 0) {
            throw new IllegalArgumentException("Negative position " + line + ":" + character);
        }
    }

    @Override
    public int compareTo(SourcePos other) {
        int cmp = Integer.compare(line, other.line);
        return cmp != 0 ? cmp : Integer.compare(character, other.character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
