package io.github.tfls.indexer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Identity of a configuration document: a workspace root plus a path relative to it. This exists so that documents
 * discovered by the walker, opened by the editor, or reported by the file watcher compare equal regardless of how the
 * path was spelled. Equality is by canonical absolute path, so a module file reached through {@code ../} compares
 * equal to the same file reached from its own root.
 */
public final class DocumentId implements Comparable<DocumentId> {
    private final transient Path root;
    private final transient Path relPath;
    private final transient Path absPath;

    /** root must be absolute and pre-normalized; relPath is normalized here */
    @JsonCreator
    public DocumentId(@JsonProperty("root") Path root, @JsonProperty("relPath") Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = root;
        this.relPath = relPath.normalize();
        this.absPath = root.resolve(this.relPath).normalize();
    }

    public DocumentId(Path root, String relName) {
        this(root, Path.of(relName));
    }

    /** Identity for an absolute file path, expressed relative to the given workspace root. */
    public static DocumentId of(Path root, Path file) {
        var normalizedRoot = root.toAbsolutePath().normalize();
        var normalizedFile = file.toAbsolutePath().normalize();
        return new DocumentId(normalizedRoot, normalizedRoot.relativize(normalizedFile));
    }

    @JsonGetter("root")
    public Path getRoot() {
        return root;
    }

    @JsonGetter("relPath")
    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return absPath;
    }

    /** Directory containing the document, absolute. */
    @JsonIgnore
    public Path directory() {
        var parent = absPath.getParent();
        return parent == null ? root : parent;
    }

    @JsonIgnore
    public URI toUri() {
        return absPath.toUri();
    }

    @JsonIgnore
    public String getFileName() {
        return absPath.getFileName().toString();
    }

    public String read() throws IOException {
        return Files.readString(absPath);
    }

    public boolean exists() {
        return Files.exists(absPath);
    }

    @Override
    public int compareTo(DocumentId o) {
        return absPath.compareTo(o.absPath);
    }

    @Override
    public String toString() {
        return relPath.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentId other)) return false;
        return absPath.equals(other.absPath);
    }

    @Override
    public int hashCode() {
        return absPath.hashCode();
    }
}
