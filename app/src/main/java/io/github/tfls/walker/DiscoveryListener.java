package io.github.tfls.walker;

import io.github.tfls.indexer.DocumentId;
import java.nio.file.Path;
import java.util.Set;

/** Receives each configuration file the walker finds, with the scopes of the walk that found it. */
@FunctionalInterface
public interface DiscoveryListener {
    void onDiscovered(DocumentId document, Set<Path> scopes);
}
