package io.github.tfls.walker;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Collects what the walker did: walked roots, discovered file count, and non-fatal errors. */
public final class WalkerCollector {

    public record WalkError(Path path, IOException error) {
        @Override
        public String toString() {
            return path + ": " + error;
        }
    }

    private final List<WalkError> errors = new CopyOnWriteArrayList<>();
    private final List<Path> walkedRoots = new CopyOnWriteArrayList<>();
    private final AtomicInteger discovered = new AtomicInteger();

    void recordError(Path path, IOException error) {
        errors.add(new WalkError(path, error));
    }

    void recordWalked(Path root) {
        walkedRoots.add(root);
    }

    void recordDiscovered() {
        discovered.incrementAndGet();
    }

    public List<WalkError> errors() {
        return List.copyOf(errors);
    }

    public List<Path> walkedRoots() {
        return List.copyOf(walkedRoots);
    }

    public int discoveredCount() {
        return discovered.get();
    }
}
