package io.github.tfls.state;

import io.github.tfls.indexer.DocumentId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory table of known documents plus their canonical order: documents open in the editor first, in the order they
 * were opened, then every other document in the order it was first registered. Both orders are kept as their own
 * lists and never derived from map iteration. All access goes through a read-write lock; callers never do I/O while
 * holding it.
 */
public final class DocumentStore {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<DocumentId, Document> documents = new HashMap<>();
    private final List<DocumentId> order = new ArrayList<>();
    private final List<DocumentId> openOrder = new ArrayList<>();

    public @Nullable Document get(DocumentId id) {
        lock.readLock().lock();
        try {
            return documents.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(DocumentId id) {
        return get(id) != null;
    }

    /** Registers a closed document if unknown. Returns the current entry either way. */
    public Document register(DocumentId id) {
        var registered = compute(id, current -> current != null ? current : Document.discovered(id));
        assert registered != null;
        return registered;
    }

    /**
     * Atomically replaces the entry for {@code id}. The function receives null for unknown documents; returning null
     * leaves an unknown document unregistered. New entries are appended to the canonical order.
     */
    public @Nullable Document compute(DocumentId id, Function<@Nullable Document, @Nullable Document> fn) {
        lock.writeLock().lock();
        try {
            var current = documents.get(id);
            var next = fn.apply(current);
            if (next == null) {
                return current;
            }
            if (current == null) {
                order.add(id);
            }
            put(id, current, next);
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Applies {@code update} to a known document. Returns false if the document is unknown. */
    public boolean update(DocumentId id, DocumentUpdate update) {
        lock.writeLock().lock();
        try {
            var current = documents.get(id);
            if (current == null) {
                return false;
            }
            put(id, current, update.apply(current));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public @Nullable Document remove(DocumentId id) {
        return removeIf(id, current -> true);
    }

    /** Removes the entry for {@code id} only if it still satisfies {@code condition}, checked under the write lock. */
    public @Nullable Document removeIf(DocumentId id, Predicate<Document> condition) {
        lock.writeLock().lock();
        try {
            var current = documents.get(id);
            if (current == null || !condition.test(current)) {
                return null;
            }
            documents.remove(id);
            order.remove(id);
            openOrder.remove(id);
            return current;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Consistent copy of every document in canonical order. */
    public List<Document> snapshot() {
        lock.readLock().lock();
        try {
            var result = new ArrayList<Document>(order.size());
            for (var id : openOrder) {
                result.add(documents.get(id));
            }
            for (var id : order) {
                var document = documents.get(id);
                if (!document.open()) {
                    result.add(document);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void put(DocumentId id, @Nullable Document current, Document next) {
        boolean wasOpen = current != null && current.open();
        if (next.open() && !wasOpen) {
            openOrder.add(id);
        } else if (!next.open() && wasOpen) {
            openOrder.remove(id);
        }
        documents.put(id, next);
    }

    public List<Document> openDocuments() {
        return snapshot().stream().filter(Document::open).toList();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return documents.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
