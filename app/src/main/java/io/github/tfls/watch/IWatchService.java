package io.github.tfls.watch;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

public interface IWatchService extends AutoCloseable {
    default void start() {}

    /**
     * Dynamically add a listener to receive file system events.
     * @param listener The listener to add
     */
    default void addListener(Listener listener) {}

    /**
     * Remove a previously added listener.
     * @param listener The listener to remove
     */
    default void removeListener(Listener listener) {}

    @Override
    default void close() {}

    interface Listener {
        void onFilesChanged(EventBatch batch);

        default void onNoFilesChangedDuringPollInterval() {}
    }

    /** mutable since we will collect events until they stop arriving */
    class EventBatch {
        boolean isOverflowed;
        final Set<Path> files = new LinkedHashSet<>();

        public EventBatch() {}

        public EventBatch(boolean isOverflowed, Set<Path> files) {
            this.isOverflowed = isOverflowed;
            this.files.addAll(files);
        }

        public boolean isOverflowed() {
            return isOverflowed;
        }

        /** Absolute paths of every created, modified or deleted entry, files and directories alike. */
        public Set<Path> files() {
            return files;
        }

        @Override
        public String toString() {
            return "EventBatch{" + "isOverflowed=" + isOverflowed + ", files=" + files + '}';
        }
    }
}
