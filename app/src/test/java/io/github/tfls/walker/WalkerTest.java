package io.github.tfls.walker;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.github.tfls.indexer.DocumentId;
import io.github.tfls.jobs.ScopeTracker;
import io.github.tfls.testutil.FileUtil;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WalkerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private Path root;
    private ScopeTracker tracker;
    private WalkerCollector collector;
    private Walker walker;
    private final List<DocumentId> discovered = new CopyOnWriteArrayList<>();
    private final Map<DocumentId, Set<Path>> scopesByDocument = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        root = tempDir.toAbsolutePath().normalize();
        tracker = new ScopeTracker();
        collector = new WalkerCollector();
        walker = new Walker(root, Set.of(".terraform", ".git"), tracker, collector);
    }

    @AfterEach
    void tearDown() {
        walker.close();
    }

    private void start() {
        walker.start((id, scopes) -> {
            discovered.add(id);
            scopesByDocument.put(id, scopes);
        });
    }

    private List<String> discoveredNames() {
        return discovered.stream().map(id -> id.getRelPath().toString().replace('\\', '/')).toList();
    }

    @Test
    void testDiscoversConfigFilesInDeterministicOrder() throws Exception {
        FileUtil.write(root, "b.tf", "");
        FileUtil.write(root, "a.tf", "");
        FileUtil.write(root, "sub/c.tf.json", "{}");
        FileUtil.write(root, "sub/deeper/d.tfvars", "");
        FileUtil.write(root, "README.md", "");
        FileUtil.write(root, "z.tofu", "");
        start();

        assertTrue(walker.enqueue(root, Set.of(root)));
        tracker.await(root, WAIT);

        assertEquals(List.of("a.tf", "b.tf", "z.tofu", "sub/c.tf.json", "sub/deeper/d.tfvars"), discoveredNames());
        assertEquals(5, collector.discoveredCount());
        assertEquals(List.of(root), collector.walkedRoots());
    }

    @Test
    void testSkipsIgnoredDirectoriesAndFiles() throws Exception {
        FileUtil.write(root, "main.tf", "");
        FileUtil.write(root, ".terraform/modules/x/main.tf", "");
        FileUtil.write(root, ".git/hooks/x.tf", "");
        FileUtil.write(root, ".hidden.tf", "");
        FileUtil.write(root, "backup.tf~", "");
        FileUtil.write(root, "#autosave.tf#", "");
        start();

        walker.enqueue(root, Set.of(root));
        tracker.await(root, WAIT);

        assertEquals(List.of("main.tf"), discoveredNames());
    }

    @Test
    void testLeaseCoversQueuedWalkBeforeItStarts() throws Exception {
        FileUtil.write(root, "main.tf", "");

        walker.enqueue(root, Set.of(root));
        assertEquals(1, tracker.outstanding(root), "a queued walk counts before the walker thread picks it up");

        start();
        tracker.await(root, WAIT);
        assertEquals(List.of("main.tf"), discoveredNames());
    }

    @Test
    void testCoveredDirectoryIsNotWalkedAgain() throws Exception {
        FileUtil.write(root, "mod/main.tf", "");
        start();

        assertTrue(walker.enqueue(root, Set.of(root)));
        assertFalse(walker.enqueue(root.resolve("mod"), Set.of(root)), "already covered by the root walk");
        assertFalse(walker.enqueue(root, Set.of(root)));
        tracker.await(root, WAIT);

        assertEquals(List.of("mod/main.tf"), discoveredNames());

        assertTrue(walker.enqueue(root, Set.of(root), true), "a forced walk runs again");
        tracker.await(root, WAIT);
        assertEquals(List.of("mod/main.tf", "mod/main.tf"), discoveredNames());
    }

    @Test
    void testDiscoveredFilesCarryTheWalkScopes() throws Exception {
        var moduleDir = Files.createDirectories(root.resolve("modules/net"));
        FileUtil.write(moduleDir, "main.tf", "");
        var caller = root.resolve("caller.tf");
        start();

        walker.enqueue(moduleDir, Set.of(caller));
        tracker.await(moduleDir, WAIT);

        var id = DocumentId.of(root, moduleDir.resolve("main.tf"));
        assertEquals(Set.of(caller, moduleDir), scopesByDocument.get(id));
    }

    @Test
    void testMissingRootIsCollectedAsError() throws Exception {
        start();
        var missing = root.resolve("nope");

        assertTrue(walker.enqueue(missing, Set.of(root)));
        tracker.await(root, WAIT);

        assertEquals(1, collector.errors().size());
        assertEquals(missing, collector.errors().get(0).path());
        assertEquals(List.of(), discoveredNames());
    }

    @Test
    void testUnreadableDirectoryDoesNotStopSiblings() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        FileUtil.write(root, "a/main.tf", "");
        FileUtil.write(root, "locked/secret.tf", "");
        FileUtil.write(root, "z/main.tf", "");
        var locked = root.resolve("locked");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            start();
            walker.enqueue(root, Set.of(root));
            tracker.await(root, WAIT);

            var names = discoveredNames();
            assertTrue(names.contains("a/main.tf"));
            assertTrue(names.contains("z/main.tf"));
            if (!Files.isReadable(locked)) {
                assertFalse(names.contains("locked/secret.tf"));
                assertTrue(collector.errors().stream().anyMatch(e -> e.path().equals(locked)));
            }
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void testCloseReleasesQueuedWalks() {
        walker.enqueue(root, Set.of(root));
        assertEquals(1, tracker.outstanding(root));

        walker.close();

        assertEquals(0, tracker.outstanding(root));
        assertFalse(walker.enqueue(root.resolve("later"), Set.of(root)));
    }
}
