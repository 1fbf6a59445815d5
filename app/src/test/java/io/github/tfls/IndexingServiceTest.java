package io.github.tfls;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tfls.indexer.SourceRange;
import io.github.tfls.indexer.Symbol;
import io.github.tfls.search.SymbolMatch;
import io.github.tfls.testutil.FileUtil;
import io.github.tfls.watch.IWatchService.EventBatch;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexingServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private Path root;
    private IndexingService service;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectories(tempDir.toAbsolutePath().normalize().resolve("workspace"));
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private IndexingService start(IndexerConfig config) {
        service = new IndexingService(root, config);
        service.start();
        return service;
    }

    private IndexingService start() {
        return start(IndexerConfig.defaults().withWorkers(2).withWatchFiles(false));
    }

    private List<String> symbolNames() {
        return service.state().allSymbols().stream().map(Symbol::name).toList();
    }

    private static List<String> names(List<SymbolMatch> matches) {
        return matches.stream().map(m -> m.symbol().name()).toList();
    }

    private void open(String relPath, String text) {
        assertTrue(service.state().openOrUpdateDocument(service.documentId(root.resolve(relPath)), text, 1));
    }

    @Test
    void testWorkspaceSymbolsInCanonicalOrder() throws Exception {
        // second.tf is on disk and walked before any document is opened
        FileUtil.write(root, "second.tf", "provider \"google\" {}\n");
        start();
        service.awaitScope(WAIT);
        assertEquals(List.of("provider \"google\""), symbolNames());

        open("first.tf", "provider \"github\" {}");
        open("second.tf", "provider \"google\" {}");
        open("blah/third.tf", "myblock \"custom\" {}");
        service.awaitIdle(WAIT);

        var all = service.search().search("");
        assertEquals(List.of("provider \"github\"", "provider \"google\"", "myblock \"custom\""), names(all));
        assertEquals(SourceRange.of(0, 0, 0, 20), all.get(0).symbol().range());
        assertEquals(SourceRange.of(0, 0, 0, 20), all.get(1).symbol().range());
        assertEquals(SourceRange.of(0, 0, 0, 19), all.get(2).symbol().range());
        assertEquals(root.resolve("blah/third.tf"), all.get(2).symbol().document().absPath());

        assertEquals(List.of("myblock \"custom\""), names(service.search().search("myb")));

        var lsp = service.search().searchWorkspaceSymbols("myb");
        assertEquals(1, lsp.size());
        assertEquals(
                root.resolve("blah/third.tf").toUri().toString(),
                lsp.get(0).getLocation().getLeft().getUri());
    }

    @Test
    void testWalkIndexesWorkspaceAndWaitIsRepeatable() throws Exception {
        FileUtil.write(root, "main.tf", "provider \"aws\" {\n  region = \"us-east-1\"\n}\n");
        FileUtil.write(root, "network.tf.json", "{\"resource\": {\"aws_vpc\": {\"main\": {\"cidr_block\": \"10.0.0.0/16\"}}}}");
        FileUtil.write(root, "prod.tfvars", "instance_count = 3\n");
        FileUtil.write(root, ".terraform/modules/x/main.tf", "provider \"cached\" {}\n");
        FileUtil.write(root, "README.md", "# not configuration\n");
        start();

        service.awaitScope(WAIT);

        assertEquals(List.of("provider \"aws\"", "resource \"aws_vpc\" \"main\"", "instance_count"), symbolNames());
        // nothing outstanding, so even a zero deadline succeeds
        service.awaitScope(Duration.ZERO);
        assertEquals(List.of(root), service.collector().walkedRoots());
        assertTrue(service.collector().errors().isEmpty());
    }

    @Test
    void testDeletedWalkedFileLosesItsSymbols() throws Exception {
        var main = FileUtil.write(root, "main.tf", "provider \"github\" {}\n");
        FileUtil.write(root, "other.tf", "provider \"google\" {}\n");
        start();
        service.awaitScope(WAIT);

        Files.delete(main);
        service.onFilesChanged(new EventBatch(false, Set.of(main)));
        service.awaitScope(WAIT);

        assertEquals(List.of("provider \"google\""), symbolNames());
        assertTrue(service.state().document(service.documentId(main)).isEmpty());
    }

    @Test
    void testChangedFileIsReindexed() throws Exception {
        var main = FileUtil.write(root, "main.tf", "provider \"github\" {}\n");
        start();
        service.awaitScope(WAIT);

        Files.writeString(main, "provider \"gitlab\" {}\nprovider \"gitea\" {}\n");
        service.onFilesChanged(new EventBatch(false, Set.of(main)));
        service.awaitScope(WAIT);

        assertEquals(List.of("provider \"gitlab\"", "provider \"gitea\""), symbolNames());
    }

    @Test
    void testReopeningWithEditedTextReplacesSymbols() throws Exception {
        var main = FileUtil.write(root, "main.tf", "provider \"github\" {}\n");
        start();
        service.awaitScope(WAIT);
        var id = service.documentId(main);

        service.state().openOrUpdateDocument(id, "provider \"github\" {}\nprovider \"extra\" {}\n", 1);
        service.awaitScope(main, WAIT);
        service.state().closeDocument(id);
        assertEquals(List.of("provider \"github\"", "provider \"extra\""), symbolNames());

        service.state().openOrUpdateDocument(id, "module \"net\" {\n  source = \"./net\"\n}\n", 1);
        service.awaitScope(main, WAIT);

        assertEquals(List.of("module \"net\""), symbolNames());
    }

    @Test
    void testNewDirectoryIsWalked() throws Exception {
        FileUtil.write(root, "main.tf", "provider \"github\" {}\n");
        start();
        service.awaitScope(WAIT);

        FileUtil.write(root, "envs/prod/main.tf", "provider \"prod\" {}\n");
        service.onFilesChanged(new EventBatch(false, Set.of(root.resolve("envs"))));
        service.awaitScope(WAIT);

        assertEquals(List.of("provider \"github\"", "provider \"prod\""), symbolNames());
    }

    @Test
    void testIgnoredAndForeignPathsAreSkipped() throws Exception {
        start();
        service.awaitScope(WAIT);

        var cached = FileUtil.write(root, ".terraform/modules/x/main.tf", "provider \"cached\" {}\n");
        var readme = FileUtil.write(root, "README.md", "text\n");
        var foreign = FileUtil.write(tempDir, "outside.tf", "provider \"foreign\" {}\n");
        service.onFilesChanged(new EventBatch(false, Set.of(cached, readme, foreign)));
        service.awaitScope(WAIT);

        assertEquals(List.of(), symbolNames());
        assertTrue(service.state().documents().isEmpty());
    }

    @Test
    void testOverflowTriggersRescan() throws Exception {
        var old = FileUtil.write(root, "old.tf", "provider \"old\" {}\n");
        start();
        service.awaitScope(WAIT);

        Files.delete(old);
        FileUtil.write(root, "new.tf", "provider \"new\" {}\n");
        service.onFilesChanged(new EventBatch(true, Set.of()));
        service.awaitScope(WAIT);

        assertEquals(List.of("provider \"new\""), symbolNames());
    }

    @Test
    void testLocalModulesAreIndexedAndCyclesTerminate() throws Exception {
        FileUtil.write(root, "main.tf", "module \"x\" {\n  source = \"../mods/x\"\n}\n");
        var mods = tempDir.toAbsolutePath().normalize().resolve("mods");
        FileUtil.write(mods, "x/main.tf", "module \"y\" {\n  source = \"../y\"\n}\n");
        FileUtil.write(mods, "y/main.tf", "module \"x\" {\n  source = \"../x\"\n}\n");
        start();

        service.awaitScope(WAIT);

        var documents = service.state().documents().stream()
                .map(d -> d.id().absPath())
                .toList();
        assertEquals(
                List.of(root.resolve("main.tf"), mods.resolve("x/main.tf"), mods.resolve("y/main.tf")), documents);
        assertEquals(List.of("module \"x\"", "module \"y\"", "module \"x\""), symbolNames());
    }

    @Test
    void testMissingRootIsCollectedNotFatal() throws Exception {
        root = tempDir.toAbsolutePath().normalize().resolve("does-not-exist");
        start();

        service.awaitScope(WAIT);

        assertEquals(1, service.collector().errors().size());
        assertEquals(List.of(), service.search().search(""));
    }

    @Test
    void testExportSymbolsJson() throws Exception {
        start();
        open("first.tf", "provider \"github\" {}");
        service.awaitIdle(WAIT);

        var tree = new ObjectMapper().readTree(service.exportSymbolsJson());

        assertEquals(1, tree.size());
        var symbol = tree.get(0);
        assertEquals("provider \"github\"", symbol.get("name").asText());
        assertEquals("BLOCK", symbol.get("kind").asText());
        assertEquals(20, symbol.get("range").get("end").get("character").asInt());
        assertEquals("first.tf", symbol.get("document").get("relPath").asText());
    }

    @Test
    void testStartTwiceIsRejected() {
        start();
        assertEquals(root, service.root());
        assertFalse(service.config().watchFiles());
        assertThrows(IllegalStateException.class, () -> service.start());
    }

    @Test
    void testWatchedChangesAreIndexed() throws Exception {
        start(IndexerConfig.defaults().withWorkers(2).withWatchFiles(true));
        service.awaitScope(WAIT);
        // let the watcher register the root
        Thread.sleep(500);

        FileUtil.write(root, "watched.tf", "provider \"watched\" {}\n");

        var deadline = System.currentTimeMillis() + 10_000;
        while (service.search().search("watched").isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(List.of("provider \"watched\""), names(service.search().search("watched")));
    }
}
