package me.golemcore.nightpilot.adapter.outbound.storage;

import me.golemcore.nightpilot.infrastructure.config.NightPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "jobs";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        NightPilotProperties properties = new NightPilotProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesWorkspaceDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("jobs")));
        assertTrue(Files.isDirectory(tempDir.resolve("prompts")));
        assertEquals(tempDir.toAbsolutePath().normalize(), storageAdapter.getBasePath());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json").get());
    }

    @Test
    void appendText_accumulatesLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, "executions/job-1.jsonl", "{\"a\":1}\n").get();
        storageAdapter.appendText(TEST_DIR, "executions/job-1.jsonl", "{\"a\":2}\n").get();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", storageAdapter.getText(TEST_DIR, "executions/job-1.jsonl").get());
    }

    @Test
    void putTextAtomic_replacesContentAndKeepsBackup() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "jobs.json", "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, "jobs.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TEST_DIR, "jobs.json").get());
        assertEquals("v1", Files.readString(tempDir.resolve("jobs/jobs.json.bak"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(tempDir.resolve("jobs/jobs.json.tmp")));
    }

    @Test
    void putTextAtomic_withoutBackupLeavesNoBakFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v1", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v2", false).get();

        assertFalse(Files.exists(tempDir.resolve("jobs/state.json.bak")));
    }

    @Test
    void deleteObject_removesFile() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, "to-delete.txt", "content").get();

        storageAdapter.deleteObject(TEST_DIR, "to-delete.txt").get();

        assertNull(storageAdapter.getText(TEST_DIR, "to-delete.txt").get());
    }

    @Test
    void pathTraversal_isBlocked() {
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../outside.txt").get());

        assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
    }
}
