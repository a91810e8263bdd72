package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.change.ChangeManager;
import com.zzf.koda.core.change.ChangeType;
import com.zzf.koda.core.repo.LocalRepositoryAccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileToolsTest {

    @TempDir
    Path root;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();
    private ChangeManager changes;
    private Tool.Context ctx;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/Main.java"), "class Main {}", StandardCharsets.UTF_8);
        LocalRepositoryAccess repository = new LocalRepositoryAccess(root);
        changes = new ChangeManager("t1", repository);
        ctx = Tool.Context.builder()
                .taskID("t1")
                .phase(Phase.EXECUTING)
                .repository(repository)
                .changeManager(changes)
                .build();
    }

    @Test
    void shouldStageWriteAndLeaveDiskUntouched() {
        ObjectNode args = mapper.createObjectNode();
        args.put("path", root.resolve("src/Main.java").toString());
        args.put("content", "class Main { int x; }");

        Tool.Result result = new WriteTool(resourceLoader).execute(args, ctx).join();

        assertEquals("Staged modify of 'src/Main.java' for approval.", result.getOutput());
        assertEquals(ChangeType.MODIFY, changes.get("src/Main.java").orElseThrow().getChangeType());
        assertEquals("class Main {}", readDisk("src/Main.java"));
    }

    @Test
    void shouldStageDeleteAndKeepFileUntilApproved() {
        Tool.Result result = new DeleteTool(resourceLoader).execute(path("src/Main.java"), ctx).join();

        assertEquals("Staged delete of 'src/Main.java' for approval.", result.getOutput());
        assertTrue(Files.exists(root.resolve("src/Main.java")));
        assertEquals(1, changes.size());
    }

    @Test
    void shouldDropStagedCreateOnDelete() {
        changes.stageWrite("src/Tmp.java", "class Tmp {}");

        Tool.Result result = new DeleteTool(resourceLoader).execute(path("src/Tmp.java"), ctx).join();

        assertTrue(result.getOutput().startsWith("Dropped the staged creation"));
        assertTrue(changes.isEmpty());
    }

    @Test
    void shouldFailToDeleteMissingFile() {
        assertThrows(CompletionException.class,
                () -> new DeleteTool(resourceLoader).execute(path("missing.txt"), ctx).join());
    }

    @Test
    void shouldListDirectoryWithStagedEntries() {
        changes.stageWrite("src/util/Strings.java", "class Strings {}");

        String output = new ListTool(resourceLoader).execute(path("src"), ctx).join().getOutput();

        assertEquals("Main.java\nutil/", output);
    }

    @Test
    void shouldReportEmptyDirectory() throws Exception {
        Files.createDirectories(root.resolve("empty"));

        String output = new ListTool(resourceLoader).execute(path("empty"), ctx).join().getOutput();

        assertEquals("Directory 'empty' is empty.", output);
    }

    @Test
    void shouldOnlyOfferWriteToolsWhileExecuting() {
        WriteTool write = new WriteTool(resourceLoader);

        assertTrue(write.definition().isCallableIn(Phase.EXECUTING));
        assertFalse(write.definition().isCallableIn(Phase.PLANNING));
        assertTrue(new ListTool(resourceLoader).definition().isCallableIn(Phase.UNDERSTANDING));
    }

    private ObjectNode path(String path) {
        ObjectNode args = mapper.createObjectNode();
        args.put("path", path);
        return args;
    }

    private String readDisk(String path) {
        try {
            return Files.readString(root.resolve(path), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
