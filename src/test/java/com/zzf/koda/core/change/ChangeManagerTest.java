package com.zzf.koda.core.change;

import com.zzf.koda.core.repo.LocalRepositoryAccess;
import com.zzf.koda.core.repo.RepositoryAccess;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChangeManagerTest {

    @Test
    void shouldStageCreateWithoutTouchingDisk(@TempDir Path root) {
        ChangeManager manager = new ChangeManager("t1", new LocalRepositoryAccess(root));

        StagedChange change = manager.stageWrite("src/App.java", "class App {}");

        assertEquals(ChangeType.CREATE, change.getChangeType());
        assertNull(change.getOriginalContent());
        assertFalse(Files.exists(root.resolve("src/App.java")));
        assertEquals(1, manager.size());
    }

    @Test
    void shouldKeepFirstOriginalWhenRestaged(@TempDir Path root) throws IOException {
        Files.writeString(root.resolve("a.txt"), "v0", StandardCharsets.UTF_8);
        ChangeManager manager = new ChangeManager("t1", new LocalRepositoryAccess(root));

        manager.stageWrite("a.txt", "v1");
        StagedChange second = manager.stageWrite("./a.txt", "v2");

        assertEquals(ChangeType.MODIFY, second.getChangeType());
        assertEquals("v0", second.getOriginalContent());
        assertEquals("v2", second.getNewContent());
        assertEquals(1, manager.getChangeSet().size());
    }

    @Test
    void shouldDropStagedCreateWhenDeleted(@TempDir Path root) {
        ChangeManager manager = new ChangeManager("t1", new LocalRepositoryAccess(root));
        manager.stageWrite("new.txt", "hello");

        Optional<StagedChange> result = manager.stageDelete("new.txt");

        assertTrue(result.isEmpty());
        assertTrue(manager.isEmpty());
    }

    @Test
    void shouldStageDeleteWithOriginalContent(@TempDir Path root) throws IOException {
        Files.writeString(root.resolve("old.txt"), "bye", StandardCharsets.UTF_8);
        ChangeManager manager = new ChangeManager("t1", new LocalRepositoryAccess(root));

        StagedChange change = manager.stageDelete("old.txt").orElseThrow();

        assertEquals(ChangeType.DELETE, change.getChangeType());
        assertEquals("bye", change.getOriginalContent());
        assertEquals("", change.getNewContent());
        assertTrue(Files.exists(root.resolve("old.txt")));
    }

    @Test
    void shouldRejectDeleteOfMissingFile(@TempDir Path root) {
        ChangeManager manager = new ChangeManager("t1", new LocalRepositoryAccess(root));

        assertThrows(IllegalArgumentException.class, () -> manager.stageDelete("missing.txt"));
    }

    @Test
    void shouldApplyCreatesModifiesAndDeletes(@TempDir Path root) throws IOException {
        Files.writeString(root.resolve("keep.txt"), "old", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("gone.txt"), "x", StandardCharsets.UTF_8);
        ChangeManager manager = new ChangeManager("t1", new LocalRepositoryAccess(root));
        manager.stageWrite("keep.txt", "new");
        manager.stageWrite("dir/created.txt", "made");
        manager.stageDelete("gone.txt");

        ApplyResult result = manager.apply();

        assertEquals(List.of("dir/created.txt", "gone.txt", "keep.txt"), result.getApplied());
        assertTrue(result.getFailed().isEmpty());
        assertEquals("new", Files.readString(root.resolve("keep.txt")));
        assertEquals("made", Files.readString(root.resolve("dir/created.txt")));
        assertFalse(Files.exists(root.resolve("gone.txt")));
        assertTrue(manager.isEmpty());
    }

    @Test
    void shouldNeverWriteAfterDiscard() throws IOException {
        RepositoryAccess repository = mock(RepositoryAccess.class);
        when(repository.read(anyString())).thenReturn(Optional.empty());
        ChangeManager manager = new ChangeManager("t1", repository);
        manager.stageWrite("a.txt", "a");
        manager.stageWrite("b.txt", "b");

        assertEquals(2, manager.discard());
        ApplyResult result = manager.apply();

        assertTrue(result.isEmpty());
        verify(repository, never()).write(anyString(), anyString());
        verify(repository, never()).delete(anyString());
    }

    @Test
    void shouldContinuePastFailedPathWithoutRollback() throws IOException {
        RepositoryAccess repository = mock(RepositoryAccess.class);
        when(repository.read(anyString())).thenReturn(Optional.empty());
        doThrow(new IOException("disk full")).when(repository).write("b.txt", "b");
        ChangeManager manager = new ChangeManager("t1", repository);
        manager.stageWrite("a.txt", "a");
        manager.stageWrite("b.txt", "b");
        manager.stageWrite("c.txt", "c");

        ApplyResult result = manager.apply();

        assertTrue(result.isPartial());
        assertEquals(List.of("a.txt", "c.txt"), result.getApplied());
        assertEquals(1, result.getFailed().size());
        assertEquals("b.txt", result.getFailed().get(0).getPath());
        assertEquals("disk full", result.getFailed().get(0).getReason());
        verify(repository).write("a.txt", "a");
        verify(repository).write("c.txt", "c");
        assertEquals(1, manager.size());
    }

    @Test
    void shouldSummarizeStagedChanges(@TempDir Path root) throws IOException {
        Files.writeString(root.resolve("m.txt"), "m", StandardCharsets.UTF_8);
        ChangeManager manager = new ChangeManager("t1", new LocalRepositoryAccess(root));
        assertEquals("No staged changes.", manager.summary());

        manager.stageWrite("m.txt", "changed");
        manager.stageWrite("n.txt", "created");

        assertEquals("Staged: 1 file(s) to create, 1 file(s) to modify", manager.summary());
        String diff = manager.diff();
        assertTrue(diff.indexOf("+++ b/m.txt") < diff.indexOf("+++ b/n.txt"));
        assertTrue(diff.contains("--- /dev/null\n+++ b/n.txt"));
    }
}
