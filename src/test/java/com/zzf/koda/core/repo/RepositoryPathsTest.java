package com.zzf.koda.core.repo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepositoryPathsTest {

    @TempDir
    Path root;

    @Test
    void shouldNormalizeStagingKeys() {
        assertEquals("src/App.java", RepositoryPaths.normalize("./src//App.java/"));
        assertEquals("src/App.java", RepositoryPaths.normalize("src\\App.java"));
    }

    @Test
    void shouldResolveInsideRoot() {
        assertEquals(root.resolve("a/b.txt").toAbsolutePath().normalize(), RepositoryPaths.resolve(root, "a/./b.txt"));
    }

    @Test
    void shouldRefuseEscapingPaths() {
        assertThrows(IllegalArgumentException.class, () -> RepositoryPaths.resolve(root, "../etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> RepositoryPaths.resolve(root, "/etc/passwd"));
    }

    @Test
    void shouldRelativizeWithForwardSlashes() {
        assertEquals("a/b.txt", RepositoryPaths.relativize(root, root.resolve("a").resolve("b.txt")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldRefuseLinkedDirectoryPointingOutside(@TempDir Path outside) throws Exception {
        Files.writeString(outside.resolve("secret.txt"), "TOP-SECRET", StandardCharsets.UTF_8);
        Files.createSymbolicLink(root.resolve("link"), outside);

        assertThrows(IllegalArgumentException.class, () -> RepositoryPaths.resolve(root, "link/secret.txt"));
        assertThrows(IllegalArgumentException.class, () -> RepositoryPaths.resolve(root, "link/new/file.txt"));
        assertFalse(RepositoryPaths.isContained(root, root.resolve("link/secret.txt")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldAllowLinksThatStayInsideRoot() throws Exception {
        Files.createDirectories(root.resolve("real"));
        Files.writeString(root.resolve("real/a.txt"), "a", StandardCharsets.UTF_8);
        Files.createSymbolicLink(root.resolve("alias"), root.resolve("real"));

        assertEquals(root.resolve("alias/a.txt").toAbsolutePath().normalize(), RepositoryPaths.resolve(root, "alias/a.txt"));
        assertTrue(RepositoryPaths.isContained(root, root.resolve("alias/missing/b.txt")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldRefuseDanglingLink() throws Exception {
        Files.createSymbolicLink(root.resolve("dangling"), root.resolve("nowhere"));

        assertThrows(IllegalArgumentException.class, () -> RepositoryPaths.resolve(root, "dangling"));
    }
}
