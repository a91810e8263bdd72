package com.zzf.koda.core.repo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Storage behind a task's repository. Paths are repository-relative.
 * {@link #write} and {@link #delete} are only called while applying an approved change set.
 */
public interface RepositoryAccess {

    Path root();

    Optional<String> read(String path) throws IOException;

    boolean exists(String path);

    void write(String path, String content) throws IOException;

    void delete(String path) throws IOException;

    default Path resolve(String path) {
        return RepositoryPaths.resolve(root(), path);
    }
}
