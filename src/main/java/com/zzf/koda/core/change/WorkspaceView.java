package com.zzf.koda.core.change;

import com.zzf.koda.core.repo.RepositoryAccess;
import com.zzf.koda.core.repo.RepositoryPaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Read-only view of a task's repository with its staged changes laid over it: staged writes
 * replace file content, staged deletes hide files and staged creates appear as files.
 */
public class WorkspaceView {

    private static final Set<String> IGNORED_DIRS = Set.of(
            ".git", "node_modules", "target", "build", "dist", "__pycache__", ".venv", "venv", ".idea");

    private final RepositoryAccess repository;
    private final ChangeManager changes;

    public WorkspaceView(RepositoryAccess repository, ChangeManager changes) {
        this.repository = repository;
        this.changes = changes;
    }

    public Path root() {
        return repository.root();
    }

    public Optional<String> read(String path) throws IOException {
        Optional<StagedChange> staged = changes.get(path);
        if (staged.isPresent()) {
            StagedChange change = staged.get();
            return change.getChangeType() == ChangeType.DELETE ? Optional.empty() : Optional.of(change.getNewContent());
        }
        return repository.read(RepositoryPaths.normalize(path));
    }

    public boolean isDirectory(String path) {
        String key = RepositoryPaths.normalize(path);
        if (Files.isDirectory(repository.resolve(key))) {
            return true;
        }
        String prefix = dirPrefix(key);
        for (StagedChange change : changes.getChangeSet()) {
            if (change.getChangeType() != ChangeType.DELETE && change.getPath().startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Direct children of a directory, sorted, directories suffixed with {@code /}.
     */
    public List<String> list(String dir) throws IOException {
        String key = RepositoryPaths.normalize(dir);
        Path target = repository.resolve(key);
        String prefix = dirPrefix(key);
        Set<String> entries = new TreeSet<>();
        if (Files.isDirectory(target)) {
            try (Stream<Path> stream = Files.list(target)) {
                stream.forEach(p -> {
                    String name = p.getFileName().toString();
                    if (Files.isDirectory(p)) {
                        entries.add(name + "/");
                    } else if (!isStagedDelete(prefix + name)) {
                        entries.add(name);
                    }
                });
            }
        }
        for (StagedChange change : changes.getChangeSet()) {
            if (change.getChangeType() == ChangeType.DELETE || !change.getPath().startsWith(prefix)) {
                continue;
            }
            String rest = change.getPath().substring(prefix.length());
            int slash = rest.indexOf('/');
            entries.add(slash < 0 ? rest : rest.substring(0, slash + 1));
        }
        return new ArrayList<>(entries);
    }

    /**
     * Every visible file under a path (or the file itself), repository-relative, sorted.
     * VCS metadata and dependency/build output directories are skipped.
     */
    public List<String> files(String path) throws IOException {
        String key = RepositoryPaths.normalize(path);
        Path start = repository.resolve(key);
        Set<String> files = new TreeSet<>();
        if (Files.isRegularFile(start)) {
            files.add(RepositoryPaths.relativize(root(), start));
        } else if (Files.isDirectory(start)) {
            Path root = root();
            try (Stream<Path> walk = Files.walk(start)) {
                walk.filter(Files::isRegularFile)
                        .filter(p -> !isIgnored(root.relativize(p)))
                        .filter(p -> !Files.isSymbolicLink(p) || RepositoryPaths.isContained(root, p))
                        .map(p -> RepositoryPaths.relativize(root, p))
                        .forEach(files::add);
            }
        }
        String prefix = dirPrefix(key);
        for (StagedChange change : changes.getChangeSet()) {
            if (change.getChangeType() == ChangeType.DELETE) {
                files.remove(change.getPath());
            } else if (change.getPath().equals(key) || change.getPath().startsWith(prefix)) {
                files.add(change.getPath());
            }
        }
        return new ArrayList<>(files);
    }

    private boolean isStagedDelete(String path) {
        return changes.get(path).map(c -> c.getChangeType() == ChangeType.DELETE).orElse(false);
    }

    private static boolean isIgnored(Path relative) {
        for (Path part : relative) {
            if (IGNORED_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private static String dirPrefix(String key) {
        return key.isEmpty() || ".".equals(key) ? "" : key + "/";
    }
}
