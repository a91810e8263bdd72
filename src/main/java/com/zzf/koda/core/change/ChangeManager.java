package com.zzf.koda.core.change;

import com.zzf.koda.core.repo.RepositoryAccess;
import com.zzf.koda.core.repo.RepositoryPaths;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Task-scoped staging area (one instance per task). Holds proposed mutations keyed by
 * repository-relative path and only touches real storage inside {@link #apply}.
 */
@Slf4j
public class ChangeManager {

    private final String taskId;
    private final RepositoryAccess repository;
    private final Map<String, StagedChange> staged = new TreeMap<>();

    public ChangeManager(String taskId, RepositoryAccess repository) {
        this.taskId = taskId;
        this.repository = repository;
    }

    /**
     * Stages a full-content write. Re-staging a path keeps the original content captured the
     * first time it was staged.
     */
    public synchronized StagedChange stageWrite(String path, String content) {
        String key = key(path);
        StagedChange existing = staged.get(key);
        String original = existing != null ? existing.getOriginalContent() : readCurrent(key);
        ChangeType type = original == null ? ChangeType.CREATE : ChangeType.MODIFY;
        StagedChange change = new StagedChange(key, type, original, content == null ? "" : content);
        staged.put(key, change);
        log.info("change.stage taskId={} path={} type={} restaged={}", taskId, key, type.wireName(), existing != null);
        return change;
    }

    /**
     * Stages a deletion. Deleting a path that is only staged as a create drops the staged entry,
     * since nothing exists in storage; the result is then empty.
     *
     * @throws IllegalArgumentException if the path is neither staged nor present in the repository
     */
    public synchronized Optional<StagedChange> stageDelete(String path) {
        String key = key(path);
        StagedChange existing = staged.get(key);
        if (existing != null && existing.getOriginalContent() == null) {
            staged.remove(key);
            log.info("change.unstage taskId={} path={} reason=delete_of_create", taskId, key);
            return Optional.empty();
        }
        if (existing != null && existing.getChangeType() == ChangeType.DELETE) {
            return Optional.of(existing);
        }
        String original = existing != null ? existing.getOriginalContent() : readCurrent(key);
        if (original == null) {
            throw new IllegalArgumentException("File not found: " + key);
        }
        StagedChange change = new StagedChange(key, ChangeType.DELETE, original, "");
        staged.put(key, change);
        log.info("change.stage taskId={} path={} type=delete restaged={}", taskId, key, existing != null);
        return Optional.of(change);
    }

    public synchronized Optional<StagedChange> get(String path) {
        return Optional.ofNullable(staged.get(key(path)));
    }

    /**
     * Current change set, one entry per path, in path order.
     */
    public synchronized List<StagedChange> getChangeSet() {
        return List.copyOf(staged.values());
    }

    public synchronized boolean isEmpty() {
        return staged.isEmpty();
    }

    public synchronized int size() {
        return staged.size();
    }

    public ApplyResult apply() {
        return apply(getChangeSet());
    }

    /**
     * Writes creates and modifies and removes deletes, in path order. A failing path does not stop
     * the remaining ones and nothing is rolled back. Applied entries leave the staging area;
     * failed entries stay staged.
     */
    public synchronized ApplyResult apply(List<StagedChange> changeSet) {
        if (changeSet == null || changeSet.isEmpty()) {
            log.info("change.apply taskId={} count=0", taskId);
            return ApplyResult.empty();
        }
        List<StagedChange> ordered = new ArrayList<>(changeSet);
        ordered.sort(Comparator.comparing(StagedChange::getPath));
        List<String> applied = new ArrayList<>();
        List<ApplyResult.Failure> failed = new ArrayList<>();
        for (StagedChange change : ordered) {
            try {
                if (change.getChangeType() == ChangeType.DELETE) {
                    repository.delete(change.getPath());
                } else {
                    repository.write(change.getPath(), change.getNewContent());
                }
                applied.add(change.getPath());
                staged.remove(change.getPath(), change);
            } catch (IOException | RuntimeException e) {
                String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                failed.add(new ApplyResult.Failure(change.getPath(), reason));
                log.warn("change.apply.fail taskId={} path={} type={} err={}", taskId, change.getPath(),
                        change.getChangeType().wireName(), e.toString());
            }
        }
        log.info("change.apply taskId={} applied={} failed={}", taskId, applied.size(), failed.size());
        return new ApplyResult(applied, failed);
    }

    public synchronized int discard() {
        int count = staged.size();
        staged.clear();
        log.info("change.discard taskId={} count={}", taskId, count);
        return count;
    }

    /**
     * Unified diff of everything staged, in path order.
     */
    public synchronized String diff() {
        return DiffRenderer.render(getChangeSet());
    }

    public synchronized String summary() {
        if (staged.isEmpty()) {
            return "No staged changes.";
        }
        long creates = staged.values().stream().filter(c -> c.getChangeType() == ChangeType.CREATE).count();
        long modifies = staged.values().stream().filter(c -> c.getChangeType() == ChangeType.MODIFY).count();
        long deletes = staged.values().stream().filter(c -> c.getChangeType() == ChangeType.DELETE).count();
        List<String> parts = new ArrayList<>();
        if (creates > 0) {
            parts.add(creates + " file(s) to create");
        }
        if (modifies > 0) {
            parts.add(modifies + " file(s) to modify");
        }
        if (deletes > 0) {
            parts.add(deletes + " file(s) to delete");
        }
        return "Staged: " + String.join(", ", parts);
    }

    private String readCurrent(String key) {
        try {
            return repository.read(key).orElse(null);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + key, e);
        }
    }

    private static String key(String path) {
        String key = RepositoryPaths.normalize(path);
        if (key.isEmpty() || ".".equals(key)) {
            throw new IllegalArgumentException("path is blank");
        }
        return key;
    }
}
