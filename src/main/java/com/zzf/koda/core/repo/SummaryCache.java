package com.zzf.koda.core.repo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.koda.config.AgentConfig;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.ObjectId;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * On-disk cache of understanding summaries. An entry is keyed by the repository (its clone URL,
 * or its real root path for a local checkout), the HEAD commit and the task text, so a task
 * repeated against an unchanged checkout skips exploration. Only clean git working trees are
 * cached: without a commit, or with uncommitted edits, HEAD says nothing about the content.
 */
@Slf4j
@Component
public class SummaryCache {

    private final AgentConfig config;
    private final ObjectMapper objectMapper;

    public SummaryCache(AgentConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    public Optional<String> lookup(Path root, String origin, String task) {
        if (!config.isSummaryCacheEnabled()) {
            return Optional.empty();
        }
        Optional<String> key = keyFor(root, origin, task);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        Path file = entryFile(key.get());
        if (!Files.isRegularFile(file)) {
            log.debug("summary.cache.miss root={} key={}", root, key.get());
            return Optional.empty();
        }
        try {
            JsonNode entry = objectMapper.readTree(file.toFile());
            String summary = entry.path("summary").asText("");
            if (summary.isBlank()) {
                return Optional.empty();
            }
            log.info("summary.cache.hit root={} key={}", root, key.get());
            return Optional.of(summary);
        } catch (IOException e) {
            log.warn("summary.cache.read.fail file={} err={}", file, e.toString());
            return Optional.empty();
        }
    }

    /**
     * @return whether an entry was written; false when caching is off or the checkout is not cacheable
     */
    public boolean store(Path root, String origin, String task, String summary) {
        if (!config.isSummaryCacheEnabled() || summary == null || summary.isBlank()) {
            return false;
        }
        Optional<String> key = keyFor(root, origin, task);
        if (key.isEmpty()) {
            return false;
        }
        Path file = entryFile(key.get());
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("summary", summary);
        entry.put("repository", origin(root, origin));
        entry.put("created_at", Instant.now().toString());
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), entry);
            log.info("summary.cache.store root={} key={}", root, key.get());
            return true;
        } catch (IOException e) {
            log.warn("summary.cache.write.fail file={} err={}", file, e.toString());
            return false;
        }
    }

    /**
     * Removes every cached entry.
     *
     * @return number of entries removed
     */
    public int clear() throws IOException {
        Path dir = cacheDir();
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (Stream<Path> entries = Files.list(dir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                if (entry.getFileName().toString().endsWith(".json") && Files.deleteIfExists(entry)) {
                    removed++;
                }
            }
        }
        log.info("summary.cache.clear dir={} removed={}", dir, removed);
        return removed;
    }

    Optional<String> keyFor(Path root, String origin, String task) {
        Optional<String> head = cleanHead(root);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        String material = origin(root, origin) + "\n" + head.get() + "\n" + (task == null ? "" : task.trim());
        return Optional.of(DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8)));
    }

    private Optional<String> cleanHead(Path root) {
        try (Git git = Git.open(root.toFile())) {
            ObjectId head = git.getRepository().resolve("HEAD");
            if (head == null) {
                return Optional.empty();
            }
            if (!git.status().call().isClean()) {
                log.debug("summary.cache.skip root={} reason=dirty", root);
                return Optional.empty();
            }
            return Optional.of(head.getName());
        } catch (RepositoryNotFoundException e) {
            // not a git checkout
            return Optional.empty();
        } catch (IOException | GitAPIException e) {
            log.warn("summary.cache.head.fail root={} err={}", root, e.toString());
            return Optional.empty();
        }
    }

    private static String origin(Path root, String origin) {
        if (origin != null && !origin.isBlank()) {
            return origin.trim();
        }
        try {
            return root.toRealPath().toString();
        } catch (IOException e) {
            log.debug("summary.cache.realpath.fail root={} err={}", root, e.toString());
            return root.toAbsolutePath().normalize().toString();
        }
    }

    private Path entryFile(String key) {
        return cacheDir().resolve(key + ".json");
    }

    private Path cacheDir() {
        return Paths.get(config.getSummaryCacheDir()).toAbsolutePath().normalize();
    }
}
