package com.zzf.koda.core.repo;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
public class LocalRepositoryAccess implements RepositoryAccess {

    private final Path root;

    public LocalRepositoryAccess(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Optional<String> read(String path) throws IOException {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public void write(String path, String content) throws IOException {
        Path file = resolve(path);
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8);
        log.debug("repo.write root={} path={}", root, path);
    }

    @Override
    public void delete(String path) throws IOException {
        Path file = resolve(path);
        if (!Files.deleteIfExists(file)) {
            throw new NoSuchFileException(path);
        }
        log.debug("repo.delete root={} path={}", root, path);
    }
}
