package com.zzf.koda.core.repo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves repository-relative paths against a root and refuses anything that escapes it, either
 * lexically ({@code ../}) or through a symbolic link pointing outside the root.
 */
public final class RepositoryPaths {

    private static final boolean WINDOWS = System.getProperty("os.name", "")
            .toLowerCase(Locale.ROOT)
            .contains("win");

    private RepositoryPaths() {
    }

    public static Path resolve(Path root, String rawPath) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path parsed = parse(rawPath);
        Path resolved = parsed.isAbsolute()
                ? parsed.normalize()
                : normalizedRoot.resolve(parsed).normalize();
        if (!resolved.startsWith(normalizedRoot)) {
            throw new IllegalArgumentException("Path escapes repository root: " + rawPath);
        }
        if (!isContained(normalizedRoot, resolved)) {
            throw new IllegalArgumentException("Path escapes repository root through a link: " + rawPath);
        }
        return resolved;
    }

    /**
     * Whether the target, once links are followed, still lies under the root. Checked on the
     * deepest existing ancestor, so paths that do not exist yet are judged by where they would be
     * created. A dangling link is never contained.
     */
    public static boolean isContained(Path root, Path target) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.exists(normalizedRoot)) {
            return target.toAbsolutePath().normalize().startsWith(normalizedRoot);
        }
        Path existing = target.toAbsolutePath().normalize();
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return false;
        }
        try {
            return existing.toRealPath().startsWith(normalizedRoot.toRealPath());
        } catch (IOException e) {
            // dangling link or unreadable ancestor
            return false;
        }
    }

    /**
     * Canonical staging key: forward slashes, no leading {@code ./}, no trailing slash.
     */
    public static String normalize(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        String norm = rawPath.trim().replace('\\', '/');
        while (norm.startsWith("./")) {
            norm = norm.substring(2);
        }
        while (norm.contains("//")) {
            norm = norm.replace("//", "/");
        }
        while (norm.endsWith("/") && norm.length() > 1) {
            norm = norm.substring(0, norm.length() - 1);
        }
        return norm;
    }

    public static String relativize(Path root, Path target) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedTarget = target.toAbsolutePath().normalize();
        if (normalizedTarget.startsWith(normalizedRoot)) {
            return toTransportPath(normalizedRoot.relativize(normalizedTarget).toString());
        }
        return toTransportPath(normalizedTarget.toString());
    }

    private static Path parse(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Paths.get(".");
        }
        String normalized = rawPath.trim();
        if (WINDOWS && normalized.matches("^/[a-zA-Z]/.*")) {
            char drive = Character.toUpperCase(normalized.charAt(1));
            normalized = drive + ":" + normalized.substring(2);
        }
        return Paths.get(normalized);
    }

    private static String toTransportPath(String path) {
        return path == null ? "" : path.replace('\\', '/');
    }
}
