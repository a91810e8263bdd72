package com.zzf.koda.core.repo;

import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.error.CloneException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clones a task's repository into its own workspace directory. Credentials and
 * pull-request handling live outside the orchestrator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryCloner {

    private static final Pattern GITHUB_URL = Pattern.compile(
            "^https?://github\\.com/([^/]+)/([^/.]+)(?:\\.git)?(?:/tree/([^/]+))?.*$",
            Pattern.CASE_INSENSITIVE);

    private final AgentConfig agentConfig;

    public Path cloneInto(String taskId, String repoUrl, String branch) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("repoUrl is blank");
        }
        String url = repoUrl.trim();
        String effectiveBranch = resolveBranch(url, branch);
        Path destination = workspaceFor(taskId, url);
        try {
            if (Files.exists(destination)) {
                FileSystemUtils.deleteRecursively(destination);
            }
            Files.createDirectories(destination.getParent());
        } catch (IOException e) {
            throw new CloneException("Could not prepare workspace for " + url, e);
        }

        log.info("repo.clone taskId={} url={} branch={} dest={}", taskId, url, effectiveBranch, destination);
        try (Git git = Git.cloneRepository()
                .setURI(cloneUrl(url))
                .setDirectory(destination.toFile())
                .setBranch(effectiveBranch)
                .setDepth(1)
                .call()) {
            log.info("repo.clone.done taskId={} head={}", taskId, git.getRepository().getBranch());
            return destination;
        } catch (GitAPIException | IOException e) {
            log.warn("repo.clone.fail taskId={} url={} err={}", taskId, url, e.toString());
            throw new CloneException("Failed to clone " + url + " (branch " + effectiveBranch + ")", e);
        }
    }

    String resolveBranch(String url, String branch) {
        if (branch != null && !branch.isBlank()) {
            return branch.trim();
        }
        Matcher m = GITHUB_URL.matcher(url);
        if (m.matches() && m.group(3) != null) {
            return m.group(3);
        }
        return agentConfig.getDefaultBranch();
    }

    String cloneUrl(String url) {
        Matcher m = GITHUB_URL.matcher(url);
        if (m.matches()) {
            return "https://github.com/" + m.group(1) + "/" + m.group(2) + ".git";
        }
        return url;
    }

    Path workspaceFor(String taskId, String url) {
        String name = url.replaceAll("\\.git$", "");
        int slash = name.lastIndexOf('/');
        String repoName = slash >= 0 ? name.substring(slash + 1) : name;
        String safeRepo = repoName.replaceAll("[^a-zA-Z0-9_-]", "_");
        String safeTask = taskId.replaceAll("[^a-zA-Z0-9_-]", "_");
        return Paths.get(agentConfig.getWorkspaceDir()).toAbsolutePath().normalize()
                .resolve(safeTask).resolve(safeRepo.isEmpty() ? "repo" : safeRepo);
    }
}
