package com.zzf.koda.shell;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Shell selection and process-tree termination for commands run on behalf of a task.
 */
@Slf4j
@Service
public class ShellService {

    private static final long SIGKILL_TIMEOUT_MS = 200;

    public List<String> commandLine(String command) {
        if (isWindows()) {
            return List.of("cmd.exe", "/c", command);
        }
        return List.of("/bin/sh", "-c", command);
    }

    public void killTree(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        long pid = process.pid();
        log.info("shell.kill pid={}", pid);

        if (isWindows()) {
            try {
                new ProcessBuilder("taskkill", "/pid", String.valueOf(pid), "/f", "/t")
                        .inheritIO()
                        .start()
                        .waitFor();
                return;
            } catch (IOException e) {
                log.warn("shell.kill.fail pid={} err={}", pid, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(SIGKILL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
