package com.zzf.koda.core.tool;

import com.zzf.koda.shell.ShellService;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one shell command with a deadline. stdout and stderr are drained on their own threads so a
 * chatty process cannot block on a full pipe; a process past its deadline is killed with its
 * descendants and reported as timed out.
 */
@Slf4j
final class CommandExecutor {

    private static final int MAX_STREAM_CHARS = 1_000_000;
    private static final long DRAIN_TIMEOUT_MS = 2000;
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final ShellService shellService;
    private final ExecutorService drainers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "koda-cmd-io-" + THREAD_IDS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final Map<String, Process> runningProcessesByCall = new ConcurrentHashMap<>();
    private final Map<String, String> runningCallTask = new ConcurrentHashMap<>();

    CommandExecutor(ShellService shellService) {
        this.shellService = shellService;
    }

    /**
     * Kills the process of one call, or of every running call of the task when callID is blank.
     */
    void cancel(String taskID, String callID) {
        if (callID != null && !callID.isBlank()) {
            killRunningProcess(callID);
            return;
        }
        if (taskID == null || taskID.isBlank()) {
            return;
        }
        List<String> callIds = runningCallTask.entrySet().stream()
                .filter(entry -> taskID.equals(entry.getValue()))
                .map(Map.Entry::getKey)
                .toList();
        for (String id : callIds) {
            killRunningProcess(id);
        }
    }

    int runningCount() {
        return runningProcessesByCall.size();
    }

    ExecutionResult execute(String command, Path workdir, long timeoutMs, String taskID, String callID) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(shellService.commandLine(command));
        pb.directory(workdir.toFile());

        long startedAt = System.currentTimeMillis();
        Process process = pb.start();
        process.getOutputStream().close();
        boolean tracked = callID != null && !callID.isBlank();
        if (tracked) {
            runningProcessesByCall.put(callID, process);
            if (taskID != null) {
                runningCallTask.put(callID, taskID);
            }
        }
        log.info("command.start taskId={} callId={} pid={} timeoutMs={}", taskID, callID, process.pid(), timeoutMs);

        StringBuffer stdoutText = new StringBuffer();
        StringBuffer stderrText = new StringBuffer();
        Future<?> stdout = drainers.submit(() -> drain(process.getInputStream(), stdoutText));
        Future<?> stderr = drainers.submit(() -> drain(process.getErrorStream(), stderrText));
        try {
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                shellService.killTree(process);
            }
            String out = collect(stdout, stdoutText);
            String err = collect(stderr, stderrText);
            long duration = System.currentTimeMillis() - startedAt;
            int exitCode = finished ? process.exitValue() : -1;
            log.info("command.end taskId={} callId={} exit={} timedOut={} durationMs={}",
                    taskID, callID, exitCode, !finished, duration);
            return new ExecutionResult(out, err, exitCode, !finished, duration);
        } catch (InterruptedException e) {
            shellService.killTree(process);
            Thread.currentThread().interrupt();
            stderr.cancel(true);
            return new ExecutionResult(collect(stdout, stdoutText), "Command terminated due to interruption.", -1, false,
                    System.currentTimeMillis() - startedAt);
        } finally {
            if (tracked) {
                runningProcessesByCall.remove(callID, process);
                runningCallTask.remove(callID);
            }
        }
    }

    private void killRunningProcess(String callID) {
        Process process = runningProcessesByCall.remove(callID);
        runningCallTask.remove(callID);
        if (process != null && process.isAlive()) {
            shellService.killTree(process);
        }
    }

    private static Void drain(InputStream in, StringBuffer out) throws IOException {
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buffer)) != -1) {
                int room = MAX_STREAM_CHARS - out.length();
                if (room > 0) {
                    out.append(buffer, 0, Math.min(n, room));
                }
            }
        }
        return null;
    }

    /**
     * Waits briefly for a drainer to hit end of stream; a grandchild still holding the pipe open
     * leaves whatever was read so far.
     */
    private static String collect(Future<?> stream, StringBuffer text) {
        try {
            stream.get(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stream.cancel(true);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("command.drain.incomplete err={}", e.toString());
            stream.cancel(true);
        }
        return text.toString();
    }

    static final class ExecutionResult {
        final String stdout;
        final String stderr;
        final int exitCode;
        final boolean timedOut;
        final long durationMs;

        ExecutionResult(String stdout, String stderr, int exitCode, boolean timedOut, long durationMs) {
            this.stdout = stdout;
            this.stderr = stderr;
            this.exitCode = exitCode;
            this.timedOut = timedOut;
            this.durationMs = durationMs;
        }
    }
}
