package com.example.almanac.action;

import com.example.almanac.config.AlmanacProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs argv subprocesses (no shell) with a hard timeout. Output goes to temp files so a chatty
 * process can never block on a full pipe. Processes still running at shutdown get a grace period
 * after SIGTERM before they are killed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner {

    private final AlmanacProperties properties;

    private final Set<Process> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @throws ActionTimeoutException   if the process outlives {@code timeout}; it is killed first
     * @throws ActionExecutionException if the process cannot be started
     */
    public CommandResult run(List<String> argv, Duration timeout, String workingDirectory) {
        int limit = properties.getActions().getOutputLimitChars();
        Path stdoutFile = null;
        Path stderrFile = null;
        long start = System.nanoTime();
        try {
            stdoutFile = Files.createTempFile("almanac-cmd-", ".out");
            stderrFile = Files.createTempFile("almanac-cmd-", ".err");

            ProcessBuilder pb = new ProcessBuilder(argv);
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());
            if (workingDirectory != null && !workingDirectory.isBlank()) {
                pb.directory(new File(workingDirectory));
            }

            log.debug("Running command: {}", String.join(" ", argv));
            Process process = pb.start();
            inFlight.add(process);
            try {
                boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(5, TimeUnit.SECONDS);
                    Map<String, Object> fields = new LinkedHashMap<>();
                    fields.put("argv", argv);
                    fields.put("timeout_seconds", timeout.toSeconds());
                    fields.put("stdout", readCapped(stdoutFile, limit));
                    fields.put("stderr", readCapped(stderrFile, limit));
                    throw new ActionTimeoutException(
                            "Command timed out after " + timeout.toSeconds() + "s: " + argv.get(0), fields);
                }
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                return new CommandResult(process.exitValue(),
                        readCapped(stdoutFile, limit), readCapped(stderrFile, limit), elapsed);
            } finally {
                inFlight.remove(process);
            }
        } catch (IOException e) {
            throw new ActionExecutionException("Failed to start command " + argv.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionExecutionException("Interrupted while running " + argv.get(0), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    @PreDestroy
    public void shutdown() {
        if (inFlight.isEmpty()) return;
        int graceSeconds = properties.getActions().getShutdownGraceSeconds();
        log.info("Terminating {} running command(s), grace period {}s", inFlight.size(), graceSeconds);
        for (Process process : inFlight) {
            process.destroy();
        }
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(graceSeconds);
        for (Process process : inFlight) {
            long remaining = deadline - System.nanoTime();
            try {
                if (remaining <= 0 || !process.waitFor(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Command pid {} ignored SIGTERM, killing", process.pid());
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * Captured output, decoded leniently: malformed UTF-8 becomes U+FFFD. A read failure never
     * replaces the exit or timeout result of the command.
     */
    static String readCapped(Path file, int limit) {
        String text;
        try {
            text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read command output from {}: {}", file, e.getMessage());
            return "[output unavailable: " + e.getMessage() + "]";
        }
        return text.length() <= limit ? text : text.substring(0, limit) + "\n...[truncated]";
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
