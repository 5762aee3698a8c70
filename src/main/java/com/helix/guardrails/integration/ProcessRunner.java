package com.helix.guardrails.integration;

import com.helix.guardrails.exception.ProcessTimeoutException;
import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.model.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a hard time limit.
 *
 * <p>stdout and stderr are redirected to temporary files and decoded as UTF-8 with
 * replacement. On timeout the process is killed and no partial output is returned.
 */
@Slf4j
@Component
public class ProcessRunner {

    /**
     * @throws ProcessTimeoutException when the command does not finish within {@code timeout}
     * @throws TransientIoException    when the command cannot be started
     */
    public ProcessResult run(List<String> command, File workingDir, Duration timeout, ServiceType service) {
        String display = String.join(" ", command);
        log.debug("Running: {}", display);
        long start = System.currentTimeMillis();

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("helix-proc-", ".out");
            stderrFile = Files.createTempFile("helix-proc-", ".err");

            ProcessBuilder builder = new ProcessBuilder(command);
            if (workingDir != null) {
                builder.directory(workingDir);
            }
            builder.redirectOutput(stdoutFile.toFile());
            builder.redirectError(stderrFile.toFile());
            process = builder.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s, killed: {}", timeout.toSeconds(), display);
                throw new ProcessTimeoutException(service, display, timeout);
            }

            return new ProcessResult(
                    process.exitValue(),
                    new String(Files.readAllBytes(stdoutFile), StandardCharsets.UTF_8),
                    new String(Files.readAllBytes(stderrFile), StandardCharsets.UTF_8),
                    System.currentTimeMillis() - start);

        } catch (IOException e) {
            throw new TransientIoException(service, "Failed to run command: " + display + " (" + e.getMessage() + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new TransientIoException(service, "Interrupted while running: " + display, e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
