package com.helix.guardrails.integration;

import com.helix.guardrails.configuration.AppProperties;
import com.helix.guardrails.configuration.GitProperties;
import com.helix.guardrails.exception.ConfigurationException;
import com.helix.guardrails.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Root directory holding local repositories. Repository paths are stored relative to
 * it and resolved here; nothing outside the workspace can be opened.
 */
@Slf4j
@Component
public class GitWorkspace {

    private final Path root;
    private final Duration timeout;
    private final ProcessRunner processRunner;

    public GitWorkspace(AppProperties props, ProcessRunner processRunner) {
        GitProperties git = props.getGit();
        this.root = expandHome(git.getWorkspace()).toAbsolutePath().normalize();
        this.timeout = Duration.ofSeconds(git.getTimeoutSeconds());
        this.processRunner = processRunner;
        log.info("Git workspace: {} (command timeout {}s)", root, timeout.toSeconds());
    }

    public Path root() {
        return root;
    }

    /**
     * Resolve a workspace-relative path to an existing git repository.
     *
     * @throws IllegalArgumentException  when the path escapes the workspace
     * @throws ResourceNotFoundException when it is not a directory with a {@code .git} entry
     */
    public Path resolve(String relativePath) {
        Path resolved = root.resolve(relativePath).toAbsolutePath().normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Resolved path " + resolved + " escapes the workspace (" + root + ")");
        }
        if (!Files.isDirectory(resolved) || !Files.exists(resolved.resolve(".git"))) {
            throw new ResourceNotFoundException("Git repository", resolved.toString());
        }
        return resolved;
    }

    /**
     * Normalise an absolute, {@code ~/}-prefixed or relative path to the workspace-relative
     * form used for storage.
     */
    public String toRelative(String path) {
        Path p = expandHome(path).toAbsolutePath().normalize();
        if (!p.startsWith(root)) {
            throw new IllegalArgumentException("Path " + p + " is outside the workspace (" + root + ")");
        }
        Path relative = root.relativize(p);
        if (relative.toString().isEmpty()) {
            throw new IllegalArgumentException("Path resolves to the workspace root itself; expected a subdirectory");
        }
        return relative.toString().replace('\\', '/');
    }

    public LocalGitClient open(String relativePath) {
        return new LocalGitClient(resolve(relativePath), processRunner, timeout);
    }

    public void validate() {
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Git workspace " + root + " does not exist or is not a directory");
        }
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }
}
