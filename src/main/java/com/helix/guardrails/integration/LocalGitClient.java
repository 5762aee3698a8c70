package com.helix.guardrails.integration;

import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.model.CallContext;
import com.helix.guardrails.model.ServiceType;
import com.helix.guardrails.util.ExternalCallLogger;
import com.helix.guardrails.util.GitInputValidator;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@code git} CLI wrapper bound to one local repository. Produces the diffs, commit
 * logs and file listings the scope checker consumes.
 *
 * <p>Each command is time-boxed; a timeout raises
 * {@link com.helix.guardrails.exception.ProcessTimeoutException} and a non-zero exit
 * raises {@link TransientIoException} carrying git's stderr.
 */
@Slf4j
public class LocalGitClient {

    static final String DEFAULT_LOG_FORMAT = "%H%n%s%n%b%n---";
    static final int DEFAULT_MAX_COUNT = 50;

    private final Path repoDir;
    private final ProcessRunner processRunner;
    private final Duration timeout;

    public LocalGitClient(Path repoDir, ProcessRunner processRunner, Duration timeout) {
        this.repoDir = repoDir;
        this.processRunner = processRunner;
        this.timeout = timeout;
    }

    public Path getRepoDir() {
        return repoDir;
    }

    /**
     * Unified diff of {@code base..head}.
     */
    public String diff(String base, String head) {
        GitInputValidator.validateRef(base);
        GitInputValidator.validateRef(head);
        return run("diff", base + ".." + head);
    }

    public String log(String base, String head) {
        return log(base, head, DEFAULT_LOG_FORMAT, DEFAULT_MAX_COUNT);
    }

    public String log(String base, String head, String format, int maxCount) {
        GitInputValidator.validateRef(base);
        GitInputValidator.validateRef(head);
        GitInputValidator.validateLogFormat(format);
        return run("log", "--format=" + format, "--max-count=" + maxCount, base + ".." + head);
    }

    public BranchSummary branchSummary(String base, String head) {
        GitInputValidator.validateRef(base);
        GitInputValidator.validateRef(head);
        List<String> subjects = nonBlankLines(run("log", "--format=%s", base + ".." + head));
        return new BranchSummary(
                subjects.isEmpty() ? "(no commits)" : subjects.get(0),
                String.join("\n", subjects),
                subjects.size());
    }

    /**
     * Tracked file paths at {@code ref}.
     */
    public List<String> lsTree(String ref) {
        GitInputValidator.validateRef(ref);
        return nonBlankLines(run("ls-tree", "-r", "--name-only", ref));
    }

    public String fileContent(String path, String ref) {
        GitInputValidator.validateRef(ref);
        GitInputValidator.validateFilePath(path);
        return run("show", ref + ":" + path);
    }

    public String currentBranch() {
        return run("rev-parse", "--abbrev-ref", "HEAD").strip();
    }

    /**
     * {@code main} or {@code master} when present, otherwise the first local branch.
     */
    public String defaultBranch() {
        String branches = run("branch", "--list", "main", "master");
        for (String candidate : List.of("main", "master")) {
            if (branches.contains(candidate)) {
                return candidate;
            }
        }
        List<String> all = nonBlankLines(run("branch", "--format=%(refname:short)"));
        return all.isEmpty() ? "main" : all.get(0);
    }

    private String run(String... args) {
        List<String> command = new ArrayList<>(List.of("git", "-C", repoDir.toString()));
        command.addAll(Arrays.asList(args));

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GIT, args[0], log);
        ctx.logRequest(String.join(" ", command));

        ProcessResult result;
        try {
            result = processRunner.run(command, null, timeout, ServiceType.GIT);
        } catch (TransientIoException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }

        if (!result.isSuccess()) {
            String stderr = result.stderr().strip();
            ctx.logError("exit " + result.exitCode() + ": " + stderr, null);
            throw new TransientIoException(ServiceType.GIT,
                    "git command failed (exit " + result.exitCode() + "): " + String.join(" ", command) + "\n" + stderr);
        }
        ctx.logResponse(null, "Bytes", result.stdout().length());
        return result.stdout();
    }

    private static List<String> nonBlankLines(String raw) {
        return raw.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
