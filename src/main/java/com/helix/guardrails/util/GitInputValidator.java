package com.helix.guardrails.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validates refs and paths before they reach a {@code git} command line.
 *
 * <p>Arguments are passed to {@link ProcessBuilder} as a list, so there is no shell to
 * inject into; the remaining risks are option injection (an argument starting with
 * {@code -}) and refs git itself would reject.
 */
@Slf4j
public final class GitInputValidator {

    private static final Pattern REF = Pattern.compile("^[a-zA-Z0-9/_.-]+([~^][0-9]*)*$");
    private static final Pattern FORMAT_UNSAFE = Pattern.compile("[\\r\\n\\x00]");

    private GitInputValidator() {
    }

    /**
     * Accepts branch names, tags, commit hashes, {@code HEAD} and ancestry suffixes such
     * as {@code HEAD~2} or {@code main^}.
     *
     * @throws IllegalArgumentException when the ref is blank, too long, starts with a dash,
     *                                  or breaks git's ref-format rules
     */
    public static void validateRef(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("Git ref cannot be null or blank");
        }
        if (ref.length() > 200) {
            throw new IllegalArgumentException("Git ref too long (max 200 characters): " + ref.length());
        }
        if (ref.startsWith("-")) {
            log.warn("⚠️ SECURITY: Rejected option-like git ref: {}", sanitizeForLogging(ref));
            throw new IllegalArgumentException("Git ref cannot start with '-': " + sanitizeForLogging(ref));
        }
        if (!REF.matcher(ref).matches()) {
            log.warn("⚠️ SECURITY: Rejected git ref: {}", sanitizeForLogging(ref));
            throw new IllegalArgumentException(
                    "Invalid git ref. Only alphanumeric characters, dash, underscore, slash, dot "
                            + "and ~/^ ancestry suffixes are allowed. Received: " + sanitizeForLogging(ref));
        }
        // git-check-ref-format rules
        if (ref.startsWith("/") || ref.endsWith("/") || ref.contains("//")) {
            throw new IllegalArgumentException("Git ref has an empty path component: " + ref);
        }
        if (ref.startsWith(".") || ref.endsWith(".") || ref.contains("..")) {
            throw new IllegalArgumentException("Git ref cannot start or end with '.' or contain '..': " + ref);
        }
        if (ref.endsWith(".lock")) {
            throw new IllegalArgumentException("Git ref cannot end with '.lock': " + ref);
        }
    }

    /**
     * Repository-relative file path for {@code git show ref:path}.
     */
    public static void validateFilePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File path cannot be null or blank");
        }
        if (FORMAT_UNSAFE.matcher(path).find()) {
            throw new IllegalArgumentException("File path contains control characters: " + sanitizeForLogging(path));
        }
        if (path.startsWith("/") || path.equals("..") || path.startsWith("../") || path.contains("/../")) {
            throw new IllegalArgumentException("File path must stay inside the repository: " + sanitizeForLogging(path));
        }
    }

    /**
     * {@code git log --format} placeholder string.
     */
    public static void validateLogFormat(String format) {
        if (format == null || format.isEmpty()) {
            throw new IllegalArgumentException("Log format cannot be empty");
        }
        if (FORMAT_UNSAFE.matcher(format).find()) {
            throw new IllegalArgumentException("Log format contains control characters");
        }
    }

    static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        String sanitized = input.length() > 100 ? input.substring(0, 100) + "..." : input;
        return sanitized
                .replaceAll("[\\r\\n]", " ")
                .replaceAll("[;|&$`<>(){}\\[\\]\\\\]", "?");
    }
}
