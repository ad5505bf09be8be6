package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings shared by every file of a task. Prompts, verify command and allowlist are
 * templates; placeholders are resolved per file before anything runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskConfig(
        @JsonProperty("input_file") String inputFile,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("fixup_prompt") String fixupPrompt,
        @JsonProperty("verify_command") String verifyCommand,
        @JsonProperty("allowlist_pattern") String allowlistPattern,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("concurrency") int concurrency,
        @JsonProperty("max_files") Integer maxFiles,
        @JsonProperty("git") GitSettings git
) {
    public TaskConfig {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be empty");
        }
        if (allowlistPattern == null || allowlistPattern.isBlank()) {
            throw new IllegalArgumentException("allowlist pattern cannot be empty");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max_retries must be >= 0, got " + maxRetries);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
        }
        if (maxFiles != null && maxFiles < 1) {
            throw new IllegalArgumentException("max_files must be >= 1, got " + maxFiles);
        }
        fixupPrompt = blankToNull(fixupPrompt);
        verifyCommand = blankToNull(verifyCommand);
        git = git == null ? GitSettings.disabled() : git;
    }

    public boolean hasVerifyCommand() {
        return verifyCommand != null;
    }

    public TaskConfig withConcurrency(int value) {
        return new TaskConfig(inputFile, prompt, fixupPrompt, verifyCommand, allowlistPattern,
                maxRetries, value, maxFiles, git);
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw;
    }
}
