package io.loopforge.runtime;

import io.loopforge.model.GitSettings;

import java.nio.file.Path;

/**
 * Everything needed to create a fresh task. Validation of the numeric bounds happens when the
 * task configuration is built.
 */
public record TaskRequest(
        Path inputFile,
        Path workingDir,
        String prompt,
        String fixupPrompt,
        String verifyCommand,
        String allowlistPattern,
        int maxRetries,
        int concurrency,
        Integer maxFiles,
        GitSettings git
) {
}
