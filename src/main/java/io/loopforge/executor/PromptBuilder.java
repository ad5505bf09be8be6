package io.loopforge.executor;

import com.fasterxml.jackson.databind.JsonNode;
import io.loopforge.util.Jsons;

public final class PromptBuilder {
    static final String RESULT_INSTRUCTION = """

            When you have finished the task, output your result data as JSON on a single line starting with "RESULT:"
            Example: RESULT: {"coverage": 78.5}
            If you have no structured data to report, output: RESULT: "done"
            """;

    private PromptBuilder() {
    }

    public static String prompt(String basePrompt, String filePath, JsonNode metadata, String allowlist) {
        String metadataJson = metadata == null ? "null" : Jsons.toCompactJson(metadata);
        return """
                %s

                IMPORTANT: You may ONLY read and modify files matching the pattern: %s
                Do not edit any other files.

                File: %s
                Original data: %s
                %s""".formatted(basePrompt, allowlist, filePath, metadataJson, RESULT_INSTRUCTION);
    }

    public static String fixup(String fixupPrompt, String filePath, String verifyOutput, String allowlist) {
        return """
                %s

                IMPORTANT: You may ONLY read and modify files matching the pattern: %s
                Do not edit any other files.

                File: %s

                Verification failed with the following error:
                ```
                %s
                ```

                Please fix the issues and try again.
                %s""".formatted(fixupPrompt, allowlist, filePath, verifyOutput == null ? "" : verifyOutput.strip(),
                RESULT_INSTRUCTION);
    }
}
