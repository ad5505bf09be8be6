package io.loopforge.executor;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PromptBuilderTest {

    @Test
    void promptCarriesAllowlistFileAndMetadata() {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode().put("coverage", 41);
        String prompt = PromptBuilder.prompt("Raise coverage", "src/a.ts", metadata, "a*");

        Assertions.assertTrue(prompt.startsWith("Raise coverage"));
        Assertions.assertTrue(prompt.contains("ONLY read and modify files matching the pattern: a*"));
        Assertions.assertTrue(prompt.contains("File: src/a.ts"));
        Assertions.assertTrue(prompt.contains("Original data: {\"coverage\":41}"));
        Assertions.assertTrue(prompt.contains("RESULT:"));
    }

    @Test
    void fixupPromptIncludesVerificationOutput() {
        String prompt = PromptBuilder.fixup("Fix it", "src/a.ts", "  expected 1 got 2\n", "a*");
        Assertions.assertTrue(prompt.startsWith("Fix it"));
        Assertions.assertTrue(prompt.contains("Verification failed with the following error:"));
        Assertions.assertTrue(prompt.contains("expected 1 got 2"));
    }
}
