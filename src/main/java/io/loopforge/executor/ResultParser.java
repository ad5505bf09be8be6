package io.loopforge.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.loopforge.util.Jsons;

public final class ResultParser {
    private static final String PREFIX = "RESULT:";

    private ResultParser() {
    }

    /**
     * Scans from the end of the output; the last non-empty {@code RESULT:} line wins.
     */
    public static ParsedResult parse(String output) {
        if (output == null || output.isEmpty()) {
            return new ParsedResult(NullNode.getInstance(), false);
        }
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String trimmed = lines[i].trim();
            if (!trimmed.startsWith(PREFIX)) {
                continue;
            }
            String json = trimmed.substring(PREFIX.length()).trim();
            if (json.isEmpty()) {
                continue;
            }
            try {
                JsonNode value = Jsons.mapper().readTree(json);
                return new ParsedResult(value, false);
            } catch (JsonProcessingException e) {
                return new ParsedResult(TextNode.valueOf(json), true);
            }
        }
        return new ParsedResult(NullNode.getInstance(), false);
    }
}
