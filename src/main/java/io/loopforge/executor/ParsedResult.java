package io.loopforge.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Value from the agent's last {@code RESULT:} line; {@code raw} when it was not valid JSON.
 */
public record ParsedResult(JsonNode value, boolean raw) {
}
