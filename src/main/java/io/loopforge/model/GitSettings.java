package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitSettings(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("auto_branch") boolean autoBranch,
        @JsonProperty("auto_commit") boolean autoCommit,
        @JsonProperty("commit_message_template") String commitMessageTemplate
) {
    public static GitSettings disabled() {
        return new GitSettings(false, false, false, null);
    }

    /**
     * Branching and committing both need dirty-file tracking.
     */
    public boolean tracksChanges() {
        return enabled || autoBranch || autoCommit;
    }
}
