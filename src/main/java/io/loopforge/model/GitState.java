package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Git facts captured when a task is first run. The baseline survives resume so files that
 * were dirty before the task started stay exempt from authorization checks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitState(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("original_branch") String originalBranch,
        @JsonProperty("task_branch") String taskBranch,
        @JsonProperty("baseline_dirty_files") Set<String> baselineDirtyFiles
) {
    public GitState {
        baselineDirtyFiles = baselineDirtyFiles == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(baselineDirtyFiles));
    }

    public static GitState disabled() {
        return new GitState(false, null, null, Set.of());
    }

    public GitState withTaskBranch(String branch) {
        return new GitState(enabled, originalBranch, branch, baselineDirtyFiles);
    }
}
