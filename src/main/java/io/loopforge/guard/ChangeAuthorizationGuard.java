package io.loopforge.guard;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether the changes visible when a file is about to complete were permitted.
 *
 * <p>A modified path is unauthorized when it matches none of the allowlist patterns and was not
 * already dirty in the baseline. The guard only decides; collecting modified paths is the change
 * tracker's job.
 */
public final class ChangeAuthorizationGuard {
    private final Set<String> taskPatterns;

    /**
     * @param taskPatterns resolved allowlist patterns of every file in the task, accepted for all
     *                     files so that workers on sibling files do not trip each other
     */
    public ChangeAuthorizationGuard(Collection<String> taskPatterns) {
        this.taskPatterns = taskPatterns == null ? Set.of() : Set.copyOf(taskPatterns);
    }

    public static ChangeAuthorizationGuard forFileOnly() {
        return new ChangeAuthorizationGuard(Set.of());
    }

    public AuthorizationDecision check(String filePattern, Collection<String> modifiedPaths, Collection<String> baseline) {
        if (modifiedPaths == null || modifiedPaths.isEmpty()) {
            return AuthorizationDecision.allowed();
        }
        Set<String> exempt = baseline == null ? Set.of() : Set.copyOf(baseline);
        List<String> unauthorized = new ArrayList<>();
        for (String path : new TreeSet<>(modifiedPaths)) {
            if (exempt.contains(path)) {
                continue;
            }
            if (AllowlistMatcher.matches(path, filePattern)) {
                continue;
            }
            if (taskPatterns.stream().anyMatch(p -> AllowlistMatcher.matches(path, p))) {
                continue;
            }
            unauthorized.add(path);
        }
        return new AuthorizationDecision(unauthorized);
    }
}
