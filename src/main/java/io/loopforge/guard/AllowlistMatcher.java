package io.loopforge.guard;

/**
 * Path test behind the allowlist. A trailing {@code *} means "some path component starts
 * with the prefix, or the path contains it"; anything else is a substring test.
 */
public final class AllowlistMatcher {
    private AllowlistMatcher() {
    }

    public static boolean matches(String path, String pattern) {
        if (path == null || pattern == null || pattern.isEmpty()) {
            return false;
        }
        String normalized = path.replace('\\', '/');
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            for (String component : normalized.split("/")) {
                if (!component.isEmpty() && !".".equals(component) && component.startsWith(prefix)) {
                    return true;
                }
            }
            return normalized.contains(prefix);
        }
        return normalized.contains(pattern);
    }
}
