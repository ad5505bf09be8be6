package io.loopforge.guard;

import java.util.List;

public record AuthorizationDecision(List<String> unauthorizedPaths) {
    public AuthorizationDecision {
        unauthorizedPaths = unauthorizedPaths == null ? List.of() : List.copyOf(unauthorizedPaths);
    }

    public static AuthorizationDecision allowed() {
        return new AuthorizationDecision(List.of());
    }

    public boolean authorized() {
        return unauthorizedPaths.isEmpty();
    }

    public String detail() {
        return "unauthorized changes: " + String.join(", ", unauthorizedPaths);
    }
}
