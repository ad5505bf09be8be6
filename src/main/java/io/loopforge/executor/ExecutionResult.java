package io.loopforge.executor;

public record ExecutionResult(
        boolean success,
        int exitCode,
        String output
) {
    public static ExecutionResult ok(String output) {
        return new ExecutionResult(true, 0, output);
    }

    public static ExecutionResult fail(int exitCode, String output) {
        return new ExecutionResult(false, exitCode, output);
    }
}
