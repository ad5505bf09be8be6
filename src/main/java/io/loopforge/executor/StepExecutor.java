package io.loopforge.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runs the external work of a pipeline step. Implementations must be safe to call from
 * several workers at once.
 */
public interface StepExecutor {
    /**
     * Runs the modification agent for the prompt or fixup step.
     *
     * @throws ExecutorException when the agent could not be started or crashed
     */
    ExecutionResult run(String prompt, String filePath, JsonNode metadata) throws ExecutorException;

    /**
     * Runs a fully resolved verify command; {@link ExecutionResult#success()} means it passed.
     *
     * @throws ExecutorException when the command could not be started
     */
    ExecutionResult verify(String command) throws ExecutorException;
}
