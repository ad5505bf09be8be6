/**
 * Task execution.
 *
 * <p>{@link io.loopforge.runtime.LoopForgeRuntime} is the facade the CLI talks to.
 * {@link io.loopforge.runtime.TaskOrchestrator} runs one task through a
 * {@link io.loopforge.runtime.WorkerPool}; workers coordinate through a
 * {@link io.loopforge.runtime.ClaimQueue} and persist every transition through
 * {@link io.loopforge.storage.TaskStateStore} before moving on.
 */
package io.loopforge.runtime;
