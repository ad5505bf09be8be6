package io.loopforge.runtime;

import io.loopforge.changes.ChangeCheckpoint;
import io.loopforge.changes.ChangeTracker;
import io.loopforge.changes.ChangeTrackingException;
import io.loopforge.config.LoopForgeConfig;
import io.loopforge.engine.StepOutcome;
import io.loopforge.engine.Transition;
import io.loopforge.engine.TransitionEngine;
import io.loopforge.executor.ExecutionResult;
import io.loopforge.executor.ExecutorException;
import io.loopforge.executor.PromptBuilder;
import io.loopforge.executor.ResultParser;
import io.loopforge.executor.StepExecutor;
import io.loopforge.guard.AuthorizationDecision;
import io.loopforge.guard.ChangeAuthorizationGuard;
import io.loopforge.model.FileState;
import io.loopforge.model.FileStatus;
import io.loopforge.model.TaskConfig;
import io.loopforge.observability.FailureLog;
import io.loopforge.observability.TransitionJournal;
import io.loopforge.pattern.PatternResolver;
import io.loopforge.storage.PersistenceException;
import io.loopforge.storage.TaskStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed pool of {@code concurrency} workers driving claimed files through the pipeline.
 *
 * <p>A worker holds its claim while the file sits in an in-flight status and gives it back once
 * the file rests in {@code awaiting_verification} or is terminal, so in-flight files never outnumber
 * workers. Every transition is persisted through the {@link TaskStateStore} before the next step
 * of that file starts. A failed write stops all claiming; the pool then drains and reports it.
 */
public final class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final int ERROR_OUTPUT_LIMIT = 2_000;

    private final TaskStateStore store;
    private final StepExecutor executor;
    private final ChangeTracker changeTracker;
    private final ChangeAuthorizationGuard guard;
    private final PatternResolver resolver;
    private final TransitionJournal journal;
    private final FailureLog failureLog;
    private final MemoryGate memoryGate;
    private final Set<String> baseline;
    private final Map<String, ChangeCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final Map<String, String> verifyOutputs = new ConcurrentHashMap<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicReference<PersistenceException> persistenceFailure = new AtomicReference<>();
    private final AtomicInteger workerErrors = new AtomicInteger(0);
    private volatile ClaimQueue queue;

    public WorkerPool(
            TaskStateStore store,
            StepExecutor executor,
            ChangeTracker changeTracker,
            ChangeAuthorizationGuard guard,
            PatternResolver resolver,
            TransitionJournal journal,
            FailureLog failureLog,
            MemoryGate memoryGate
    ) {
        this.store = store;
        this.executor = executor;
        this.changeTracker = changeTracker;
        this.guard = guard;
        this.resolver = resolver;
        this.journal = journal;
        this.failureLog = failureLog;
        this.memoryGate = memoryGate == null ? MemoryGate.disabled() : memoryGate;
        this.baseline = Set.copyOf(store.snapshot().gitState().baselineDirtyFiles());
    }

    /**
     * Drives the given files until each is terminal or resting, or until a stop is requested.
     * Blocks until every worker has returned.
     */
    public Result run(List<String> paths) throws InterruptedException {
        String taskId = store.snapshot().id();
        int workers = store.snapshot().config().concurrency();
        ClaimQueue claims = new ClaimQueue(paths);
        this.queue = claims;
        if (stopRequested.get()) {
            claims.close();
        }
        log.info("Starting {} workers for {} files", workers, paths.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads(taskId));
        try {
            for (int i = 1; i <= workers; i++) {
                String workerId = "worker-" + i;
                pool.submit(() -> drive(workerId, taskId, claims));
            }
        } finally {
            pool.shutdown();
        }
        while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
            log.debug("Waiting for {} claimed files to finish their step", claims.claimedCount());
        }
        return new Result(stopRequested.get(), persistenceFailure.get(), workerErrors.get());
    }

    /**
     * Stops handing out claims; steps already running finish and are persisted.
     */
    public void requestStop() {
        stopRequested.set(true);
        ClaimQueue claims = queue;
        if (claims != null) {
            claims.close();
        }
    }

    private void drive(String workerId, String taskId, ClaimQueue claims) {
        MDC.put("task", taskId);
        MDC.put("worker", workerId);
        try {
            while (!stopRequested.get()) {
                memoryGate.awaitCapacity(stopRequested::get);
                Optional<String> claimed = claims.claim();
                if (claimed.isEmpty()) {
                    break;
                }
                String path = claimed.get();
                MDC.put("file", path);
                boolean requeue = false;
                try {
                    requeue = advance(workerId, taskId, path);
                } catch (PersistenceException e) {
                    throw e;
                } catch (RuntimeException e) {
                    workerErrors.incrementAndGet();
                    log.error("Unhandled error while processing {}: {}", path, e.getMessage(), e);
                } finally {
                    claims.release(path, requeue);
                    MDC.remove("file");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted, leaving its file for resume", workerId);
        } catch (PersistenceException e) {
            if (persistenceFailure.compareAndSet(null, e)) {
                log.error("Persisting task state failed, stopping all workers: {}", e.getMessage(), e);
            }
            requestStop();
        } finally {
            MDC.clear();
        }
    }

    /**
     * Runs steps on one claimed file while it stays in flight.
     *
     * @return true when the file rests in {@code awaiting_verification} and goes back to the ready set
     */
    private boolean advance(String workerId, String taskId, String path) {
        TaskConfig config = store.snapshot().config();
        FileState file = store.file(path);
        while (!file.status().isTerminal() && !stopRequested.get()) {
            if (TransitionEngine.needsClaim(file.status())) {
                Transition claim = TransitionEngine.next(file.status(), file.retryCount(), config.maxRetries(),
                        config.hasVerifyCommand(), StepOutcome.NONE);
                file = persist(workerId, taskId, file.withStatus(claim.to(), claim.retryCount()), claim, null);
            }
            StepResult step = runStep(config, file);
            Transition transition = TransitionEngine.next(file.status(), file.retryCount(), config.maxRetries(),
                    config.hasVerifyCommand(), step.outcome());
            file = finish(workerId, taskId, config, file, transition, step);
            if (file.status() == FileStatus.AWAITING_VERIFICATION) {
                return !stopRequested.get();
            }
        }
        return false;
    }

    private StepResult runStep(TaskConfig config, FileState file) {
        String allowlist = PatternResolver.expandBasic(config.allowlistPattern(), file.path());
        return switch (TransitionEngine.nextAction(file.status())) {
            case PROMPT -> prompt(config, file, allowlist);
            case VERIFY -> verify(config, file);
            case FIXUP -> fixup(config, file, allowlist);
            case NONE -> throw new IllegalStateException("no step for status " + file.status().wireName());
        };
    }

    private StepResult prompt(TaskConfig config, FileState file, String allowlist) {
        String path = file.path();
        checkpoints.put(path, changeTracker.checkpoint());
        String base = resolver.resolve(config.prompt(), path, config.allowlistPattern());
        String prompt = PromptBuilder.prompt(base, path, file.metadata(), allowlist);
        log.info("Running prompt for {}", path);
        try {
            ExecutionResult result = executor.run(prompt, path, file.metadata());
            warnIfUnauthorized(path, allowlist);
            if (result.success()) {
                return StepResult.success(ResultParser.parse(result.output()));
            }
            return StepResult.of(StepOutcome.FAILURE,
                    "prompt failed (exit " + result.exitCode() + "): " + tail(result.output()));
        } catch (ExecutorException e) {
            return StepResult.of(StepOutcome.ERROR, "prompt could not run: " + e.getMessage());
        }
    }

    private StepResult verify(TaskConfig config, FileState file) {
        String path = file.path();
        checkpoints.computeIfAbsent(path, p -> changeTracker.checkpoint());
        String command = resolver.resolve(config.verifyCommand(), path, config.allowlistPattern());
        log.info("Verifying {} (attempt {})", path, file.retryCount() + 1);
        try {
            ExecutionResult result = executor.verify(command);
            if (result.success()) {
                return StepResult.success(null);
            }
            String output = result.output() == null ? "" : result.output();
            verifyOutputs.put(path, output);
            try {
                failureLog.verifyFailed(path, file.retryCount() + 1, command, output);
            } catch (RuntimeException e) {
                log.warn("Failed to write failure log for {}: {}", path, e.getMessage());
            }
            return StepResult.of(StepOutcome.FAILURE,
                    "verification failed (exit " + result.exitCode() + "): " + tail(output));
        } catch (ExecutorException e) {
            return StepResult.of(StepOutcome.ERROR, "verify command could not run: " + e.getMessage());
        }
    }

    private StepResult fixup(TaskConfig config, FileState file, String allowlist) {
        String path = file.path();
        checkpoints.computeIfAbsent(path, p -> changeTracker.checkpoint());
        String template = config.fixupPrompt() == null ? LoopForgeConfig.DEFAULT_FIXUP_PROMPT : config.fixupPrompt();
        String base = resolver.resolve(template, path, config.allowlistPattern());
        String verifyOutput = verifyOutputs.getOrDefault(path, file.lastError() == null ? "" : file.lastError());
        String prompt = PromptBuilder.fixup(base, path, verifyOutput, allowlist);
        log.info("Running fixup {} of {} for {}", file.retryCount(), config.maxRetries(), path);
        try {
            ExecutionResult result = executor.run(prompt, path, file.metadata());
            warnIfUnauthorized(path, allowlist);
            if (result.success()) {
                return StepResult.success(ResultParser.parse(result.output()));
            }
            return StepResult.of(StepOutcome.FAILURE,
                    "fixup failed (exit " + result.exitCode() + "): " + tail(result.output()));
        } catch (ExecutorException e) {
            return StepResult.of(StepOutcome.ERROR, "fixup could not run: " + e.getMessage());
        }
    }

    private FileState finish(
            String workerId,
            String taskId,
            TaskConfig config,
            FileState file,
            Transition transition,
            StepResult step
    ) {
        String path = file.path();
        String allowlist = PatternResolver.expandBasic(config.allowlistPattern(), path);
        Transition applied = transition;
        String error = step.detail();
        if (transition.isCompletion()) {
            Optional<String> veto = authorize(path, allowlist);
            if (veto.isPresent()) {
                error = veto.get();
                applied = new Transition(transition.from(), FileStatus.FAILED, transition.retryCount(), false);
            }
        }
        FileState next = file;
        if (step.hasResult()) {
            next = next.withResult(step.parsed().value(), step.parsed().raw());
        }
        if (error != null) {
            next = next.withError(error);
        }
        next = next.withStatus(applied.to(), applied.retryCount());
        FileState persisted = persist(workerId, taskId, next, applied, error);

        if (persisted.status() == FileStatus.COMPLETED) {
            commit(taskId, config, path);
        }
        if (persisted.status().isTerminal()) {
            checkpoints.remove(path);
            verifyOutputs.remove(path);
        }
        if (persisted.status() == FileStatus.FAILED) {
            log.warn("{} failed: {}", path, error);
            try {
                failureLog.failed(path, error);
            } catch (RuntimeException e) {
                log.warn("Failed to write failure log for {}: {}", path, e.getMessage());
            }
        }
        return persisted;
    }

    private FileState persist(String workerId, String taskId, FileState next, Transition transition, String detail) {
        store.apply(next);
        log.info("{}: {} -> {} (retry {})", next.path(), transition.from().wireName(), transition.to().wireName(),
                transition.retryCount());
        try {
            journal.record(taskId, workerId, next.path(), transition, detail);
        } catch (RuntimeException e) {
            log.warn("Failed to journal transition of {}: {}", next.path(), e.getMessage());
        }
        return next;
    }

    /**
     * @return the error that vetoes completion, if any
     */
    private Optional<String> authorize(String path, String allowlist) {
        if (!changeTracker.enabled()) {
            return Optional.empty();
        }
        try {
            ChangeCheckpoint checkpoint = checkpoints.computeIfAbsent(path, p -> changeTracker.checkpoint());
            AuthorizationDecision decision = guard.check(allowlist, changeTracker.diffSince(checkpoint), baseline);
            return decision.authorized() ? Optional.empty() : Optional.of(decision.detail());
        } catch (ChangeTrackingException e) {
            return Optional.of("cannot check changes: " + e.getMessage());
        }
    }

    private void warnIfUnauthorized(String path, String allowlist) {
        if (!changeTracker.enabled()) {
            return;
        }
        try {
            ChangeCheckpoint checkpoint = checkpoints.computeIfAbsent(path, p -> changeTracker.checkpoint());
            AuthorizationDecision decision = guard.check(allowlist, changeTracker.diffSince(checkpoint), baseline);
            if (!decision.authorized()) {
                log.warn("{} after step on {}", decision.detail(), path);
            }
        } catch (ChangeTrackingException e) {
            log.warn("Cannot check changes after step on {}: {}", path, e.getMessage());
        }
    }

    private void commit(String taskId, TaskConfig config, String path) {
        if (!config.git().autoCommit() || !changeTracker.enabled()) {
            return;
        }
        String template = config.git().commitMessageTemplate() == null
                ? LoopForgeConfig.DEFAULT_COMMIT_MESSAGE
                : config.git().commitMessageTemplate();
        String message = PatternResolver.expandWith(PatternResolver.expandBasic(template, path), Map.of("task_id", taskId));
        try {
            changeTracker.commit(path, message).ifPresentOrElse(
                    hash -> log.info("Committed {} as {}", path, hash),
                    () -> log.debug("Nothing to commit for {}", path));
        } catch (ChangeTrackingException e) {
            log.warn("Auto-commit failed for {}: {}", path, e.getMessage());
        }
    }

    private static String tail(String output) {
        if (output == null) {
            return "";
        }
        String stripped = output.strip();
        return stripped.length() <= ERROR_OUTPUT_LIMIT
                ? stripped
                : "..." + stripped.substring(stripped.length() - ERROR_OUTPUT_LIMIT);
    }

    private static ThreadFactory workerThreads(String taskId) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, "loopforge-" + taskId + "-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }

    public record Result(boolean stopped, PersistenceException persistenceFailure, int workerErrors) {
        public boolean persistenceFailed() {
            return persistenceFailure != null;
        }
    }
}
