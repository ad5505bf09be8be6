package io.loopforge.runtime;

import io.loopforge.changes.ChangeTracker;
import io.loopforge.changes.ChangeTrackingException;
import io.loopforge.config.LoopForgeConfig;
import io.loopforge.engine.Transition;
import io.loopforge.guard.ChangeAuthorizationGuard;
import io.loopforge.model.FileState;
import io.loopforge.model.FileStatus;
import io.loopforge.model.GitSettings;
import io.loopforge.model.GitState;
import io.loopforge.model.StateSummary;
import io.loopforge.model.TaskReport;
import io.loopforge.model.TaskState;
import io.loopforge.observability.FailureLog;
import io.loopforge.observability.TransitionJournal;
import io.loopforge.pattern.PatternResolver;
import io.loopforge.storage.PersistenceException;
import io.loopforge.storage.TaskRegistry;
import io.loopforge.storage.TaskStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs one loaded task to the end: prepares change tracking, starts the worker pool over the
 * unfinished files, and marks the registry entry completed once every file is terminal.
 */
public final class TaskOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final TaskRegistry registry;
    private final CollaboratorFactory collaborators;
    private final MemoryGate memoryGate;
    private final Consumer<TaskState> stateListener;
    private final TransitionJournal journal;
    private final FailureLog failureLog;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile WorkerPool activePool;

    public TaskOrchestrator(
            LoopForgeConfig config,
            TaskRegistry registry,
            CollaboratorFactory collaborators,
            MemoryGate memoryGate,
            Consumer<TaskState> stateListener
    ) {
        this.registry = registry;
        this.collaborators = collaborators;
        this.memoryGate = memoryGate == null ? MemoryGate.disabled() : memoryGate;
        this.stateListener = stateListener == null ? s -> { } : stateListener;
        this.journal = new TransitionJournal(config.journalFile());
        this.failureLog = new FailureLog(config.failuresRoot());
    }

    public RunOutcome run(LoadedTask task) {
        MDC.put("task", task.taskId());
        TaskStateStore store = TaskStateStore.attach(task.stateFile(), task.state(), this::onPersisted);
        try {
            Path workingDir = Path.of(task.entry().workingDir());
            ChangeTracker tracker = prepareChangeTracking(store, workingDir);
            TaskState state = store.snapshot();
            if (state.isDone()) {
                log.info("Task {} has nothing left to do", state.id());
                return finished(store, RunStatus.DONE, null);
            }
            List<String> queue = selectFiles(store);
            WorkerPool pool = new WorkerPool(
                    store,
                    collaborators.executor(workingDir),
                    tracker,
                    new ChangeAuthorizationGuard(taskPatterns(state)),
                    new PatternResolver(workingDir),
                    journal,
                    failureLog,
                    memoryGate
            );
            activePool = pool;
            if (stopRequested.get()) {
                pool.requestStop();
            }
            WorkerPool.Result result = pool.run(queue);
            if (result.persistenceFailed()) {
                return persistenceFailed(store, result.persistenceFailure());
            }
            TaskState last = store.snapshot();
            if (last.isDone()) {
                return finished(store, RunStatus.DONE, null);
            }
            if (result.stopped()) {
                log.warn("Task {} interrupted with {} files remaining", last.id(), last.summary().remaining());
                return finished(store, RunStatus.INTERRUPTED, "interrupted");
            }
            if (result.workerErrors() > 0) {
                return finished(store, RunStatus.WORKER_ERROR, result.workerErrors() + " files hit unexpected errors");
            }
            log.info("Task {} paused with {} files remaining", last.id(), last.summary().remaining());
            return finished(store, RunStatus.PARTIAL, null);
        } catch (PersistenceException e) {
            return persistenceFailed(store, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finished(store, RunStatus.INTERRUPTED, "interrupted");
        } finally {
            activePool = null;
            MDC.remove("task");
        }
    }

    /**
     * Asks the running pool, if any, to stop claiming; also stops a run that has not started yet.
     */
    public void requestStop() {
        stopRequested.set(true);
        WorkerPool pool = activePool;
        if (pool != null) {
            pool.requestStop();
        }
    }

    private ChangeTracker prepareChangeTracking(TaskStateStore store, Path workingDir) {
        TaskState state = store.snapshot();
        GitSettings settings = state.config().git();
        ChangeTracker tracker = collaborators.changeTracker(workingDir, settings);
        if (!tracker.enabled()) {
            return tracker;
        }
        GitState gitState = state.gitState();
        if (!gitState.enabled()) {
            Set<String> baseline = tracker.captureBaseline();
            gitState = new GitState(true, tracker.currentBranch().orElse(null), null, baseline);
            if (settings.autoBranch()) {
                try {
                    gitState = gitState.withTaskBranch(tracker.createTaskBranch(state.id()));
                    log.info("Working on branch {}", gitState.taskBranch());
                } catch (ChangeTrackingException e) {
                    log.warn("Could not create task branch, staying on {}: {}", gitState.originalBranch(), e.getMessage());
                }
            }
            store.replace(state.withGitState(gitState, System.currentTimeMillis()));
            if (!baseline.isEmpty()) {
                log.info("{} files were already modified and are exempt from checks", baseline.size());
            }
        }
        return tracker.withBaseline(gitState.baselineDirtyFiles());
    }

    /**
     * Files left in flight by an earlier process go first, so they are driven again before any resting
     * file is claimed. In-flight files beyond {@code concurrency} are first set back to the resting
     * status their step started from; a fixup has no such status and keeps its place at the front.
     * {@code max_files} limits only the resting files added behind them.
     */
    private List<String> selectFiles(TaskStateStore store) {
        settleSurplusInFlight(store);
        TaskState state = store.snapshot();
        Integer limit = state.config().maxFiles();
        List<String> queue = new ArrayList<>();
        List<String> resting = new ArrayList<>();
        for (FileState file : state.files().values()) {
            if (file.status().isTerminal()) {
                continue;
            }
            if (file.status().isInFlight()) {
                queue.add(file.path());
            } else {
                resting.add(file.path());
            }
        }
        if (!queue.isEmpty()) {
            log.info("Restarting {} files left in flight", queue.size());
        }
        for (String path : resting) {
            if (limit != null && queue.size() >= limit) {
                break;
            }
            queue.add(path);
        }
        return queue;
    }

    private void settleSurplusInFlight(TaskStateStore store) {
        TaskState state = store.snapshot();
        int slots = state.config().concurrency();
        List<FileState> restartable = new ArrayList<>();
        for (FileState file : state.files().values()) {
            if (file.status() == FileStatus.FIXUP_IN_PROGRESS) {
                slots--;
            } else if (file.status().isInFlight()) {
                restartable.add(file);
            }
        }
        if (slots < 0) {
            log.warn("{} fixups were left in flight, more than {} workers", state.config().concurrency() - slots,
                    state.config().concurrency());
        }
        for (int i = Math.max(0, slots); i < restartable.size(); i++) {
            FileState file = restartable.get(i);
            FileStatus resting = file.status() == FileStatus.PROMPT_IN_PROGRESS
                    ? FileStatus.PENDING
                    : FileStatus.AWAITING_VERIFICATION;
            store.apply(file.withStatus(resting, file.retryCount()));
            log.info("{}: {} -> {} (more files in flight than workers)", file.path(), file.status().wireName(),
                    resting.wireName());
            try {
                journal.record(state.id(), "orchestrator", file.path(),
                        new Transition(file.status(), resting, file.retryCount(), false), "more files in flight than workers");
            } catch (RuntimeException e) {
                log.warn("Failed to journal transition of {}: {}", file.path(), e.getMessage());
            }
        }
    }

    private static Set<String> taskPatterns(TaskState state) {
        Set<String> patterns = new LinkedHashSet<>();
        for (String path : state.files().keySet()) {
            patterns.add(PatternResolver.expandBasic(state.config().allowlistPattern(), path));
        }
        return patterns;
    }

    private RunOutcome finished(TaskStateStore store, RunStatus status, String error) {
        TaskState state = store.snapshot();
        if (state.isDone()) {
            try {
                registry.markCompleted(state.id());
            } catch (PersistenceException e) {
                return persistenceFailed(store, e);
            }
        }
        StateSummary summary = state.summary();
        log.info("Task {}: {} completed, {} failed, {} remaining", state.id(),
                summary.completed(), summary.failed(), summary.remaining());
        return new RunOutcome(status, TaskReport.of(state, store.stateFile().toString()), error);
    }

    private RunOutcome persistenceFailed(TaskStateStore store, PersistenceException failure) {
        log.error("Task state could not be persisted: {}", failure.getMessage());
        try {
            store.flush();
        } catch (PersistenceException e) {
            log.error("Final flush failed as well: {}", e.getMessage());
        }
        TaskState state = store.snapshot();
        return new RunOutcome(RunStatus.PERSISTENCE_FAILED,
                TaskReport.of(state, store.stateFile().toString()), failure.getMessage());
    }

    private void onPersisted(TaskState state) {
        if (log.isDebugEnabled()) {
            log.debug("Persisted {}: {}", state.id(), state.summary());
        }
        stateListener.accept(state);
    }
}
