package io.loopforge.runtime;

import io.loopforge.config.LoopForgeConfig;
import io.loopforge.model.RegistryEntry;
import io.loopforge.model.TaskReport;
import io.loopforge.model.TaskState;
import io.loopforge.storage.ResumeInconsistencyException;
import io.loopforge.storage.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Entry points used by the CLI: create, run, resume, list and report tasks of one tasks directory.
 */
public final class LoopForgeRuntime {
    private static final Logger log = LoggerFactory.getLogger(LoopForgeRuntime.class);

    private final LoopForgeConfig config;
    private final TaskRegistry registry;
    private final TaskFactory taskFactory;
    private final ResumeLoader resumeLoader;
    private final TaskOrchestrator orchestrator;

    public LoopForgeRuntime(LoopForgeConfig config, CollaboratorFactory collaborators, MemoryGate memoryGate) {
        this(config, collaborators, memoryGate, null);
    }

    public LoopForgeRuntime(
            LoopForgeConfig config,
            CollaboratorFactory collaborators,
            MemoryGate memoryGate,
            Consumer<TaskState> stateListener
    ) {
        this.config = config;
        this.registry = TaskRegistry.open(config.registryFile());
        this.taskFactory = new TaskFactory(config, registry);
        this.resumeLoader = new ResumeLoader(config, registry);
        this.orchestrator = new TaskOrchestrator(config, registry, collaborators, memoryGate, stateListener);
    }

    public LoopForgeConfig config() {
        return config;
    }

    /**
     * Records a new all-pending task without processing anything.
     */
    public LoadedTask createTask(TaskRequest request) {
        return taskFactory.create(request);
    }

    public RunOutcome run(LoadedTask task) {
        return orchestrator.run(task);
    }

    public RunOutcome createAndRun(TaskRequest request) {
        return run(createTask(request));
    }

    /**
     * @param taskId      task to resume, or {@code null} for the first incomplete one
     * @param concurrency worker count override, or {@code null}
     */
    public RunOutcome resume(String taskId, Integer concurrency) {
        LoadedTask task;
        try {
            task = resumeLoader.load(taskId, concurrency);
        } catch (ResumeInconsistencyException e) {
            log.error("Cannot resume: {}", e.getMessage());
            return new RunOutcome(RunStatus.RESUME_INCONSISTENT, null, e.getMessage());
        }
        return run(task);
    }

    public List<RegistryEntry> tasks() {
        return registry.entries();
    }

    public TaskReport report(String taskId) {
        RegistryEntry entry = registry.find(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        TaskState state = ResumeLoader.readValidated(entry, config.stateFile(entry.stateFile()));
        return TaskReport.of(state, config.stateFile(entry.stateFile()).toString());
    }

    public void requestStop() {
        orchestrator.requestStop();
    }
}
