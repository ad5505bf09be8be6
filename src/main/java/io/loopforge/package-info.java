/**
 * LoopForge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.loopforge.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.loopforge.cli.LoopForgeCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.loopforge.runtime.WorkerPool} drives files through the pipeline.</li>
 *   <li>{@code io.loopforge.engine.TransitionEngine} owns the legal status changes.</li>
 *   <li>{@code io.loopforge.storage.TaskStateStore} is the only writer of task state.</li>
 * </ul>
 */
package io.loopforge;
