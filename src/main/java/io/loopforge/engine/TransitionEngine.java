package io.loopforge.engine;

import io.loopforge.model.FileStatus;

/**
 * Transition table of a file's pipeline. Stateless: every input arrives as an argument and
 * every result is returned, so the retry bound is a property of the data alone.
 *
 * <pre>
 * pending                + NONE            -> prompt_in_progress
 * prompt_in_progress     + SUCCESS         -> awaiting_verification | completed (no verify command)
 * prompt_in_progress     + FAILURE, ERROR  -> failed
 * awaiting_verification  + NONE            -> verify_in_progress
 * verify_in_progress     + SUCCESS         -> completed
 * verify_in_progress     + FAILURE         -> fixup_in_progress (retry + 1) | failed (retries exhausted)
 * verify_in_progress     + ERROR           -> failed
 * fixup_in_progress      + SUCCESS, FAILURE -> awaiting_verification
 * fixup_in_progress      + ERROR           -> failed
 * </pre>
 */
public final class TransitionEngine {
    private TransitionEngine() {
    }

    public static PipelineAction nextAction(FileStatus status) {
        return switch (status) {
            case PENDING, PROMPT_IN_PROGRESS -> PipelineAction.PROMPT;
            case AWAITING_VERIFICATION, VERIFY_IN_PROGRESS -> PipelineAction.VERIFY;
            case FIXUP_IN_PROGRESS -> PipelineAction.FIXUP;
            case COMPLETED, FAILED -> PipelineAction.NONE;
        };
    }

    /**
     * Statuses a worker must move out of with a claim transition before running a step.
     * In-flight statuses found on disk skip the claim and restart their step.
     */
    public static boolean needsClaim(FileStatus status) {
        return status == FileStatus.PENDING || status == FileStatus.AWAITING_VERIFICATION;
    }

    public static Transition next(
            FileStatus status,
            int retryCount,
            int maxRetries,
            boolean verifyConfigured,
            StepOutcome outcome
    ) {
        if (retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalTransitionException(status, outcome,
                    "retry_count " + retryCount + " outside [0, " + maxRetries + "]");
        }
        return switch (status) {
            case PENDING -> {
                requireOutcome(status, outcome, StepOutcome.NONE);
                yield keep(status, FileStatus.PROMPT_IN_PROGRESS, retryCount);
            }
            case PROMPT_IN_PROGRESS -> switch (outcome) {
                case SUCCESS -> keep(status,
                        verifyConfigured ? FileStatus.AWAITING_VERIFICATION : FileStatus.COMPLETED,
                        retryCount);
                case FAILURE, ERROR -> keep(status, FileStatus.FAILED, retryCount);
                case NONE -> throw new IllegalTransitionException(status, outcome, "prompt step has not run");
            };
            case AWAITING_VERIFICATION -> {
                requireVerify(status, outcome, verifyConfigured);
                requireOutcome(status, outcome, StepOutcome.NONE);
                yield keep(status, FileStatus.VERIFY_IN_PROGRESS, retryCount);
            }
            case VERIFY_IN_PROGRESS -> {
                requireVerify(status, outcome, verifyConfigured);
                yield switch (outcome) {
                    case SUCCESS -> keep(status, FileStatus.COMPLETED, retryCount);
                    case FAILURE -> retryCount < maxRetries
                            ? new Transition(status, FileStatus.FIXUP_IN_PROGRESS, retryCount + 1, true)
                            : keep(status, FileStatus.FAILED, retryCount);
                    case ERROR -> keep(status, FileStatus.FAILED, retryCount);
                    case NONE -> throw new IllegalTransitionException(status, outcome, "verify step has not run");
                };
            }
            case FIXUP_IN_PROGRESS -> {
                requireVerify(status, outcome, verifyConfigured);
                yield switch (outcome) {
                    case SUCCESS, FAILURE -> keep(status, FileStatus.AWAITING_VERIFICATION, retryCount);
                    case ERROR -> keep(status, FileStatus.FAILED, retryCount);
                    case NONE -> throw new IllegalTransitionException(status, outcome, "fixup step has not run");
                };
            }
            case COMPLETED, FAILED -> throw new IllegalTransitionException(status, outcome, "status is terminal");
        };
    }

    private static Transition keep(FileStatus from, FileStatus to, int retryCount) {
        return new Transition(from, to, retryCount, false);
    }

    private static void requireOutcome(FileStatus status, StepOutcome actual, StepOutcome expected) {
        if (actual != expected) {
            throw new IllegalTransitionException(status, actual, "expected " + expected);
        }
    }

    private static void requireVerify(FileStatus status, StepOutcome outcome, boolean verifyConfigured) {
        if (!verifyConfigured) {
            throw new IllegalTransitionException(status, outcome, "no verify command configured");
        }
    }
}
