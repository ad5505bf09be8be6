package io.loopforge.engine;

/**
 * What the last external step reported. {@code NONE} is the claim trigger: no step ran yet.
 * {@code ERROR} means the step could not run at all, as opposed to running and failing.
 */
public enum StepOutcome {
    NONE,
    SUCCESS,
    FAILURE,
    ERROR
}
