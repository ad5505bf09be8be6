package io.loopforge.engine;

public enum PipelineAction {
    PROMPT,
    VERIFY,
    FIXUP,
    NONE
}
