package com.contextgraph.capture;

public enum RunState {
    ACTIVE,
    /** Paused for a human; cleared by a resume. */
    INTERRUPTED,
    FINALIZED
}
