package com.tinqer.plan;

public enum DeleteStage {
    INITIAL,
    /** A WHERE clause or the full-table opt-in is present. */
    COMPLETE
}
