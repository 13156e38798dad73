package com.tinqer.plan;

public enum UpdateStage {
    INITIAL,
    WITH_SET,
    /** A WHERE clause or the full-table opt-in is present. */
    COMPLETE,
    WITH_RETURNING
}
