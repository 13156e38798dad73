package com.tinqer.plan;

public enum InsertStage {
    INITIAL,
    WITH_VALUES,
    WITH_CONFLICT_TARGET,
    WITH_RETURNING
}
