package com.tinqer.plan;

public enum PlanKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE
}
