package com.tinqer.plan;

public enum SelectStage {
    /** Further query operations or a terminal may follow. */
    QUERY,
    /** A terminal operation was applied; only finalize remains. */
    TERMINAL
}
