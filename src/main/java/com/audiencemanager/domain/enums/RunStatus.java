package com.audiencemanager.domain.enums;

/** Outcome of a materialization run. */
public enum RunStatus {
    SUCCEEDED,
    DEPENDENCY_LOAD_FAILED,
    EXECUTION_FAILED,
    METADATA_UPDATE_FAILED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
