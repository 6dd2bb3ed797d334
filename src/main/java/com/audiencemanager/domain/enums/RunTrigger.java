package com.audiencemanager.domain.enums;

/** What started a materialization run. */
public enum RunTrigger {
    SCHEDULED,
    MANUAL,
    /** Started by a composite run that found this dependency missing or stale. */
    DEPENDENCY
}
