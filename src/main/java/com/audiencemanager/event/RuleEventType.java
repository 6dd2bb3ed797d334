package com.audiencemanager.event;

/**
 * Classifies the catalog change that produced a {@link RuleEvent}.
 */
public enum RuleEventType {

    /** Rule and segment were created; the rule needs a job slot. */
    CREATED,

    /** Conditions, schedule or active flag changed; the job slot must follow. */
    UPDATED,

    /** Rule, segment and output table are gone; the job slot must be removed. */
    DELETED,

    /** A manual run was requested. */
    TRIGGERED
}
