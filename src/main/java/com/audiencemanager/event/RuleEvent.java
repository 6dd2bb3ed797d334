package com.audiencemanager.event;

import com.audiencemanager.domain.model.Rule;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the segment catalog whenever a rule changes or a manual run is requested.
 *
 * <p>Listeners run after the catalog transaction commits, so a job is only registered for
 * a rule that actually exists, and an output table is only dropped once the deletion of
 * its rule is durable. {@link #getOutputTable()} is set for {@link RuleEventType#DELETED}.
 */
public class RuleEvent extends ApplicationEvent {

    private final Rule rule;
    private final RuleEventType eventType;
    private final String outputTable;

    public RuleEvent(Object source, Rule rule, RuleEventType eventType) {
        this(source, rule, eventType, null);
    }

    public RuleEvent(Object source, Rule rule, RuleEventType eventType, String outputTable) {
        super(source);
        this.rule = rule;
        this.eventType = eventType;
        this.outputTable = outputTable;
    }

    public Rule getRule() {
        return rule;
    }

    public RuleEventType getEventType() {
        return eventType;
    }

    public String getOutputTable() {
        return outputTable;
    }
}
