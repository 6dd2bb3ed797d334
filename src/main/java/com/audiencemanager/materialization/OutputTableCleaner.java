package com.audiencemanager.materialization;

import com.audiencemanager.event.RuleEvent;
import com.audiencemanager.event.RuleEventType;
import com.audiencemanager.exception.BatchEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Drops a deleted rule's output table once the deletion has committed. A rolled back
 * deletion leaves both the catalog entry and its table in place.
 */
@Component
public class OutputTableCleaner {

    private static final Logger log = LoggerFactory.getLogger(OutputTableCleaner.class);

    private final BatchEngine batchEngine;

    public OutputTableCleaner(BatchEngine batchEngine) {
        this.batchEngine = batchEngine;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRuleEvent(RuleEvent event) {
        if (event.getEventType() != RuleEventType.DELETED || event.getOutputTable() == null) {
            return;
        }
        try {
            batchEngine.dropTable(event.getOutputTable());
            log.info("Dropped {} of deleted rule {}", event.getOutputTable(), event.getRule().getId());
        } catch (BatchEngineException e) {
            // The catalog no longer references the table; it is only orphaned storage now
            log.warn("Could not drop {} of deleted rule {}: {}",
                    event.getOutputTable(), event.getRule().getId(), e.getMessage());
        }
    }
}
