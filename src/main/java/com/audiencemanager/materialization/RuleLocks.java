package com.audiencemanager.materialization;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * One lock per rule, shared by the scheduler and the executor so that a rule's segment
 * is never materialized by two threads at once. Locks are reentrant: a composite run
 * that refreshes a dependency on its own thread never blocks on itself.
 */
@Component
public class RuleLocks {

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(Long ruleId) {
        return locks.computeIfAbsent(ruleId, id -> new ReentrantLock());
    }

    public void release(Long ruleId) {
        locks.remove(ruleId);
    }
}
