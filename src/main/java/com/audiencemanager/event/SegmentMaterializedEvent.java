package com.audiencemanager.event;

import com.audiencemanager.domain.model.MaterializationRun;
import java.time.Duration;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the materialization executor after every run, successful or not.
 *
 * <p>Consumed by {@code SegmentMetricsService} to count runs by outcome and time them.
 */
public class SegmentMaterializedEvent extends ApplicationEvent {

    private final MaterializationRun run;
    private final Duration duration;

    public SegmentMaterializedEvent(Object source, MaterializationRun run, Duration duration) {
        super(source);
        this.run = run;
        this.duration = duration;
    }

    public MaterializationRun getRun() {
        return run;
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean isSuccess() {
        return run.isSuccess();
    }
}
