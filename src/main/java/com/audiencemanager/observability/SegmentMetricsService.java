package com.audiencemanager.observability;

import com.audiencemanager.domain.enums.RunStatus;
import com.audiencemanager.event.SegmentMaterializedEvent;
import com.audiencemanager.materialization.MaterializationScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the Micrometer metrics of segment materialization.
 *
 * <ul>
 *   <li><b>segment.materializations</b> (counter, tag {@code status}): one per run outcome</li>
 *   <li><b>segment.materialization.duration</b> (timer): wall time of a run</li>
 *   <li><b>segment.rows</b> (summary): rows written by successful runs</li>
 *   <li><b>segment.scheduled.jobs</b> (gauge): job slots currently registered</li>
 * </ul>
 *
 * <p>Counters, timer and summary are fed by {@link SegmentMaterializedEvent}; the gauge is
 * polled by Micrometer when scraping.
 */
@Service
public class SegmentMetricsService {

    private static final Logger log = LoggerFactory.getLogger(SegmentMetricsService.class);

    private final Map<RunStatus, Counter> runCounters = new EnumMap<>(RunStatus.class);
    private final Timer runTimer;
    private final DistributionSummary rowsWritten;

    public SegmentMetricsService(MeterRegistry meterRegistry, MaterializationScheduler materializationScheduler) {
        for (RunStatus status : RunStatus.values()) {
            runCounters.put(
                    status,
                    Counter.builder("segment.materializations")
                            .description("Segment materialization runs by outcome")
                            .tag("status", status.name())
                            .register(meterRegistry));
        }

        this.runTimer = Timer.builder("segment.materialization.duration")
                .description("Wall time of a segment materialization run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofMinutes(30))
                .register(meterRegistry);

        this.rowsWritten = DistributionSummary.builder("segment.rows")
                .description("Rows written per successful materialization")
                .register(meterRegistry);

        meterRegistry.gauge(
                "segment.scheduled.jobs", materializationScheduler, scheduler -> scheduler.getScheduledJobIds()
                        .size());
    }

    @Async("eventExecutor")
    @EventListener
    @Order(20)
    public void onSegmentMaterialized(SegmentMaterializedEvent event) {
        RunStatus status = event.getRun().getStatus();
        if (status != null) {
            runCounters.get(status).increment();
        }
        if (event.getDuration() != null) {
            runTimer.record(event.getDuration());
        }
        if (event.isSuccess() && event.getRun().getRowCount() != null) {
            rowsWritten.record(event.getRun().getRowCount());
        } else if (!event.isSuccess()) {
            log.debug("Counted failed run of rule {} ({})", event.getRun().getRuleId(), status);
        }
    }
}
