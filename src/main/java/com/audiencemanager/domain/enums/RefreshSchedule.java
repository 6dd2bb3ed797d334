package com.audiencemanager.domain.enums;

import java.time.Duration;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Refresh cadence of a rule's segment.
 *
 * <p>The next run is always computed from the current time, never from the previous
 * {@code nextRunAt}, so repeated failures cannot accumulate drift. {@link #ONCE} still
 * carries a one-day interval: a rule that was scheduled once keeps a daily refresh
 * slot rather than silently falling out of the scheduler.
 */
@Getter
@RequiredArgsConstructor
public enum RefreshSchedule {
    ONCE(Duration.ofDays(1)),
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7));

    private final Duration interval;

    public LocalDateTime nextRunFrom(LocalDateTime now) {
        return now.plus(interval);
    }
}
