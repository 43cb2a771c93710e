package com.z254.strongbox.metrics.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one collection tick.
 */
@Value
@Builder
public class CollectionReport {

    /** Samples to publish, one per successfully walked mount */
    @Singular
    List<GaugeSample> samples;

    /** Mounts whose walk failed this tick */
    @Singular
    List<KvMount> failedMounts;

    /** Mounts whose walk was cut short by cancellation or the tick deadline */
    @Singular
    List<KvMount> cancelledMounts;

    Instant startedAt;
    Instant completedAt;

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    public boolean isComplete() {
        return failedMounts.isEmpty() && cancelledMounts.isEmpty();
    }
}
