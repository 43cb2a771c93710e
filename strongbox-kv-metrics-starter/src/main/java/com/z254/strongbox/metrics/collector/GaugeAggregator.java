package com.z254.strongbox.metrics.collector;

import com.z254.strongbox.metrics.domain.CollectionReport;
import com.z254.strongbox.metrics.domain.GaugeSample;
import com.z254.strongbox.metrics.domain.MountWalkResult;

import java.time.Instant;
import java.util.List;

/**
 * Folds per-mount walk results into a {@link CollectionReport}.
 * <p>
 * Stateless; the same results always produce the same report. Every successful mount
 * yields exactly one sample, in input order.
 */
public final class GaugeAggregator {

    private GaugeAggregator() {
    }

    /**
     * @param results walk results in mount enumeration order
     */
    public static CollectionReport aggregate(List<MountWalkResult> results,
                                             Instant startedAt,
                                             Instant completedAt) {
        CollectionReport.CollectionReportBuilder report = CollectionReport.builder()
                .startedAt(startedAt)
                .completedAt(completedAt);

        for (MountWalkResult result : results) {
            switch (result.getStatus()) {
                case SUCCESS -> report.sample(GaugeSample.of(result.getMount(), result.getSecretCount()));
                case FAILED -> report.failedMount(result.getMount());
                case CANCELLED -> report.cancelledMount(result.getMount());
            }
        }
        return report.build();
    }
}
