package com.z254.strongbox.metrics.observability;

import com.z254.strongbox.metrics.domain.CollectionReport;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health of the KV secret gauge, based on the most recent collection tick.
 * <p>
 * Reports UNKNOWN until the first tick, UP after a tick that produced a report (even
 * one with failed mounts, which show up in the details) and DOWN after an aborted tick.
 */
public class KvSecretGaugeHealthIndicator implements HealthIndicator {

    private final KvSecretMetrics metrics;

    public KvSecretGaugeHealthIndicator(KvSecretMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public Health health() {
        return metrics.getLastOutcome()
                .map(outcome -> outcome.isCompleted()
                        ? completed(outcome.report(), outcome.truncatedRows())
                        : Health.down()
                                .withDetail("error", outcome.failure())
                                .withDetail("lastAttemptAt", outcome.at().toString())
                                .build())
                .orElseGet(() -> Health.unknown()
                        .withDetail("reason", "No collection has run yet")
                        .build());
    }

    private static Health completed(CollectionReport report, int truncatedRows) {
        Health.Builder builder = Health.up()
                .withDetail("samples", report.getSamples().size())
                .withDetail("failedMounts", report.getFailedMounts().size())
                .withDetail("cancelledMounts", report.getCancelledMounts().size())
                .withDetail("truncatedSamples", truncatedRows)
                .withDetail("durationMs", report.duration().toMillis());
        if (report.getCompletedAt() != null) {
            builder.withDetail("lastCollectedAt", report.getCompletedAt().toString());
        }
        return builder.build();
    }
}
