package com.z254.strongbox.metrics.observability;

import com.z254.strongbox.metrics.collector.KvSecretGaugeCollector;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.CollectionReport;
import com.z254.strongbox.metrics.source.NamespaceAccessException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the KV secret gauge collector on a fixed delay and publishes each report.
 * <p>
 * A tick never throws out of the scheduler: an unreadable namespace tree is logged
 * and recorded, leaving the previously published rows in place. Stopping cancels the
 * tick in flight; its partial report is discarded rather than published.
 */
public class KvSecretGaugeScheduler {

    private static final Logger log = LoggerFactory.getLogger(KvSecretGaugeScheduler.class);

    private final KvSecretGaugeCollector collector;
    private final KvSecretMetrics metrics;
    private final Duration collectionInterval;
    private final Duration initialDelay;
    private final Duration collectionTimeout;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
            r -> new Thread(r, "kv-secret-gauge-scheduler"));
    private final AtomicReference<CollectionContext> inFlight = new AtomicReference<>();
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public KvSecretGaugeScheduler(KvSecretGaugeCollector collector,
                                  KvSecretMetrics metrics,
                                  Duration collectionInterval,
                                  Duration initialDelay,
                                  Duration collectionTimeout) {
        this.collector = collector;
        this.metrics = metrics;
        this.collectionInterval = collectionInterval;
        this.initialDelay = initialDelay;
        this.collectionTimeout = collectionTimeout;
    }

    @PostConstruct
    void start() {
        log.info("Scheduling KV secret gauge collection every {} (timeout {})", collectionInterval, collectionTimeout);
        scheduler.scheduleWithFixedDelay(this::runOnce,
                initialDelay.toMillis(),
                collectionInterval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void stop() {
        log.info("Shutting down KV secret gauge scheduler");
        stopping.set(true);
        CollectionContext context = inFlight.get();
        if (context != null) {
            context.cancel();
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one collection tick and publish its report.
     *
     * @return the report, or empty when the tick aborted; a report collected while
     * stopping is returned without being published
     */
    public Optional<CollectionReport> runOnce() {
        CollectionContext context = CollectionContext.withTimeout(collectionTimeout);
        inFlight.set(context);
        long started = System.nanoTime();
        try {
            CollectionReport report = collector.collect(context);
            if (stopping.get()) {
                log.info("Discarding KV secret gauge report of a tick cancelled by shutdown ({} cancelled mounts)",
                        report.getCancelledMounts().size());
                return Optional.of(report);
            }
            metrics.publish(report);
            if (!report.isComplete()) {
                log.info("KV secret gauge published with {} samples ({} mounts failed, {} cancelled)",
                        report.getSamples().size(), report.getFailedMounts().size(),
                        report.getCancelledMounts().size());
            }
            return Optional.of(report);
        } catch (NamespaceAccessException e) {
            log.error("KV secret gauge collection aborted: namespace tree unavailable", e);
            metrics.recordCollectionFailure(e, Duration.ofNanos(System.nanoTime() - started));
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("KV secret gauge collection failed unexpectedly", e);
            metrics.recordCollectionFailure(e, Duration.ofNanos(System.nanoTime() - started));
            return Optional.empty();
        } finally {
            inFlight.compareAndSet(context, null);
        }
    }
}
