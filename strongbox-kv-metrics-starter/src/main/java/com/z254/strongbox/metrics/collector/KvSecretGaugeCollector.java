package com.z254.strongbox.metrics.collector;

import com.z254.strongbox.metrics.domain.CollectionCancelledException;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.CollectionReport;
import com.z254.strongbox.metrics.domain.KvMount;
import com.z254.strongbox.metrics.domain.MountWalkResult;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.observability.KvSecretMetrics;
import com.z254.strongbox.metrics.source.NamespaceAccessException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Computes the KV secret count gauge for one collection tick.
 * <p>
 * Flow:
 * 1. Enumerate namespaces (a failure here aborts the tick)
 * 2. Enumerate KV mounts per namespace (a failing namespace is skipped)
 * 3. Walk every mount on the bounded walk executor
 * 4. Gather results in enumeration order until the context deadline
 * 5. Count one collection error per failed mount and fold the results into a report
 * <p>
 * Cancellation or the deadline at any step yields a report of what was reached so
 * far; only an unreadable namespace tree aborts the tick. Holds no state between ticks.
 */
@Slf4j
public class KvSecretGaugeCollector {

    private final NamespaceEnumerator namespaceEnumerator;
    private final MountEnumerator mountEnumerator;
    private final SecretTreeWalker walker;
    private final ExecutorService walkExecutor;
    private final KvSecretMetrics metrics;
    private final Clock clock;

    public KvSecretGaugeCollector(NamespaceEnumerator namespaceEnumerator,
                                  MountEnumerator mountEnumerator,
                                  SecretTreeWalker walker,
                                  ExecutorService walkExecutor,
                                  KvSecretMetrics metrics) {
        this(namespaceEnumerator, mountEnumerator, walker, walkExecutor, metrics, Clock.systemUTC());
    }

    public KvSecretGaugeCollector(NamespaceEnumerator namespaceEnumerator,
                                  MountEnumerator mountEnumerator,
                                  SecretTreeWalker walker,
                                  ExecutorService walkExecutor,
                                  KvSecretMetrics metrics,
                                  Clock clock) {
        this.namespaceEnumerator = namespaceEnumerator;
        this.mountEnumerator = mountEnumerator;
        this.walker = walker;
        this.walkExecutor = walkExecutor;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run one tick.
     *
     * @throws NamespaceAccessException if the namespace tree cannot be read; no samples
     *                                  are produced in that case
     */
    public CollectionReport collect(CollectionContext context) {
        Instant startedAt = clock.instant();

        List<Namespace> namespaces;
        try {
            namespaces = namespaceEnumerator.listNamespaces(context);
        } catch (CollectionCancelledException e) {
            log.info("KV secret collection cancelled while enumerating namespaces: {}", e.getMessage());
            context.cancel();
            return GaugeAggregator.aggregate(List.of(), startedAt, clock.instant());
        }
        List<KvMount> mounts = mountEnumerator.findKvMounts(context, namespaces);
        log.debug("Collecting KV secret counts for {} mounts across {} namespaces",
                mounts.size(), namespaces.size());

        List<MountWalkResult> results = walkAll(context, mounts);

        for (MountWalkResult result : results) {
            if (result.isFailed()) {
                metrics.recordCollectionError();
            }
        }

        CollectionReport report = GaugeAggregator.aggregate(results, startedAt, clock.instant());
        log.debug("KV secret collection finished: samples={}, failed={}, cancelled={}, took={}ms",
                report.getSamples().size(), report.getFailedMounts().size(),
                report.getCancelledMounts().size(), report.duration().toMillis());
        return report;
    }

    private List<MountWalkResult> walkAll(CollectionContext context, List<KvMount> mounts) {
        List<Future<MountWalkResult>> futures = new ArrayList<>(mounts.size());
        for (KvMount mount : mounts) {
            if (context.isDone()) {
                break;
            }
            try {
                futures.add(walkExecutor.submit(() -> walker.walk(context, mount)));
            } catch (RejectedExecutionException e) {
                log.warn("Walk executor rejected mount {}, stopping submission", mount);
                break;
            }
        }

        List<MountWalkResult> results = new ArrayList<>(mounts.size());
        boolean expired = false;
        for (int i = 0; i < mounts.size(); i++) {
            KvMount mount = mounts.get(i);
            if (i >= futures.size()) {
                results.add(MountWalkResult.cancelled(mount));
                continue;
            }
            Future<MountWalkResult> future = futures.get(i);
            if (expired) {
                future.cancel(true);
                results.add(completedOrCancelled(future, mount));
                continue;
            }
            try {
                results.add(future.get(context.remaining().toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                log.warn("KV secret collection deadline reached while walking {}, returning partial results", mount);
                expired = true;
                context.cancel();
                future.cancel(true);
                results.add(MountWalkResult.cancelled(mount));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                expired = true;
                context.cancel();
                future.cancel(true);
                results.add(MountWalkResult.cancelled(mount));
            } catch (CancellationException e) {
                results.add(MountWalkResult.cancelled(mount));
            } catch (ExecutionException e) {
                log.error("Unexpected failure walking mount_point={} namespace={}",
                        mount.getMountPoint(), mount.getNamespace().metricLabel(), e.getCause());
                results.add(MountWalkResult.failure(mount, e.getCause()));
            }
        }
        return results;
    }

    private static MountWalkResult completedOrCancelled(Future<MountWalkResult> future, KvMount mount) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                return MountWalkResult.failure(mount, e.getCause());
            }
        }
        return MountWalkResult.cancelled(mount);
    }
}
