package com.z254.strongbox.metrics.config;

import com.z254.strongbox.metrics.collector.KvSecretGaugeCollector;
import com.z254.strongbox.metrics.collector.MountEnumerator;
import com.z254.strongbox.metrics.collector.NamespaceEnumerator;
import com.z254.strongbox.metrics.collector.SecretTreeWalker;
import com.z254.strongbox.metrics.observability.KvSecretGaugeHealthIndicator;
import com.z254.strongbox.metrics.observability.KvSecretGaugeScheduler;
import com.z254.strongbox.metrics.observability.KvSecretMetrics;
import com.z254.strongbox.metrics.source.KvStorage;
import com.z254.strongbox.metrics.source.MountTable;
import com.z254.strongbox.metrics.source.NamespaceTree;
import com.z254.strongbox.metrics.source.inmemory.InMemorySecretStore;
import com.z254.strongbox.metrics.source.vault.VaultHttpClient;
import com.z254.strongbox.metrics.source.vault.VaultKvStorage;
import com.z254.strongbox.metrics.source.vault.VaultMountTable;
import com.z254.strongbox.metrics.source.vault.VaultNamespaceTree;
import com.z254.strongbox.metrics.source.vault.VaultProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Auto-configuration for the KV secret count gauge.
 * <p>
 * Wires the collector against either the in-memory development store or a Vault
 * server, publishes through Micrometer and schedules periodic collection.
 */
@AutoConfiguration
@EnableConfigurationProperties(KvMetricsProperties.class)
@ConditionalOnProperty(prefix = "strongbox.metrics.kv", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KvMetricsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(KvMetricsAutoConfiguration.class);

    static final String WALK_EXECUTOR_BEAN = "kvSecretWalkExecutor";

    // =========================================================================
    // Sources
    // =========================================================================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "strongbox.metrics.kv", name = "source", havingValue = "inmemory", matchIfMissing = true)
    static class InMemorySourceConfiguration {

        @Bean
        @ConditionalOnMissingBean({NamespaceTree.class, MountTable.class, KvStorage.class})
        InMemorySecretStore inMemorySecretStore() {
            log.info("Configuring in-memory KV secret source (development/testing)");
            return new InMemorySecretStore();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "strongbox.metrics.kv", name = "source", havingValue = "vault")
    @EnableConfigurationProperties(VaultProperties.class)
    static class VaultSourceConfiguration {

        @Bean
        @ConditionalOnMissingBean
        VaultHttpClient vaultHttpClient(VaultProperties vaultProperties) {
            log.info("Configuring Vault KV secret source with URI: {}", vaultProperties.getUri());
            return VaultHttpClient.create(vaultProperties);
        }

        @Bean
        @ConditionalOnMissingBean
        NamespaceTree vaultNamespaceTree(VaultHttpClient client) {
            return new VaultNamespaceTree(client);
        }

        @Bean
        @ConditionalOnMissingBean
        MountTable vaultMountTable(VaultHttpClient client) {
            return new VaultMountTable(client);
        }

        @Bean
        @ConditionalOnMissingBean
        KvStorage vaultKvStorage(VaultHttpClient client) {
            return new VaultKvStorage(client);
        }
    }

    // =========================================================================
    // Collection
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public NamespaceEnumerator namespaceEnumerator(NamespaceTree namespaceTree) {
        return new NamespaceEnumerator(namespaceTree);
    }

    @Bean
    @ConditionalOnMissingBean
    public MountEnumerator mountEnumerator(MountTable mountTable, KvMetricsProperties properties) {
        return new MountEnumerator(mountTable, properties.engineTypeSet(), properties.getUnrecognizedVersionLayout());
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretTreeWalker secretTreeWalker(KvStorage kvStorage) {
        return new SecretTreeWalker(kvStorage);
    }

    @Bean(name = WALK_EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = WALK_EXECUTOR_BEAN)
    public ExecutorService kvSecretWalkExecutor(KvMetricsProperties properties) {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentWalks()), r -> {
            Thread thread = new Thread(r, "kv-secret-walker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public KvSecretMetrics kvSecretMetrics(ObjectProvider<MeterRegistry> meterRegistry,
                                           KvMetricsProperties properties) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.warn("No MeterRegistry available, KV secret gauge will not be exported");
            registry = new SimpleMeterRegistry();
        }
        return new KvSecretMetrics(registry, properties.getMaxGaugeCardinality());
    }

    @Bean
    @ConditionalOnMissingBean
    public KvSecretGaugeCollector kvSecretGaugeCollector(NamespaceEnumerator namespaceEnumerator,
                                                         MountEnumerator mountEnumerator,
                                                         SecretTreeWalker secretTreeWalker,
                                                         @Qualifier(WALK_EXECUTOR_BEAN) ExecutorService walkExecutor,
                                                         KvSecretMetrics metrics,
                                                         KvMetricsProperties properties) {
        log.info("Configuring KV secret gauge collector (max concurrent walks: {}, max exported rows: {})",
                properties.getMaxConcurrentWalks(), properties.getMaxGaugeCardinality());
        return new KvSecretGaugeCollector(namespaceEnumerator, mountEnumerator, secretTreeWalker,
                walkExecutor, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "strongbox.metrics.kv", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
    public KvSecretGaugeScheduler kvSecretGaugeScheduler(KvSecretGaugeCollector collector,
                                                         KvSecretMetrics metrics,
                                                         KvMetricsProperties properties) {
        return new KvSecretGaugeScheduler(collector, metrics,
                properties.getCollectionInterval(),
                properties.getInitialDelay(),
                properties.getCollectionTimeout());
    }

    // =========================================================================
    // Health
    // =========================================================================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "kvSecretGaugeHealthIndicator")
        HealthIndicator kvSecretGaugeHealthIndicator(KvSecretMetrics metrics) {
            return new KvSecretGaugeHealthIndicator(metrics);
        }
    }
}
