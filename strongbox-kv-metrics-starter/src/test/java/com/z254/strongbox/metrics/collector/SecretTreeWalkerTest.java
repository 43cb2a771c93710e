package com.z254.strongbox.metrics.collector;

import com.z254.strongbox.metrics.domain.CollectionCancelledException;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.KvMount;
import com.z254.strongbox.metrics.domain.KvVersion;
import com.z254.strongbox.metrics.domain.MountWalkResult;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.source.KvStorage;
import com.z254.strongbox.metrics.source.StorageListException;
import com.z254.strongbox.metrics.source.inmemory.InMemorySecretStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SecretTreeWalker.
 */
@DisplayName("SecretTreeWalker Tests")
class SecretTreeWalkerTest {

    private static final Namespace ROOT = Namespace.root();

    private InMemorySecretStore store;
    private SecretTreeWalker walker;
    private final CollectionContext context = CollectionContext.unbounded();

    @BeforeEach
    void setUp() {
        store = new InMemorySecretStore();
        walker = new SecretTreeWalker(store);
    }

    @Nested
    @DisplayName("Unversioned mounts")
    class UnversionedTests {

        @Test
        @DisplayName("should count leaves at any depth")
        void shouldCountLeavesAtAnyDepth() {
            // Given
            store.mountKv(ROOT, "secret1/", "1");
            store.writeSecret(ROOT, "secret1/", "a");
            store.writeSecret(ROOT, "secret1/", "b");
            store.writeSecret(ROOT, "secret1/", "c/d");
            store.writeSecret(ROOT, "secret1/", "x/y/z/w");
            KvMount mount = new KvMount(ROOT, "secret1/", KvVersion.UNVERSIONED);

            // When
            MountWalkResult result = walker.walk(context, mount);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSecretCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should count zero for an empty mount")
        void shouldCountZeroForEmptyMount() {
            store.mountKv(ROOT, "empty/", null);

            MountWalkResult result = walker.walk(context, new KvMount(ROOT, "empty/", KvVersion.UNVERSIONED));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSecretCount()).isZero();
        }

        @Test
        @DisplayName("should walk a 10,000 level deep chain without overflowing the stack")
        void shouldWalkDeepChain() {
            // Given
            store.mountKv(ROOT, "deep/", "1");
            StringBuilder path = new StringBuilder();
            for (int i = 0; i < 10_000; i++) {
                path.append("d/");
            }
            store.writeSecret(ROOT, "deep/", path + "leaf");
            store.writeSecret(ROOT, "deep/", "top");

            // When
            MountWalkResult result = walker.walk(context, new KvMount(ROOT, "deep/", KvVersion.UNVERSIONED));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSecretCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Versioned mounts")
    class VersionedTests {

        @Test
        @DisplayName("should count only keys under metadata/")
        void shouldCountOnlyMetadata() {
            // Given
            store.mountKv(ROOT, "secret3/", "2");
            for (String secret : List.of("a", "b", "nested/c", "nested/deeper/d")) {
                store.writeSecret(ROOT, "secret3/", secret);
            }
            for (int i = 0; i < 50; i++) {
                store.putRaw(ROOT, "secret3/", "versions/extra/" + i);
            }
            store.putRaw(ROOT, "secret3/", "policy/config");

            // When
            MountWalkResult result = walker.walk(context, new KvMount(ROOT, "secret3/", KvVersion.VERSIONED));

            // Then
            assertThat(result.getSecretCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should count zero when nothing is stored")
        void shouldCountZeroWhenEmpty() {
            store.mountKv(ROOT, "secret/", "2");

            MountWalkResult result = walker.walk(context, new KvMount(ROOT, "secret/", KvVersion.VERSIONED));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSecretCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        private final KvMount mount = new KvMount(ROOT, "broken/", KvVersion.UNVERSIONED);

        @Test
        @DisplayName("should fail the mount when the root list fails")
        void shouldFailOnRootListFailure() {
            // Given
            KvStorage storage = (ctx, m, key) -> {
                throw new StorageListException(m, key, "backend unreachable", null);
            };

            // When
            MountWalkResult result = new SecretTreeWalker(storage).walk(context, mount);

            // Then
            assertThat(result.isFailed()).isTrue();
            assertThat(result.getFailure()).isInstanceOf(StorageListException.class);
        }

        @Test
        @DisplayName("should stop at the first failure deep in the tree")
        void shouldStopAtFirstDeepFailure() {
            // Given
            AtomicInteger calls = new AtomicInteger();
            KvStorage storage = (ctx, m, key) -> {
                calls.incrementAndGet();
                if (key.isEmpty()) {
                    return List.of("a/", "b/", "leaf");
                }
                throw new StorageListException(m, key, "read timeout", null);
            };

            // When
            MountWalkResult result = new SecretTreeWalker(storage).walk(context, mount);

            // Then
            assertThat(result.isFailed()).isTrue();
            assertThat(result.getSecretCount()).isZero();
            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail a mount removed after enumeration")
        void shouldFailRemovedMount() {
            MountWalkResult result = walker.walk(context, new KvMount(ROOT, "gone/", KvVersion.UNVERSIONED));

            assertThat(result.isFailed()).isTrue();
            assertThat(((StorageListException) result.getFailure()).isMountMissing()).isTrue();
        }

        @Test
        @DisplayName("should report cancellation instead of failure")
        void shouldReportCancellation() {
            // Given
            KvStorage storage = (ctx, m, key) -> {
                throw new CollectionCancelledException("Collection cancelled");
            };

            // When
            MountWalkResult result = new SecretTreeWalker(storage).walk(context, mount);

            // Then
            assertThat(result.isCancelled()).isTrue();
            assertThat(result.getFailure()).isNull();
        }

        @Test
        @DisplayName("should not list anything once the context is done")
        void shouldNotListWhenContextDone() {
            // Given
            AtomicInteger calls = new AtomicInteger();
            KvStorage storage = (ctx, m, key) -> {
                calls.incrementAndGet();
                return List.of();
            };
            CollectionContext cancelled = CollectionContext.unbounded();
            cancelled.cancel();

            // When
            MountWalkResult result = new SecretTreeWalker(storage).walk(cancelled, mount);

            // Then
            assertThat(result.isCancelled()).isTrue();
            assertThat(calls.get()).isZero();
        }
    }
}
