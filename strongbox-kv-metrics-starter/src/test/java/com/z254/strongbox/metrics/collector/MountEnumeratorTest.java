package com.z254.strongbox.metrics.collector;

import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.KvMount;
import com.z254.strongbox.metrics.domain.KvVersion;
import com.z254.strongbox.metrics.domain.MountEntry;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.source.MountTable;
import com.z254.strongbox.metrics.source.MountTableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MountEnumerator Tests")
class MountEnumeratorTest {

    private static final Namespace ROOT = Namespace.root();
    private static final Namespace TEAM_A = new Namespace("ns1", "team-a/");

    @Mock
    private MountTable mountTable;

    private final CollectionContext context = CollectionContext.unbounded();

    @Test
    @DisplayName("should keep only key-value engines and resolve their layout")
    void shouldFilterKvMounts() {
        // Given
        when(mountTable.listMounts(any(), eq(ROOT))).thenReturn(List.of(
                kv("secret/", "2"),
                kv("kv1/", null),
                MountEntry.builder().path("old/").type("generic").build(),
                MountEntry.builder().path("transit/").type("transit").build(),
                MountEntry.builder().path("sys/").type("system").build()));

        // When
        List<KvMount> mounts = new MountEnumerator(mountTable).findKvMounts(context, ROOT);

        // Then
        assertThat(mounts).containsExactly(
                new KvMount(ROOT, "secret/", KvVersion.VERSIONED),
                new KvMount(ROOT, "kv1/", KvVersion.UNVERSIONED),
                new KvMount(ROOT, "old/", KvVersion.UNVERSIONED));
    }

    @Test
    @DisplayName("should walk unrecognized versions with the configured fallback layout")
    void shouldApplyFallbackLayout() {
        // Given
        when(mountTable.listMounts(any(), eq(ROOT))).thenReturn(List.of(kv("future/", "3")));

        // When
        List<KvMount> unversioned = new MountEnumerator(mountTable).findKvMounts(context, ROOT);
        List<KvMount> versioned = new MountEnumerator(mountTable, Set.of("kv"), KvVersion.VERSIONED)
                .findKvMounts(context, ROOT);

        // Then
        assertThat(unversioned).extracting(KvMount::getVersion).containsExactly(KvVersion.UNVERSIONED);
        assertThat(versioned).extracting(KvMount::getVersion).containsExactly(KvVersion.VERSIONED);
    }

    @Test
    @DisplayName("should match engine types case-insensitively")
    void shouldMatchEngineTypesIgnoringCase() {
        // Given
        when(mountTable.listMounts(any(), eq(ROOT))).thenReturn(List.of(
                MountEntry.builder().path("upper/").type("KV").build()));

        // When
        List<KvMount> mounts = new MountEnumerator(mountTable, Set.of("Kv"), KvVersion.UNVERSIONED)
                .findKvMounts(context, ROOT);

        // Then
        assertThat(mounts).extracting(KvMount::getMountPoint).containsExactly("upper/");
    }

    @Test
    @DisplayName("should skip a namespace whose mount table cannot be read")
    void shouldSkipUnreadableNamespace() {
        // Given
        when(mountTable.listMounts(any(), eq(ROOT))).thenThrow(new MountTableException(ROOT, "permission denied"));
        when(mountTable.listMounts(any(), eq(TEAM_A))).thenReturn(List.of(kv("kv/", "1")));

        // When
        List<KvMount> mounts = new MountEnumerator(mountTable).findKvMounts(context, List.of(ROOT, TEAM_A));

        // Then
        assertThat(mounts).containsExactly(new KvMount(TEAM_A, "kv/", KvVersion.UNVERSIONED));
    }

    private static MountEntry kv(String path, String version) {
        MountEntry.MountEntryBuilder builder = MountEntry.builder().path(path).type("kv");
        if (version != null) {
            builder.option(MountEntry.VERSION_OPTION, version);
        }
        return builder.build();
    }
}
