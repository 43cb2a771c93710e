package com.z254.strongbox.metrics.domain;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CollectionContext Tests")
class CollectionContextTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("should report the time left before the deadline")
    void shouldReportRemaining() {
        CollectionContext context = CollectionContext.withTimeout(Duration.ofSeconds(30), FIXED);

        assertThat(context.isDone()).isFalse();
        assertThat(context.remaining()).isEqualTo(Duration.ofSeconds(30));
        assertThat(context.getDeadline()).isEqualTo(Instant.parse("2024-05-01T10:00:30Z"));
        assertThatCode(context::ensureActive).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should be done once the deadline has passed")
    void shouldExpireAtDeadline() {
        CollectionContext context = CollectionContext.withTimeout(Duration.ZERO, FIXED);

        assertThat(context.isDone()).isTrue();
        assertThat(context.remaining()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(context::ensureActive)
                .isInstanceOf(CollectionCancelledException.class)
                .hasMessageContaining("deadline");
    }

    @Test
    @DisplayName("should be done once cancelled")
    void shouldStopWhenCancelled() {
        CollectionContext context = CollectionContext.unbounded();

        context.cancel();

        assertThat(context.isDone()).isTrue();
        assertThat(context.remaining()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(context::ensureActive).isInstanceOf(CollectionCancelledException.class);
    }

    @Test
    @DisplayName("should refuse work on an interrupted thread")
    void shouldRefuseWorkWhenInterrupted() {
        CollectionContext context = CollectionContext.unbounded();

        Thread.currentThread().interrupt();

        assertThatThrownBy(context::ensureActive)
                .isInstanceOf(CollectionCancelledException.class)
                .hasMessageContaining("interrupted");
    }

    @Test
    @DisplayName("should never expire when unbounded")
    void shouldNeverExpireWhenUnbounded() {
        CollectionContext context = CollectionContext.unbounded();

        assertThat(context.isDone()).isFalse();
        assertThat(context.remaining().toMillis()).isEqualTo(Long.MAX_VALUE);
    }
}
