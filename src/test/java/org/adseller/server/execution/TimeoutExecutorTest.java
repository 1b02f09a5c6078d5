package org.adseller.server.execution;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class TimeoutExecutorTest {

    @Mock
    private Vertx vertx;

    @Mock
    private Clock clock;

    private Timeout timeout;

    private TimeoutExecutor target;

    @BeforeEach
    public void setUp() {
        timeout = new TimeoutFactory(Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC))
                .create(500L);
        target = new TimeoutExecutor(vertx);
    }

    @Test
    public void executeShouldBoundCallByRemainingBudget() {
        // given
        given(vertx.setTimer(anyLong(), any())).willReturn(1L);

        // when
        target.execute(() -> Future.succeededFuture("done"), 2_000L, timeout);

        // then
        verify(vertx).setTimer(eq(500L), any());
    }

    @Test
    public void executeShouldReturnActionResultAndCancelTimer() {
        // given
        given(vertx.setTimer(anyLong(), any())).willReturn(7L);

        // when
        final Future<String> result = target.execute(() -> Future.succeededFuture("done"), 300L, timeout);

        // then
        assertThat(result.result()).isEqualTo("done");
        verify(vertx).setTimer(eq(300L), any());
        verify(vertx).cancelTimer(7L);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void executeShouldFailWhenTimerFiresFirst() {
        // given
        given(vertx.setTimer(anyLong(), any())).willReturn(1L);
        final Promise<String> pending = Promise.promise();

        // when
        final Future<String> result = target.execute(pending::future, 300L, timeout);

        // then
        final ArgumentCaptor<Handler<Long>> timerCaptor = ArgumentCaptor.forClass(Handler.class);
        verify(vertx).setTimer(eq(300L), timerCaptor.capture());
        timerCaptor.getValue().handle(1L);

        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(TimeoutException.class)
                .hasMessage("Timed out while executing action");

        pending.complete("late");
        assertThat(result.failed()).isTrue();
    }

    @Test
    public void executeShouldConvertThrownExceptionToFailedFuture() {
        // given
        given(vertx.setTimer(anyLong(), any())).willReturn(1L);

        // when
        final Future<String> result = target.execute(() -> {
            throw new IllegalStateException("broken");
        }, 300L, timeout);

        // then
        assertThat(result.cause()).isInstanceOf(IllegalStateException.class).hasMessage("broken");
    }

    @Test
    public void executeShouldFailImmediatelyWhenBudgetIsExhausted() {
        // given
        given(clock.millis()).willReturn(1_000L, 2_000L);
        final Timeout expired = new TimeoutFactory(clock).create(100L);

        // when
        final Future<String> result = target.execute(() -> Future.succeededFuture("done"), 300L, expired);

        // then
        assertThat(result.cause()).isInstanceOf(TimeoutException.class).hasMessage("Timeout has been exceeded");
        verifyNoInteractions(vertx);
    }
}
