package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.core.context.Lifetime;
import com.libragraph.keeper.core.error.GraceExhaustedException;
import com.libragraph.keeper.core.error.PanicException;
import com.libragraph.keeper.core.error.ServiceFailureException;
import com.libragraph.keeper.core.service.FatalServiceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class SupervisionLoopTest {

    private final Lifetime lifetime = Lifetime.create();
    private final MutableClock clock = new MutableClock();
    private final List<SupervisionStateChangedEvent> events = new CopyOnWriteArrayList<>();

    private SupervisionLoop loop(ScriptedService service, SupervisorOptions options, SupervisionListener... extra) {
        List<SupervisionListener> listeners = new ArrayList<>();
        listeners.add(events::add);
        listeners.addAll(Arrays.asList(extra));
        return new SupervisionLoop(service, TestContexts.contextFor(service, lifetime), options, listeners,
                new AttemptRunner(), clock);
    }

    @Test
    void graceCountAllowsOneAttemptPlusRestarts() {
        var cause = new IOException("down");
        var service = ScriptedService.failing("flaky", cause);

        SupervisionReport report = loop(service, TestContexts.fastOptions().graceCount(3).build()).run();

        assertThat(service.runs).hasValue(4);
        assertThat(report.state()).isEqualTo(SupervisionState.TERMINATED_FAILURE);
        assertThat(report.attempts()).isEqualTo(4);
        assertThat(report.error()).isInstanceOf(GraceExhaustedException.class)
                .hasMessageContaining("exceeded grace count");
        var exhausted = (GraceExhaustedException) report.error();
        assertThat(exhausted.dimension()).isEqualTo(GraceExhaustedException.Dimension.COUNT);
        assertThat(exhausted.restarts()).isEqualTo(4);
        assertThat(exhausted.getCause()).isInstanceOf(ServiceFailureException.class).hasCause(cause);
    }

    @Test
    void gracePeriodStopsRestartsOnceExceeded() {
        var service = new ScriptedService("slow", "test", ctx -> {
            clock.advance(Duration.ofSeconds(40));
            throw new IOException("timeout");
        });
        var options = TestContexts.fastOptions().graceCount(0).gracePeriod(Duration.ofMinutes(1)).build();

        SupervisionReport report = loop(service, options).run();

        assertThat(service.runs).hasValue(2);
        var exhausted = (GraceExhaustedException) report.error();
        assertThat(exhausted.dimension()).isEqualTo(GraceExhaustedException.Dimension.PERIOD);
        assertThat(exhausted.elapsed()).isEqualTo(Duration.ofSeconds(80));
        assertThat(exhausted).hasMessageContaining("exceeded grace period");
    }

    @Test
    void recoversAfterTransientFailures() {
        var service = new ScriptedService("transient", "test",
                ctx -> {
                    throw new IOException("first");
                },
                ctx -> {
                    throw new IOException("second");
                },
                ctx -> { });

        SupervisionReport report = loop(service, TestContexts.fastOptions().build()).run();

        assertThat(report.succeeded()).isTrue();
        assertThat(report.attempts()).isEqualTo(3);
        assertThat(report.restarts()).isEqualTo(2);
        assertThat(service.closes).hasValue(3);
    }

    @Test
    void restartOnErrorDisabledReturnsTheAttemptError() {
        var cause = new IOException("disk full");
        var service = ScriptedService.failing("once", cause);

        SupervisionReport report = loop(service, TestContexts.fastOptions().restartOnError(false).build()).run();

        assertThat(service.runs).hasValue(1);
        assertThat(report.error()).isInstanceOf(ServiceFailureException.class);
        assertThat(report.error().getCause()).isSameAs(cause);
        assertThat(report.restarts()).isZero();
    }

    @Test
    void fatalErrorIsNeverRestarted() {
        var service = ScriptedService.failing("fatal", new FatalServiceException("invalid credentials"));

        SupervisionReport report = loop(service, TestContexts.fastOptions().graceCount(10).build()).run();

        assertThat(service.runs).hasValue(1);
        assertThat(((ServiceFailureException) report.error()).isFatal()).isTrue();
    }

    @Test
    void panicWithRestartDisabledStopsWithPanicError() {
        var service = new ScriptedService("panicky", "test", ctx -> {
            throw new IllegalStateException("boom");
        });

        SupervisionReport report = loop(service, TestContexts.fastOptions().restartOnPanic(false).build()).run();

        assertThat(service.runs).hasValue(1);
        assertThat(service.closes).hasValue(1);
        assertThat(report.error()).isInstanceOf(PanicException.class);
        assertThat(report.error().getMessage()).contains("boom");
    }

    @Test
    void panicsConsumeTheGraceBudget() {
        var service = new ScriptedService("panicky", "test", ctx -> {
            throw new IllegalStateException("boom");
        });

        SupervisionReport report = loop(service, TestContexts.fastOptions().graceCount(1).build()).run();

        assertThat(service.runs).hasValue(2);
        assertThat(report.error()).isInstanceOf(GraceExhaustedException.class)
                .hasCauseInstanceOf(PanicException.class);
    }

    @Test
    void unrecoveredPanicEscapesTheLoop() {
        var boom = new IllegalStateException("boom");
        var service = new ScriptedService("panicky", "test", ctx -> {
            throw boom;
        });
        SupervisionLoop loop = loop(service, TestContexts.fastOptions().recoverPanic(false).build());

        assertThatThrownBy(loop::run).isSameAs(boom);
        assertThat(loop.state()).isEqualTo(SupervisionState.TERMINATED_FAILURE);
        assertThat(service.closes).hasValue(1);
    }

    @Test
    void cancellationIsNotAFailure() throws Exception {
        var started = new CountDownLatch(1);
        var service = new ScriptedService("blocking", "test", ctx -> {
            started.countDown();
            ctx.awaitCancellation();
        });
        SupervisionLoop loop = loop(service, TestContexts.fastOptions().build());

        CompletableFuture<SupervisionReport> result = CompletableFuture.supplyAsync(loop::run);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        lifetime.cancel();

        SupervisionReport report = result.get(5, TimeUnit.SECONDS);
        assertThat(report.succeeded()).isTrue();
        assertThat(report.error()).isNull();
        assertThat(service.closes).hasValue(1);
    }

    @Test
    void cancellationDuringRestartDelayEndsCleanly() {
        var service = ScriptedService.failing("delayed", new IOException("down"));
        var options = TestContexts.fastOptions().restartOnErrorDelay(Duration.ofHours(1)).build();
        SupervisionListener cancelOnDelay = event -> {
            if (event.newState() == SupervisionState.DELAYING) {
                lifetime.cancel();
            }
        };

        SupervisionReport report = loop(service, options, cancelOnDelay).run();

        assertThat(report.state()).isEqualTo(SupervisionState.TERMINATED_SUCCESS);
        assertThat(service.runs).hasValue(1);
    }

    @Test
    void statesFollowTheLifecycle() {
        var service = new ScriptedService("ok", "test", ctx -> { });

        loop(service, TestContexts.fastOptions().build()).run();

        assertThat(events).extracting(SupervisionStateChangedEvent::newState).containsExactly(
                SupervisionState.INIT,
                SupervisionState.RUNNING,
                SupervisionState.CLOSING,
                SupervisionState.TERMINATED_SUCCESS);
        assertThat(events.get(0).oldState()).isEqualTo(SupervisionState.NEW);
    }

    @Test
    void failingListenerDoesNotStopSupervision() {
        var service = new ScriptedService("ok", "test", ctx -> { });
        SupervisionListener broken = event -> {
            throw new IllegalStateException("listener bug");
        };

        SupervisionReport report = loop(service, TestContexts.fastOptions().build(), broken).run();

        assertThat(report.succeeded()).isTrue();
    }

    @Test
    void loopIsSingleUse() {
        SupervisionLoop loop = loop(new ScriptedService("ok", "test", ctx -> { }), TestContexts.fastOptions().build());
        loop.run();

        assertThatThrownBy(loop::run)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already started");
    }
}
