package com.libragraph.keeper.core.context;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LifetimeTest {

    @Test
    void cancellingParentCancelsChildren() {
        Lifetime parent = Lifetime.create();
        Lifetime child = parent.child();
        Lifetime grandchild = child.child();

        parent.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(grandchild.isCancelled()).isTrue();
    }

    @Test
    void cancellingChildLeavesParentRunning() {
        Lifetime parent = Lifetime.create();
        Lifetime child = parent.child();

        child.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void cancelledChildrenReleaseTheirParentRegistration() {
        Lifetime parent = Lifetime.create();
        for (int i = 0; i < 1000; i++) {
            parent.child().cancel();
        }

        assertThat(parent.pendingCallbacks()).isZero();

        Lifetime live = parent.child();
        parent.cancel();
        assertThat(live.isCancelled()).isTrue();
    }

    @Test
    void cancelIsIdempotent() {
        Lifetime lifetime = Lifetime.create();

        assertThat(lifetime.cancel()).isTrue();
        assertThat(lifetime.cancel()).isFalse();
    }

    @Test
    void callbacksRunOnceEvenWhenOneFails() {
        Lifetime lifetime = Lifetime.create();
        List<String> calls = new ArrayList<>();
        lifetime.onCancel(() -> calls.add("first"));
        lifetime.onCancel(() -> {
            throw new IllegalStateException("broken callback");
        });
        lifetime.onCancel(() -> calls.add("third"));

        lifetime.cancel();
        lifetime.cancel();

        assertThat(calls).containsExactly("first", "third");
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        Lifetime lifetime = Lifetime.create();
        lifetime.cancel();
        List<String> calls = new ArrayList<>();

        lifetime.onCancel(() -> calls.add("late"));

        assertThat(calls).containsExactly("late");
    }

    @Test
    void awaitWithTimeoutReportsCancellation() throws Exception {
        Lifetime lifetime = Lifetime.create();
        assertThat(lifetime.await(Duration.ofMillis(10))).isFalse();

        lifetime.cancel();
        assertThat(lifetime.await(Duration.ofHours(1))).isTrue();
    }

    @Test
    void throwIfCancelled() {
        Lifetime lifetime = Lifetime.create();
        lifetime.throwIfCancelled();

        lifetime.cancel();
        assertThatThrownBy(lifetime::throwIfCancelled)
                .isInstanceOf(CancellationException.class)
                .hasMessage("context canceled");
    }
}
