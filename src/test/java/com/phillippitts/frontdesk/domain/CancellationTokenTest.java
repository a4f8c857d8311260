package com.phillippitts.frontdesk.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void cancelIsOneWayAndIdempotent() {
        CancellationToken token = new CancellationToken(3);

        assertThat(token.isCancelled()).isFalse();
        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThat(token.isCancelled()).isTrue();
        assertThat(token.turnId()).isEqualTo(3);
    }

    @Test
    void callbacksRunOnceInRegistrationOrder() {
        CancellationToken token = new CancellationToken(1);
        List<String> calls = new ArrayList<>();
        token.onCancel(() -> calls.add("first"));
        token.onCancel(() -> calls.add("second"));

        token.cancel();
        token.cancel();

        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    void lateRegistrationRunsImmediately() {
        CancellationToken token = new CancellationToken(1);
        token.cancel();
        AtomicInteger runs = new AtomicInteger();

        token.onCancel(runs::incrementAndGet);

        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationToken token = new CancellationToken(1);
        AtomicInteger runs = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("callback failure");
        });
        token.onCancel(runs::incrementAndGet);

        assertThat(token.cancel()).isTrue();
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void onlyTheFirstFailureIsReported() {
        CancellationToken token = new CancellationToken(2);

        assertThat(token.hasFailed()).isFalse();
        assertThat(token.markFailed()).isTrue();
        assertThat(token.markFailed()).isFalse();
        assertThat(token.hasFailed()).isTrue();
        assertThat(token.isCancelled()).isFalse();
    }

    @Test
    void staleTokenIsBornCancelledAndRunsCallbacksAtOnce() {
        CancellationToken stale = CancellationToken.cancelled(9);
        List<String> ran = new ArrayList<>();

        stale.onCancel(() -> ran.add("stop"));

        assertThat(stale.isCancelled()).isTrue();
        assertThat(stale.turnId()).isEqualTo(9);
        assertThat(stale.cancel()).isFalse();
        assertThat(ran).containsExactly("stop");
    }
}
