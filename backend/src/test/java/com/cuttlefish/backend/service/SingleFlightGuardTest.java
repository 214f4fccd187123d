package com.cuttlefish.backend.service;

import com.cuttlefish.backend.exception.ReentrantCallException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SingleFlightGuardTest {

    private final SingleFlightGuard guard = new SingleFlightGuard();

    @Test
    void nestedCallOnSameThreadIsRejected() {
        assertThatThrownBy(() -> guard.run("outer", () -> guard.run("inner", () -> 1)))
                .isInstanceOf(ReentrantCallException.class);
        assertThat(guard.isHeldByCurrentThread()).isFalse();
    }

    @Test
    void callsFromOtherThreadsWaitTheirTurn() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger maxConcurrent = new AtomicInteger();
        AtomicInteger inside = new AtomicInteger();
        try {
            Future<Integer> first = executor.submit(() -> guard.run("first", () -> {
                maxConcurrent.accumulateAndGet(inside.incrementAndGet(), Math::max);
                entered.countDown();
                await(release);
                inside.decrementAndGet();
                return 1;
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();

            int second = guard.run("second", () -> {
                maxConcurrent.accumulateAndGet(inside.incrementAndGet(), Math::max);
                inside.decrementAndGet();
                return 2;
            });

            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            assertThat(second).isEqualTo(2);
            assertThat(maxConcurrent.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void requireHeldFailsOutsideGuardedCall() {
        assertThatThrownBy(() -> guard.requireHeld("evaluate")).isInstanceOf(IllegalStateException.class);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
