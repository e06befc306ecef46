package com.fintech.trades.subscription;

import com.fintech.trades.domain.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubscriptionManager Tests")
class SubscriptionManagerTest {

    private final SubscriptionManager manager = new SubscriptionManager();

    @Test
    @DisplayName("Only the first subscriber reaches upstream")
    void firstSubscriber() {
        assertThat(manager.shouldSubscribeDownstream(Symbol.BTC_USD)).isTrue();
        assertThat(manager.shouldSubscribeDownstream(Symbol.BTC_USD)).isFalse();
        assertThat(manager.shouldSubscribeDownstream(Symbol.ETH_USD)).isTrue();

        assertThat(manager.referenceCount(Symbol.BTC_USD)).isEqualTo(2);
        assertThat(manager.activeSymbols()).containsExactlyInAnyOrder(Symbol.BTC_USD, Symbol.ETH_USD);
    }

    @Test
    @DisplayName("Only the last unsubscriber reaches upstream")
    void lastUnsubscriber() {
        manager.shouldSubscribeDownstream(Symbol.BTC_USD);
        manager.shouldSubscribeDownstream(Symbol.BTC_USD);

        assertThat(manager.shouldUnsubscribeDownstream(Symbol.BTC_USD)).isFalse();
        assertThat(manager.shouldUnsubscribeDownstream(Symbol.BTC_USD)).isTrue();
        assertThat(manager.referenceCount(Symbol.BTC_USD)).isZero();
        assertThat(manager.activeSymbols()).isEmpty();
    }

    @Test
    @DisplayName("Unsubscribing with no consumers is a no-op")
    void unsubscribeAtZero() {
        assertThat(manager.shouldUnsubscribeDownstream(Symbol.SOL_USD)).isFalse();
        assertThat(manager.referenceCount(Symbol.SOL_USD)).isZero();

        assertThat(manager.shouldSubscribeDownstream(Symbol.SOL_USD)).as("count did not go negative").isTrue();
    }

    @Test
    @DisplayName("Snapshot of counts is detached from later changes")
    void countsSnapshot() {
        assertThat(manager.referenceCounts()).isEmpty();

        manager.shouldSubscribeDownstream(Symbol.ADA_USD);
        var snapshot = manager.referenceCounts();
        manager.shouldSubscribeDownstream(Symbol.ADA_USD);

        assertThat(snapshot).containsExactly(java.util.Map.entry(Symbol.ADA_USD, 1));
    }

    @Test
    @DisplayName("Concurrent subscribe/unsubscribe pairs see exactly one of each transition per cycle")
    void concurrentTransitions() throws InterruptedException {
        int threads = 8;
        int perThread = 1_000;
        AtomicInteger subscribes = new AtomicInteger();
        AtomicInteger unsubscribes = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    startGate.await();
                    for (int n = 0; n < perThread; n++) {
                        if (manager.shouldSubscribeDownstream(Symbol.BTC_USD)) {
                            subscribes.incrementAndGet();
                        }
                        if (manager.shouldUnsubscribeDownstream(Symbol.BTC_USD)) {
                            unsubscribes.incrementAndGet();
                        }
                    }
                    return null;
                });
            }
            startGate.countDown();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(manager.referenceCount(Symbol.BTC_USD)).isZero();
        assertThat(subscribes.get()).isEqualTo(unsubscribes.get()).isPositive();
    }
}
