package com.budgetme.reports.events;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InProcessTransactionChangeChannelTest {

    private final InProcessTransactionChangeChannel channel = new InProcessTransactionChangeChannel();

    @Test
    void deliversOnlyToSubscribersOfThatUser() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        List<TransactionsChangedEvent> received = new ArrayList<>();
        channel.subscribe(alice, received::add);

        channel.publish(event(bob));
        channel.publish(event(alice));

        assertThat(received).singleElement().satisfies(e -> assertThat(e.userId()).isEqualTo(alice));
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        UUID userId = UUID.randomUUID();
        List<TransactionsChangedEvent> received = new ArrayList<>();
        channel.subscribe(userId, e -> {
            throw new IllegalStateException("boom");
        });
        channel.subscribe(userId, received::add);

        channel.publish(event(userId));

        assertThat(received).hasSize(1);
    }

    @Test
    void unsubscribeStopsDelivery() {
        UUID userId = UUID.randomUUID();
        List<TransactionsChangedEvent> received = new ArrayList<>();
        Subscription subscription = channel.subscribe(userId, received::add);

        subscription.unsubscribe();
        channel.publish(event(userId));

        assertThat(received).isEmpty();
        assertThat(channel.listenerCount(userId)).isZero();
    }

    @Test
    void subscribeRacingWithLastUnsubscribeStillDelivers() {
        int rounds = 2_000;
        AtomicInteger delivered = new AtomicInteger();
        for (int i = 0; i < rounds; i++) {
            UUID userId = UUID.randomUUID();
            Subscription leaving = channel.subscribe(userId, e -> { });
            CompletableFuture<Void> unsubscribe = CompletableFuture.runAsync(leaving::unsubscribe);
            Subscription staying = channel.subscribe(userId, e -> delivered.incrementAndGet());
            unsubscribe.join();

            channel.publish(event(userId));
            staying.unsubscribe();
        }

        assertThat(delivered).hasValue(rounds);
    }

    private TransactionsChangedEvent event(UUID userId) {
        return new TransactionsChangedEvent(userId, TransactionsChangedEvent.ChangeType.UPSERT, Instant.parse("2025-06-01T00:00:00Z"));
    }
}
