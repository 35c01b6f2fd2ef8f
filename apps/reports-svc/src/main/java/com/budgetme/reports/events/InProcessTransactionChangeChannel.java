package com.budgetme.reports.events;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class InProcessTransactionChangeChannel implements TransactionChangeChannel {

    private static final Logger log = LoggerFactory.getLogger(InProcessTransactionChangeChannel.class);

    private final Map<UUID, List<Consumer<TransactionsChangedEvent>>> listeners = new ConcurrentHashMap<>();

    @Override
    public void publish(TransactionsChangedEvent event) {
        List<Consumer<TransactionsChangedEvent>> targets = listeners.getOrDefault(event.userId(), List.of());
        for (Consumer<TransactionsChangedEvent> listener : targets) {
            try {
                listener.accept(event);
            } catch (RuntimeException ex) {
                log.warn("Transaction change listener failed for user {}: {}", event.userId(), ex.getMessage(), ex);
            }
        }
    }

    @Override
    public Subscription subscribe(UUID userId, Consumer<TransactionsChangedEvent> listener) {
        listeners.compute(userId, (id, current) -> {
            List<Consumer<TransactionsChangedEvent>> target = current != null ? current : new CopyOnWriteArrayList<>();
            target.add(listener);
            return target;
        });
        return () -> listeners.computeIfPresent(userId, (id, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
    }

    public int listenerCount(UUID userId) {
        return listeners.getOrDefault(userId, List.of()).size();
    }
}
