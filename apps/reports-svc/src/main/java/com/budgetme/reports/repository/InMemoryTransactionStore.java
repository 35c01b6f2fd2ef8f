package com.budgetme.reports.repository;

import com.budgetme.reports.events.TransactionChangeChannel;
import com.budgetme.reports.events.TransactionsChangedEvent;
import com.budgetme.reports.model.DateRange;
import com.budgetme.reports.model.Transaction;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTransactionStore implements TransactionStore {

    private final Map<UUID, Transaction> storage = new ConcurrentHashMap<>();
    private final TransactionChangeChannel changeChannel;
    private final Clock clock;

    public InMemoryTransactionStore(TransactionChangeChannel changeChannel, Clock clock) {
        this.changeChannel = changeChannel;
        this.clock = clock;
    }

    @Override
    public List<Transaction> fetchTransactions(UUID userId, DateRange range) {
        return storage.values().stream()
                .filter(tx -> userId.equals(tx.userId()))
                .filter(tx -> range.contains(tx.date()))
                .sorted(Comparator.comparing(Transaction::date).reversed().thenComparing(Transaction::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Transaction save(Transaction transaction) {
        if (transaction.userId() == null) {
            throw new IllegalArgumentException("userId must be provided");
        }
        storage.put(transaction.id(), transaction);
        notifyChange(transaction.userId(), TransactionsChangedEvent.ChangeType.UPSERT);
        return transaction;
    }

    @Override
    public Optional<Transaction> findById(UUID transactionId) {
        return Optional.ofNullable(storage.get(transactionId));
    }

    @Override
    public boolean delete(UUID transactionId) {
        Transaction removed = storage.remove(transactionId);
        if (removed == null) {
            return false;
        }
        notifyChange(removed.userId(), TransactionsChangedEvent.ChangeType.DELETE);
        return true;
    }

    @Override
    public void deleteByUserId(UUID userId) {
        boolean removed = storage.entrySet().removeIf(entry -> userId.equals(entry.getValue().userId()));
        if (removed) {
            notifyChange(userId, TransactionsChangedEvent.ChangeType.RESET);
        }
    }

    private void notifyChange(UUID userId, TransactionsChangedEvent.ChangeType type) {
        changeChannel.publish(new TransactionsChangedEvent(userId, type, clock.instant()));
    }
}
