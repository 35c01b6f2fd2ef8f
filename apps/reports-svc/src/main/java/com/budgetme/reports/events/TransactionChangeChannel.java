package com.budgetme.reports.events;

import java.util.UUID;
import java.util.function.Consumer;

public interface TransactionChangeChannel {

    void publish(TransactionsChangedEvent event);

    Subscription subscribe(UUID userId, Consumer<TransactionsChangedEvent> listener);
}
