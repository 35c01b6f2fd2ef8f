package com.budgetme.reports.repository;

import com.budgetme.reports.model.DateRange;
import com.budgetme.reports.model.Transaction;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TransactionStore {

    /**
     * Transactions of the user within the range, newest first.
     */
    List<Transaction> fetchTransactions(UUID userId, DateRange range);

    Transaction save(Transaction transaction);

    Optional<Transaction> findById(UUID transactionId);

    boolean delete(UUID transactionId);

    void deleteByUserId(UUID userId);
}
