package com.budgetme.reports.analytics;

import com.budgetme.reports.config.BudgetmeProperties;
import com.budgetme.reports.model.Anomaly;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TransactionKind;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stateless anomaly scan over a transaction snapshot: five independent passes, ranked by severity.
 */
@Component
public class AnomalyDetectionService {

    private static final double SPIKE_SIGMA = 2.0d;
    private static final double HIGH_SPIKE_SIGMA = 3.0d;
    private static final double FREQUENCY_MULTIPLIER = 3.0d;
    private static final double ESCALATED_UNCATEGORIZED_RATIO = 0.30d;
    private static final int MAX_DATA_ERRORS = 10;

    private final Clock clock;
    private final double uncategorizedThreshold;
    private final int minimumTransactions;

    @Autowired
    public AnomalyDetectionService(Clock clock, BudgetmeProperties properties) {
        this(clock,
                properties.analysis().uncategorizedThreshold(),
                properties.analysis().anomalyMinimumTransactions());
    }

    AnomalyDetectionService(Clock clock, double uncategorizedThreshold, int minimumTransactions) {
        this.clock = clock;
        this.uncategorizedThreshold = uncategorizedThreshold;
        this.minimumTransactions = minimumTransactions;
    }

    public List<Anomaly> detectAnomalies(List<Transaction> transactions) {
        if (transactions.size() < minimumTransactions) {
            return List.of();
        }
        List<Anomaly> anomalies = new ArrayList<>();
        anomalies.addAll(detectSpikes(transactions));
        anomalies.addAll(detectDuplicates(transactions));
        anomalies.addAll(detectUncategorizedPattern(transactions));
        anomalies.addAll(detectFrequencyOutliers(transactions));
        anomalies.addAll(detectDataErrors(transactions));
        anomalies.sort(Comparator.comparing(Anomaly::severity));
        return List.copyOf(anomalies);
    }

    List<Anomaly> detectSpikes(List<Transaction> transactions) {
        List<Transaction> expenses = transactions.stream()
                .filter(tx -> tx.kind() == TransactionKind.EXPENSE)
                .toList();
        if (expenses.isEmpty()) {
            return List.of();
        }
        double mean = expenses.stream().mapToDouble(tx -> tx.amount().doubleValue()).average().orElse(0d);
        double variance = expenses.stream()
                .mapToDouble(tx -> Math.pow(tx.amount().doubleValue() - mean, 2))
                .average()
                .orElse(0d);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0d) {
            return List.of();
        }
        double threshold = mean + SPIKE_SIGMA * stdDev;
        double highThreshold = mean + HIGH_SPIKE_SIGMA * stdDev;
        BigDecimal typical = BigDecimal.valueOf(mean).setScale(2, RoundingMode.HALF_UP);

        List<Anomaly> spikes = new ArrayList<>();
        for (Transaction tx : expenses) {
            double amount = tx.amount().doubleValue();
            if (amount <= threshold) {
                continue;
            }
            Anomaly.Severity severity = amount > highThreshold ? Anomaly.Severity.HIGH : Anomaly.Severity.MEDIUM;
            spikes.add(new Anomaly(
                    nextId(Anomaly.Kind.STATISTICAL_SPIKE, spikes.size()),
                    Anomaly.Kind.STATISTICAL_SPIKE,
                    severity,
                    Set.of(tx.id()),
                    "Unusual High Spending Detected",
                    "Transaction of " + plain(tx.amount()) + " on " + tx.date()
                            + " is significantly higher than your average spending of " + plain(typical) + ".",
                    Optional.of("Review this transaction to ensure it's accurate and expected.")));
        }
        return spikes;
    }

    List<Anomaly> detectDuplicates(List<Transaction> transactions) {
        Map<String, List<Transaction>> groups = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (!tx.kind().categorizable()) {
                continue;
            }
            groups.computeIfAbsent(duplicateKey(tx), key -> new ArrayList<>()).add(tx);
        }
        List<Anomaly> duplicates = new ArrayList<>();
        for (List<Transaction> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            Transaction first = group.get(0);
            String label = first.description().filter(text -> !text.isBlank()).orElse("Transaction");
            duplicates.add(new Anomaly(
                    nextId(Anomaly.Kind.DUPLICATE, duplicates.size()),
                    Anomaly.Kind.DUPLICATE,
                    Anomaly.Severity.MEDIUM,
                    ids(group),
                    "Possible Duplicate Transactions",
                    "Found " + group.size() + " transactions for " + label + " with the same amount ("
                            + plain(first.amount()) + ") on " + first.date() + ".",
                    Optional.of("Check if these are legitimate separate transactions or duplicates.")));
        }
        return duplicates;
    }

    List<Anomaly> detectUncategorizedPattern(List<Transaction> transactions) {
        List<Transaction> categorizable = transactions.stream()
                .filter(tx -> tx.kind().categorizable())
                .toList();
        if (categorizable.isEmpty()) {
            return List.of();
        }
        List<Transaction> uncategorized = categorizable.stream()
                .filter(Transaction::isUncategorized)
                .toList();
        double ratio = (double) uncategorized.size() / categorizable.size();
        if (uncategorized.isEmpty() || ratio <= uncategorizedThreshold) {
            return List.of();
        }
        Anomaly.Severity severity = ratio > ESCALATED_UNCATEGORIZED_RATIO ? Anomaly.Severity.MEDIUM : Anomaly.Severity.LOW;
        long percent = Math.round(ratio * 100);
        return List.of(new Anomaly(
                nextId(Anomaly.Kind.UNCATEGORIZED_PATTERN, 0),
                Anomaly.Kind.UNCATEGORIZED_PATTERN,
                severity,
                ids(uncategorized),
                "High Number of Uncategorized Transactions",
                uncategorized.size() + " transactions (" + percent + "%) are uncategorized, making it harder to track spending patterns.",
                Optional.of("Categorize your transactions for better financial insights.")));
    }

    List<Anomaly> detectFrequencyOutliers(List<Transaction> transactions) {
        Map<LocalDate, List<Transaction>> byDay = transactions.stream()
                .collect(Collectors.groupingBy(Transaction::date, LinkedHashMap::new, Collectors.toList()));
        if (byDay.isEmpty()) {
            return List.of();
        }
        double averagePerDay = (double) transactions.size() / byDay.size();
        List<Anomaly> outliers = new ArrayList<>();
        for (Map.Entry<LocalDate, List<Transaction>> day : byDay.entrySet()) {
            List<Transaction> group = day.getValue();
            if (group.size() <= averagePerDay * FREQUENCY_MULTIPLIER) {
                continue;
            }
            outliers.add(new Anomaly(
                    nextId(Anomaly.Kind.FREQUENCY_OUTLIER, outliers.size()),
                    Anomaly.Kind.FREQUENCY_OUTLIER,
                    Anomaly.Severity.LOW,
                    ids(group),
                    "Unusually High Transaction Activity",
                    group.size() + " transactions recorded on " + day.getKey()
                            + ", which is significantly higher than your average of "
                            + String.format(Locale.ROOT, "%.1f", averagePerDay) + " per day.",
                    Optional.of("Review these transactions to ensure they're all legitimate.")));
        }
        return outliers;
    }

    List<Anomaly> detectDataErrors(List<Transaction> transactions) {
        LocalDate latestAllowed = LocalDate.now(clock).plusDays(1);
        List<DataErrorFinding> findings = new ArrayList<>();
        for (Transaction tx : transactions) {
            String label = tx.description().filter(text -> !text.isBlank()).orElse("transaction");
            if (tx.amount().signum() < 0) {
                findings.add(new DataErrorFinding(DataErrorFinding.Check.NEGATIVE_AMOUNT, tx,
                        "Negative amount detected: " + plain(tx.amount()) + " for " + label));
            }
            if (tx.date().isAfter(latestAllowed)) {
                findings.add(new DataErrorFinding(DataErrorFinding.Check.FUTURE_DATE, tx,
                        "Future date detected: " + tx.date() + " for " + label));
            }
            if (tx.accountId().isEmpty()) {
                findings.add(new DataErrorFinding(DataErrorFinding.Check.MISSING_ACCOUNT, tx,
                        "Missing account information for transaction " + shortId(tx.id())));
            }
        }
        findings.sort(Comparator.comparing(DataErrorFinding::check));

        List<Anomaly> errors = new ArrayList<>();
        for (DataErrorFinding finding : findings.subList(0, Math.min(MAX_DATA_ERRORS, findings.size()))) {
            errors.add(new Anomaly(
                    nextId(Anomaly.Kind.DATA_ERROR, errors.size()),
                    Anomaly.Kind.DATA_ERROR,
                    Anomaly.Severity.ERROR,
                    Set.of(finding.transaction().id()),
                    finding.check().title(),
                    finding.message(),
                    Optional.of(finding.check().suggestion())));
        }
        return errors;
    }

    static String duplicateKey(Transaction tx) {
        String description = tx.description()
                .map(text -> text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT))
                .orElse("");
        return tx.amount().stripTrailingZeros().toPlainString() + "|" + tx.date() + "|" + description;
    }

    private static Set<UUID> ids(List<Transaction> transactions) {
        return transactions.stream().map(Transaction::id).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String nextId(Anomaly.Kind kind, int index) {
        return kind.idPrefix() + "-" + index;
    }

    private static String plain(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String shortId(UUID id) {
        return id.toString().substring(0, 8) + "...";
    }

    private record DataErrorFinding(Check check, Transaction transaction, String message) {

        enum Check {
            NEGATIVE_AMOUNT("Negative Amount", "Correct the amount; expenses are recorded as positive values."),
            FUTURE_DATE("Future-Dated Transaction", "Check the transaction date."),
            MISSING_ACCOUNT("Missing Account", "Assign this transaction to an account.");

            private final String title;
            private final String suggestion;

            Check(String title, String suggestion) {
                this.title = title;
                this.suggestion = suggestion;
            }

            String title() {
                return title;
            }

            String suggestion() {
                return suggestion;
            }
        }
    }
}
