package com.budgetme.reports.ai;

import com.budgetme.reports.config.BudgetmeProperties;
import com.budgetme.reports.model.CategoryBucket;
import com.budgetme.reports.model.PeriodAggregate;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.model.SavingsPoint;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TransactionKind;
import com.budgetme.reports.model.TrendEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class InsightPromptBuilder {

    private static final int SPENDING_CONTEXT_BUCKETS = 5;

    private final ObjectMapper objectMapper;
    private final BudgetmeProperties.Currency currency;

    public InsightPromptBuilder(ObjectMapper objectMapper, BudgetmeProperties properties) {
        this.objectMapper = objectMapper;
        this.currency = properties.currency();
    }

    public String buildPrompt(ReportData reportData, List<Transaction> transactions) {
        ObjectNode context = buildContext(reportData, transactions);
        String contextJson;
        try {
            contextJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize insight context", ex);
        }
        ReportKind kind = reportData.kind();
        return "You are a financial advisor specializing in " + specialty(kind)
                + ". Analyze the user's data and provide 3-5 actionable insights.\n\n"
                + baseInstructions() + "\n\n"
                + focusAreas(kind) + "\n\n"
                + "Context:\n" + contextJson;
    }

    ObjectNode buildContext(ReportData reportData, List<Transaction> transactions) {
        BigDecimal totalIncome = sum(transactions, TransactionKind.INCOME);
        BigDecimal totalExpenses = sum(transactions, TransactionKind.EXPENSE);
        BigDecimal net = totalIncome.subtract(totalExpenses);
        long uncategorized = transactions.stream().filter(Transaction::isUncategorized).count();
        double categorizedPercentage = transactions.isEmpty()
                ? 0d
                : (transactions.size() - uncategorized) * 100d / transactions.size();

        ObjectNode context = objectMapper.createObjectNode();
        context.put("currency", currency.code());
        context.put("currencySymbol", currency.symbol());
        context.put("reportType", reportData.kind().code());
        context.put("totalTransactions", transactions.size());
        context.put("totalIncome", money(totalIncome));
        context.put("totalIncomeRaw", totalIncome);
        context.put("totalExpenses", money(totalExpenses));
        context.put("totalExpensesRaw", totalExpenses);
        context.put("netSavings", money(net));
        context.put("netSavingsRaw", net);
        context.put("savingsRate", totalIncome.signum() > 0
                ? net.multiply(BigDecimal.valueOf(100)).divide(totalIncome, 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO);
        context.put("uncategorizedCount", uncategorized);
        context.put("categorizedPercentage", Math.round(categorizedPercentage * 100d) / 100d);
        context.set("reportData", reportDataNode(reportData));
        return context;
    }

    private ArrayNode reportDataNode(ReportData reportData) {
        ArrayNode array = objectMapper.createArrayNode();
        if (reportData instanceof ReportData.SpendingReport spending) {
            for (CategoryBucket bucket : spending.buckets().stream().limit(SPENDING_CONTEXT_BUCKETS).toList()) {
                array.addObject()
                        .put("name", bucket.categoryName())
                        .put("value", bucket.totalAmount())
                        .put("formattedValue", money(bucket.totalAmount()));
            }
        } else if (reportData instanceof ReportData.IncomeExpenseReport incomeExpense) {
            incomeExpense.periods().forEach(period -> addPeriod(array, period));
        } else if (reportData instanceof ReportData.SavingsReport savings) {
            for (SavingsPoint point : savings.points()) {
                array.addObject()
                        .put("name", point.periodLabel())
                        .put("income", point.income())
                        .put("expenses", point.expenses())
                        .put("savings", point.savings())
                        .put("rate", point.rate())
                        .put("formattedSavings", money(point.savings()));
            }
        } else if (reportData instanceof ReportData.TrendReport trends) {
            for (TrendEntry trend : trends.trends()) {
                array.addObject()
                        .put("category", trend.category())
                        .put("previousAmount", trend.previousAmount())
                        .put("currentAmount", trend.currentAmount())
                        .put("change", trend.percentChange());
            }
        } else if (reportData instanceof ReportData.GoalContributionReport goals) {
            array.addObject()
                    .put("contributionCount", goals.contributionCount())
                    .put("contributionTotal", goals.contributionTotal())
                    .put("formattedContributionTotal", money(goals.contributionTotal()));
        } else if (reportData instanceof ReportData.PredictionReport predictions) {
            predictions.projections().forEach(period -> addPeriod(array, period));
        }
        return array;
    }

    private void addPeriod(ArrayNode array, PeriodAggregate period) {
        array.addObject()
                .put("name", period.periodLabel())
                .put("income", period.income())
                .put("expenses", period.expenses())
                .put("contributions", period.contributions());
    }

    private String baseInstructions() {
        String symbol = currency.symbol();
        return """
                IMPORTANT CURRENCY INSTRUCTIONS:
                - All monetary amounts MUST use the %1$s currency symbol
                - NEVER use USD, $, or any other currency symbol
                - Format amounts as: %1$sX,XXX.XX (e.g., %1$s15,000.00)
                - All amounts are in %2$s

                IMPORTANT TRANSACTION CATEGORIZATION RULES:
                - Goal contributions and transfers are NOT uncategorized; they don't need categories
                - Only count expense and income transactions without categories as "uncategorized"
                - If uncategorizedCount is 0, DO NOT mention uncategorized transactions at all

                OUTPUT FORMAT:
                Return ONLY a valid JSON array with this exact structure:
                [
                  {
                    "type": "success" | "warning" | "info" | "tip",
                    "title": "string (max 10 words)",
                    "description": "string (max 50 words, use %1$s for amounts)",
                    "actionable": boolean,
                    "actionText": "string (optional, if actionable is true)"
                  }
                ]""".formatted(symbol, currency.code());
    }

    private static String specialty(ReportKind kind) {
        return switch (kind) {
            case SPENDING -> "SPENDING ANALYSIS";
            case INCOME_EXPENSE -> "INCOME vs EXPENSE ANALYSIS";
            case SAVINGS -> "SAVINGS ANALYSIS";
            case TRENDS -> "FINANCIAL TREND ANALYSIS";
            case GOALS -> "FINANCIAL GOALS ANALYSIS";
            case PREDICTIONS -> "FINANCIAL FORECASTING";
        };
    }

    private static String focusAreas(ReportKind kind) {
        return switch (kind) {
            case SPENDING -> """
                    Focus on:
                    - Which categories consume the most budget
                    - Whether spending is concentrated in one category
                    - Specific categories where the user could save money
                    - Red flags and positive habits in spending patterns""";
            case INCOME_EXPENSE -> """
                    Focus on:
                    - Income vs expense balance over time
                    - Months with surplus or deficit
                    - Income stability and expense growth
                    - Recommendations for improving cash flow""";
            case SAVINGS -> """
                    Focus on:
                    - Current savings rate vs the recommended 20%
                    - Savings consistency month over month
                    - Whether savings are growing or shrinking
                    - Specific ways to increase savings""";
            case TRENDS -> """
                    Focus on:
                    - Categories with the biggest increases and decreases
                    - Whether the changes look temporary or lasting
                    - Categories requiring immediate attention
                    - Spending if the trends continue""";
            case GOALS -> """
                    Focus on:
                    - Goal contribution consistency
                    - Whether contributions are sufficient
                    - Strategies to accelerate goal completion""";
            case PREDICTIONS -> """
                    Focus on:
                    - Expected surplus or deficit in coming months
                    - Whether current spending is sustainable
                    - Proactive steps to improve the projected outcome""";
        };
    }

    private String money(BigDecimal value) {
        return MoneyFormat.amount(currency.symbol(), value);
    }

    private static BigDecimal sum(List<Transaction> transactions, TransactionKind kind) {
        return transactions.stream()
                .filter(tx -> tx.kind() == kind)
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
