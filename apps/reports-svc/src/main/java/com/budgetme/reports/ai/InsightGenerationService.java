package com.budgetme.reports.ai;

import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.Transaction;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class InsightGenerationService {

    private static final Logger log = LoggerFactory.getLogger(InsightGenerationService.class);

    static final String FALLBACK_MODEL = "heuristic";

    private final TextGenerationClient textGenerationClient;
    private final InsightPromptBuilder promptBuilder;
    private final InsightResponseParser responseParser;
    private final FallbackInsightGenerator fallbackGenerator;
    private final CurrencySanitizer currencySanitizer;

    public InsightGenerationService(
            TextGenerationClient textGenerationClient,
            InsightPromptBuilder promptBuilder,
            InsightResponseParser responseParser,
            FallbackInsightGenerator fallbackGenerator,
            CurrencySanitizer currencySanitizer) {
        this.textGenerationClient = textGenerationClient;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.fallbackGenerator = fallbackGenerator;
        this.currencySanitizer = currencySanitizer;
    }

    public record GeneratedInsights(List<Insight> insights, InsightCacheEntry.Source source, String model) {
        public GeneratedInsights {
            insights = List.copyOf(insights);
        }
    }

    public GeneratedInsights generateInsights(ReportData reportData, List<Transaction> transactions) {
        if (!textGenerationClient.hasCredentials()) {
            log.debug("Insights: no text-generation credentials, using heuristics for {}", reportData.kind().code());
            return fallback(reportData, transactions);
        }
        try {
            String prompt = promptBuilder.buildPrompt(reportData, transactions);
            Optional<String> response = textGenerationClient.generateText(prompt);
            if (response.isEmpty()) {
                log.warn("Insights: text generation returned nothing for {}, using fallback", reportData.kind().code());
                return fallback(reportData, transactions);
            }
            List<Insight> parsed = responseParser.parse(response.get());
            return new GeneratedInsights(
                    currencySanitizer.sanitize(parsed),
                    InsightCacheEntry.Source.AI,
                    textGenerationClient.model());
        } catch (InsightResponseParseException ex) {
            log.warn("Insights: unparseable generated text for {} ({}), using fallback",
                    reportData.kind().code(), ex.getMessage());
            return fallback(reportData, transactions);
        } catch (RuntimeException ex) {
            log.warn("Insights: generation failed for {}, using fallback", reportData.kind().code(), ex);
            return fallback(reportData, transactions);
        }
    }

    private GeneratedInsights fallback(ReportData reportData, List<Transaction> transactions) {
        List<Insight> insights = fallbackGenerator.generate(reportData, transactions);
        return new GeneratedInsights(currencySanitizer.sanitize(insights), InsightCacheEntry.Source.FALLBACK, FALLBACK_MODEL);
    }
}
