package com.budgetme.reports.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "budgetme")
public record BudgetmeProperties(
        Ai ai,
        Currency currency,
        Insights insights,
        Analysis analysis,
        Sessions sessions,
        Map<String, String> categories
) {

    @ConstructorBinding
    public BudgetmeProperties {
        ai = ai != null ? ai : new Ai(null, null, null, null, null, null, null);
        currency = currency != null ? currency : new Currency(null, null, null, null);
        insights = insights != null ? insights : new Insights(null, null, null);
        analysis = analysis != null ? analysis : new Analysis(null, null);
        sessions = sessions != null ? sessions : new Sessions(null, null);
        categories = categories != null ? Map.copyOf(categories) : Map.of();
    }

    public record Ai(
            String provider,
            String model,
            String endpoint,
            String apiKey,
            Double temperature,
            Integer maxTokens,
            Integer timeoutMs
    ) {
        public Ai {
            provider = (provider != null && !provider.isBlank()) ? provider.toLowerCase() : "openrouter";
            model = (model != null && !model.isBlank()) ? model : "openai/gpt-oss-20b:free";
            endpoint = (endpoint != null && !endpoint.isBlank()) ? endpoint : "https://openrouter.ai/api/v1/chat/completions";
            temperature = temperature != null ? temperature : 0.7d;
            if (temperature < 0d || temperature > 2d) {
                throw new IllegalArgumentException("temperature must be between 0 and 2");
            }
            maxTokens = maxTokens != null ? maxTokens : 1200;
            if (maxTokens <= 0) {
                throw new IllegalArgumentException("maxTokens must be positive");
            }
            timeoutMs = timeoutMs != null ? Math.min(timeoutMs, 600_000) : 90_000;
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive");
            }
            // apiKey may be blank; insight generation then uses heuristics only
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record Currency(String symbol, String code, String unitName, String unitNameSingular) {
        public Currency {
            symbol = (symbol != null && !symbol.isBlank()) ? symbol : "₱";
            code = (code != null && !code.isBlank()) ? code : "PHP";
            unitName = (unitName != null && !unitName.isBlank()) ? unitName : "pesos";
            unitNameSingular = (unitNameSingular != null && !unitNameSingular.isBlank()) ? unitNameSingular : "peso";
        }
    }

    public record Insights(Integer ttlDays, String store, String cleanupCron) {
        public Insights {
            ttlDays = ttlDays != null ? ttlDays : 7;
            if (ttlDays <= 0) {
                throw new IllegalArgumentException("ttlDays must be positive");
            }
            store = (store != null && !store.isBlank()) ? store.toLowerCase() : "jpa";
            cleanupCron = (cleanupCron != null && !cleanupCron.isBlank()) ? cleanupCron : "0 30 3 * * *";
        }
    }

    public record Analysis(Double uncategorizedThreshold, Integer anomalyMinimumTransactions) {
        public Analysis {
            uncategorizedThreshold = uncategorizedThreshold != null ? uncategorizedThreshold : 0.10d;
            if (uncategorizedThreshold <= 0d || uncategorizedThreshold >= 1d) {
                throw new IllegalArgumentException("uncategorizedThreshold must be within (0, 1)");
            }
            anomalyMinimumTransactions = anomalyMinimumTransactions != null ? anomalyMinimumTransactions : 5;
            if (anomalyMinimumTransactions < 1) {
                throw new IllegalArgumentException("anomalyMinimumTransactions must be positive");
            }
        }
    }

    public record Sessions(Integer idleTimeoutMinutes, Long sweepIntervalMs) {
        public Sessions {
            idleTimeoutMinutes = idleTimeoutMinutes != null ? idleTimeoutMinutes : 30;
            if (idleTimeoutMinutes <= 0) {
                throw new IllegalArgumentException("idleTimeoutMinutes must be positive");
            }
            sweepIntervalMs = sweepIntervalMs != null ? sweepIntervalMs : 60_000L;
        }
    }

    public static BudgetmeProperties defaults() {
        return new BudgetmeProperties(null, null, null, null, null, null);
    }
}
