package com.budgetme.reports.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetme.reports.model.Insight;
import java.util.List;
import org.junit.jupiter.api.Test;

class CurrencySanitizerTest {

    private final CurrencySanitizer sanitizer = new CurrencySanitizer("₱", "PHP", "pesos", "peso");

    @Test
    void rewritesDollarMarkersToConfiguredCurrency() {
        assertThat(sanitizer.sanitize("Save $500 USD now")).isEqualTo("Save ₱500 PHP now");
        assertThat(sanitizer.sanitize("Spent US$ 1,200 on rent")).isEqualTo("Spent ₱1,200 on rent");
        assertThat(sanitizer.sanitize("Budget USD 300 monthly")).isEqualTo("Budget ₱300 monthly");
        assertThat(sanitizer.sanitize("A few Dollars here and a dollar there")).isEqualTo("A few pesos here and a peso there");
    }

    @Test
    void singularAndPluralUnitsAreMappedSeparately() {
        assertThat(sanitizer.sanitize("Every dollar counts")).isEqualTo("Every peso counts");
        assertThat(sanitizer.sanitize("Two DOLLARS saved")).isEqualTo("Two pesos saved");
        assertThat(sanitizer.sanitize("dollarstore receipts")).isEqualTo("dollarstore receipts");
    }

    @Test
    void leavesCleanTextUntouched() {
        assertThat(sanitizer.sanitize("Food spending rose to ₱1,250.00")).isEqualTo("Food spending rose to ₱1,250.00");
        assertThat(sanitizer.sanitize("")).isEmpty();
        assertThat(sanitizer.sanitize((String) null)).isNull();
    }

    @Test
    void replacementSymbolIsInsertedLiterally() {
        CurrencySanitizer escaped = new CurrencySanitizer("\\€", "EUR", "euros", "euro");

        assertThat(escaped.sanitize("$10 or 10 USD")).isEqualTo("\\€10 or 10 EUR");
    }

    @Test
    void sanitizesEveryInsightField() {
        Insight insight = Insight.actionable("insight-0", Insight.Category.TIP, "Save $50", "Put 10 dollars aside", "Move $5");

        List<Insight> result = sanitizer.sanitize(List.of(insight));

        assertThat(result).singleElement().satisfies(clean -> {
            assertThat(clean.title()).isEqualTo("Save ₱50");
            assertThat(clean.description()).isEqualTo("Put 10 pesos aside");
            assertThat(clean.actionText()).contains("Move ₱5");
            assertThat(clean.id()).isEqualTo("insight-0");
        });
    }
}
