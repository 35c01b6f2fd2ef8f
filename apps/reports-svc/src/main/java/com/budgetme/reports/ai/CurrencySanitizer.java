package com.budgetme.reports.ai;

import com.budgetme.reports.config.BudgetmeProperties;
import com.budgetme.reports.model.Insight;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class CurrencySanitizer {

    private static final Logger log = LoggerFactory.getLogger(CurrencySanitizer.class);

    private static final Pattern US_DOLLAR_BEFORE_AMOUNT = Pattern.compile("US\\$\\s*(?=\\d)");
    private static final Pattern USD_BEFORE_AMOUNT = Pattern.compile("USD\\s*(?=\\d)");
    private static final Pattern DOLLAR_BEFORE_AMOUNT = Pattern.compile("\\$\\s*(?=\\d)");
    private static final Pattern US_DOLLAR = Pattern.compile("US\\$");
    private static final Pattern DOLLAR = Pattern.compile("\\$");
    private static final Pattern USD_CODE = Pattern.compile("\\bUSD\\b");
    private static final Pattern DOLLARS_WORD = Pattern.compile("\\bdollars\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOLLAR_WORD = Pattern.compile("\\bdollar\\b", Pattern.CASE_INSENSITIVE);

    private final String symbol;
    private final String code;
    private final String unitName;
    private final String unitNameSingular;

    @Autowired
    public CurrencySanitizer(BudgetmeProperties properties) {
        this(properties.currency().symbol(),
                properties.currency().code(),
                properties.currency().unitName(),
                properties.currency().unitNameSingular());
    }

    CurrencySanitizer(String symbol, String code, String unitName, String unitNameSingular) {
        this.symbol = Matcher.quoteReplacement(symbol);
        this.code = Matcher.quoteReplacement(code);
        this.unitName = Matcher.quoteReplacement(unitName);
        this.unitNameSingular = Matcher.quoteReplacement(unitNameSingular);
    }

    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String s = US_DOLLAR_BEFORE_AMOUNT.matcher(text).replaceAll(symbol);
        s = USD_BEFORE_AMOUNT.matcher(s).replaceAll(symbol);
        s = DOLLAR_BEFORE_AMOUNT.matcher(s).replaceAll(symbol);
        s = US_DOLLAR.matcher(s).replaceAll(symbol);
        s = DOLLAR.matcher(s).replaceAll(symbol);
        s = USD_CODE.matcher(s).replaceAll(code);
        s = DOLLARS_WORD.matcher(s).replaceAll(unitName);
        return DOLLAR_WORD.matcher(s).replaceAll(unitNameSingular);
    }

    public List<Insight> sanitize(List<Insight> insights) {
        int rewritten = 0;
        List<Insight> result = new ArrayList<>(insights.size());
        for (Insight insight : insights) {
            Insight clean = insight.withText(
                    sanitize(insight.title()),
                    sanitize(insight.description()),
                    insight.actionText().map(this::sanitize));
            if (!clean.equals(insight)) {
                rewritten++;
            }
            result.add(clean);
        }
        if (rewritten > 0) {
            log.warn("Currency sanitizer rewrote foreign currency markers in {} insight(s)", rewritten);
        }
        return List.copyOf(result);
    }
}
