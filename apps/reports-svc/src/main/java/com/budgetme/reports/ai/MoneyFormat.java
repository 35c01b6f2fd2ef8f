package com.budgetme.reports.ai;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

final class MoneyFormat {

    private MoneyFormat() {
    }

    static String amount(String symbol, BigDecimal value) {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ENGLISH));
        BigDecimal safe = value == null ? BigDecimal.ZERO : value.setScale(2, RoundingMode.HALF_UP);
        return symbol + format.format(safe);
    }

    static String percent(BigDecimal value, int decimals) {
        return (value == null ? BigDecimal.ZERO : value).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }
}
