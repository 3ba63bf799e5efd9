package com.itrassist.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Rupee amount rendering for user-facing messages.
 */
public final class AmountFormats {

    private AmountFormats() {}

    /**
     * Thousands grouping: 1030000 renders as "1,030,000".
     */
    public static String grouped(BigDecimal amount) {
        DecimalFormat df = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
        return df.format(amount == null ? BigDecimal.ZERO : amount);
    }

    /**
     * Indian lakh grouping: 150000 renders as "1,50,000", 12000000 as "1,20,00,000".
     */
    public static String indian(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        String sign = value.signum() < 0 ? "-" : "";
        String digits = value.setScale(0, RoundingMode.HALF_UP).abs().toPlainString();
        if (digits.length() <= 3) return sign + digits;

        String last3 = digits.substring(digits.length() - 3);
        String rest = digits.substring(0, digits.length() - 3);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rest.length(); i++) {
            if (i > 0 && (rest.length() - i) % 2 == 0) sb.append(',');
            sb.append(rest.charAt(i));
        }
        return sign + sb + "," + last3;
    }
}
