package com.itrassist.backend.services.documents.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the first amount out of a free-text line such as {@code "Gross Salary: ₹ 12,00,000.50"}.
 * Only thousands separators and the rupee sign are dropped; a dash used as a label separator
 * ({@code "TDS - 90,000"}) is not a sign.
 */
public final class AmountParser {

    private static final Pattern NOISE = Pattern.compile("[,₹]");
    // A minus counts only when attached to the digits and not itself glued to a word ("Salary-1,000").
    private static final Pattern AMOUNT = Pattern.compile("((?<![\\p{Alnum}\\-])-)?(\\d+(?:\\.\\d{1,2})?)");
    private static final BigDecimal HALF = new BigDecimal("0.5");

    private AmountParser() {}

    /**
     * @return the first amount rounded to a whole rupee (halves round towards positive infinity),
     *         or empty when the line holds no digits
     */
    public static Optional<BigDecimal> parse(String line) {
        if (line == null || line.isEmpty()) return Optional.empty();

        String compact = NOISE.matcher(line).replaceAll("");
        Matcher m = AMOUNT.matcher(compact);
        if (!m.find()) return Optional.empty();

        try {
            String sign = m.group(1) != null ? "-" : "";
            return Optional.of(roundWhole(new BigDecimal(sign + m.group(2))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * floor(x + 0.5): 2.5 becomes 3, -2.5 becomes -2.
     */
    public static BigDecimal roundWhole(BigDecimal value) {
        return value.add(HALF).setScale(0, RoundingMode.FLOOR);
    }
}
