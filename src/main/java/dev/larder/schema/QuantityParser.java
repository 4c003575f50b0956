package dev.larder.schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the numeric quantity at the head of an ingredient line: integers, decimals with a dot
 * or a comma, simple and mixed fractions ("1/2", "1 1/2") and unicode vulgar fractions ("½",
 * "1½"). Numbers of more than six digits are not quantities.
 */
final class QuantityParser {

    private static final Map<Character, Double> VULGAR_FRACTIONS = Map.ofEntries(
            Map.entry('¼', 0.25),
            Map.entry('½', 0.5),
            Map.entry('¾', 0.75),
            Map.entry('⅓', 1.0 / 3),
            Map.entry('⅔', 2.0 / 3),
            Map.entry('⅕', 0.2),
            Map.entry('⅖', 0.4),
            Map.entry('⅗', 0.6),
            Map.entry('⅘', 0.8),
            Map.entry('⅙', 1.0 / 6),
            Map.entry('⅚', 5.0 / 6),
            Map.entry('⅛', 0.125),
            Map.entry('⅜', 0.375),
            Map.entry('⅝', 0.625),
            Map.entry('⅞', 0.875)
    );

    private static final Pattern DECIMAL = Pattern.compile("^(\\d{1,6}(?:\\.\\d{1,6})?|\\.\\d{1,6})$");
    private static final Pattern FRACTION = Pattern.compile("^(\\d{1,6})/(\\d{1,6})$");
    private static final Pattern MIXED = Pattern.compile("^(\\d{1,6})\\s+(\\d{1,6})/(\\d{1,6})$");

    private QuantityParser() {
        // utility class
    }

    static OptionalDouble parse(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return OptionalDouble.empty();
        }
        String value = candidate.trim().replace(',', '.');

        char last = value.charAt(value.length() - 1);
        Double vulgar = VULGAR_FRACTIONS.get(last);
        if (vulgar != null) {
            String whole = value.substring(0, value.length() - 1).trim();
            if (whole.isEmpty()) {
                return OptionalDouble.of(vulgar);
            }
            return DECIMAL.matcher(whole).matches()
                    ? OptionalDouble.of(Double.parseDouble(whole) + vulgar)
                    : OptionalDouble.empty();
        }

        if (DECIMAL.matcher(value).matches()) {
            return OptionalDouble.of(Double.parseDouble(value));
        }

        Matcher fraction = FRACTION.matcher(value);
        if (fraction.matches()) {
            return divide(0, fraction.group(1), fraction.group(2));
        }

        Matcher mixed = MIXED.matcher(value);
        if (mixed.matches()) {
            return divide(Integer.parseInt(mixed.group(1)), mixed.group(2), mixed.group(3));
        }
        return OptionalDouble.empty();
    }

    /**
     * Render a quantity without trailing zeros, at most three decimals: 2.0 gives "2",
     * 1/3 gives "0.333".
     */
    static String format(double quantity) {
        return BigDecimal.valueOf(quantity)
                .setScale(3, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }

    private static OptionalDouble divide(int whole, String numerator, String denominator) {
        int divisor = Integer.parseInt(denominator);
        if (divisor == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(whole + Integer.parseInt(numerator) / (double) divisor);
    }
}
