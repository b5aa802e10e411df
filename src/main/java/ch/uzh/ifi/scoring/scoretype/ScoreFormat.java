package ch.uzh.ifi.scoring.scoretype;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Compact rendering of scores for ranking columns and headers, in the style of
 * printf's {@code %g}: six significant digits, no trailing zeros, exponent
 * notation only for very small or very large magnitudes.
 */
public final class ScoreFormat {

    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(6, RoundingMode.HALF_EVEN);

    private ScoreFormat() {
    }

    public static String compact(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return Double.isNaN(value) ? "nan" : (value > 0 ? "inf" : "-inf");
        if (value == 0.0)
            return "0";
        BigDecimal rounded = new BigDecimal(Double.toString(value)).round(SIGNIFICANT_DIGITS);
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= 6) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            return "%se%s%02d".formatted(mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
