package orderbookService;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point scaling between external decimal values and the integer units used by the
 * matching engine and the write-ahead log. Prices and quantities never pass through a double.
 */
public final class DecimalScale {
    public static final DecimalScale PRICE = fromPrecision(8);
    public static final DecimalScale QUANTITY = fromPrecision(8);

    private final int precision;
    private final long scaleFactor;

    private DecimalScale(int precision, long scaleFactor) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be non-negative");
        }
        if (scaleFactor <= 0) {
            throw new IllegalArgumentException("scaleFactor must be positive");
        }
        this.precision = precision;
        this.scaleFactor = scaleFactor;
    }

    public static DecimalScale fromPrecision(int precision) {
        return new DecimalScale(precision, BigDecimal.ONE.movePointRight(precision).longValueExact());
    }

    public int precision() {
        return precision;
    }

    public long scaleFactor() {
        return scaleFactor;
    }

    public long toUnits(BigDecimal value) {
        try {
            return value.setScale(precision, RoundingMode.UNNECESSARY)
                    .movePointRight(precision)
                    .longValueExact();
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException(
                    "Value does not fit precision " + precision + ": " + value.toPlainString(), ex);
        }
    }

    public long toUnits(String value) {
        return toUnits(new BigDecimal(value));
    }

    public BigDecimal toDecimal(long units) {
        BigDecimal decimal = BigDecimal.valueOf(units, precision).stripTrailingZeros();
        return decimal.scale() < 0 ? decimal.setScale(0) : decimal;
    }
}
