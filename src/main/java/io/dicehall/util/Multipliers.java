package io.dicehall.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fixed-point multipliers in hundredths: 100 is x1.00, 125 is x1.25.
 * Every operation floors, so results never depend on floating-point rounding.
 */
public final class Multipliers {
    public static final long ONE = 100L;
    private static final BigInteger SCALE = BigInteger.valueOf(ONE);

    private Multipliers() {
    }

    public static long fromDecimal(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("multiplier must not be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("multiplier must not be negative: " + value);
        }
        return value.setScale(2, RoundingMode.DOWN).movePointRight(2).longValueExact();
    }

    public static long fromDecimal(double value) {
        return fromDecimal(BigDecimal.valueOf(value));
    }

    /**
     * floor(multiplier * factor), both in hundredths.
     */
    public static long compound(long multiplier, long factor) {
        return Math.multiplyExact(multiplier, factor) / ONE;
    }

    /**
     * floor(stake * multiplier) in the smallest currency unit.
     */
    public static long applyToStake(long stake, long multiplier) {
        return BigInteger.valueOf(stake)
                .multiply(BigInteger.valueOf(multiplier))
                .divide(SCALE)
                .longValueExact();
    }

    public static String format(long multiplier) {
        return "x" + BigDecimal.valueOf(multiplier, 2).toPlainString();
    }
}
