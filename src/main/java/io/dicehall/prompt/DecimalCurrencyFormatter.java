package io.dicehall.prompt;

import java.math.BigDecimal;

/**
 * Shows a smallest-unit amount as a decimal figure, e.g. 1500000000 with 9 decimals as "1.5 SOL".
 */
public final class DecimalCurrencyFormatter implements CurrencyFormatter {
    private final int decimals;
    private final String symbol;

    public DecimalCurrencyFormatter(int decimals, String symbol) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative");
        }
        this.decimals = decimals;
        this.symbol = symbol == null ? "" : symbol.trim();
    }

    public static DecimalCurrencyFormatter lamports() {
        return new DecimalCurrencyFormatter(9, "SOL");
    }

    @Override
    public String toDisplay(long amount) {
        String figure = BigDecimal.valueOf(amount, decimals).stripTrailingZeros().toPlainString();
        return symbol.isEmpty() ? figure : figure + " " + symbol;
    }
}
