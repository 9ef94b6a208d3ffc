package io.dicehall.prompt;

public interface CurrencyFormatter {
    String toDisplay(long amount);
}
