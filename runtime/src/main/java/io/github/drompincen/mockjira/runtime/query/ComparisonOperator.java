package io.github.drompincen.mockjira.runtime.query;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    GTE(">="),
    GT(">"),
    LTE("<="),
    LT("<");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(o -> o.symbol.equals(symbol)).findFirst();
    }

    public boolean test(Instant actual, Instant bound) {
        int cmp = actual.compareTo(bound);
        return switch (this) {
            case GTE -> cmp >= 0;
            case GT -> cmp > 0;
            case LTE -> cmp <= 0;
            case LT -> cmp < 0;
        };
    }
}
