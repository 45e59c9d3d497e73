package com.quantbacktest.rebalancer.domain.strategy;

/**
 * Comparison operator used by threshold rules.
 */
public enum Comparison {
    GT(">") {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    GTE(">=") {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT("<") {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    LTE("<=") {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    };

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public abstract boolean test(double value, double threshold);

    /**
     * Parse either the enum name ({@code GTE}) or the operator symbol ({@code >=}).
     */
    public static Comparison fromText(String text) {
        String trimmed = text == null ? "" : text.trim();
        for (Comparison comparison : values()) {
            if (comparison.name().equalsIgnoreCase(trimmed) || comparison.symbol.equals(trimmed)) {
                return comparison;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + text);
    }
}
