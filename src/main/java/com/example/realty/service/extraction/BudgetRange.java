package com.example.realty.service.extraction;

/**
 * Parsed budget in whole currency units. At least one bound is set; a single figure sets both.
 */
public record BudgetRange(Long min, Long max) {

    public static BudgetRange exactly(long value) {
        return new BudgetRange(value, value);
    }

    public static BudgetRange between(long a, long b) {
        return new BudgetRange(Math.min(a, b), Math.max(a, b));
    }

    public static BudgetRange atMost(long value) {
        return new BudgetRange(null, value);
    }

    public static BudgetRange atLeast(long value) {
        return new BudgetRange(value, null);
    }
}
