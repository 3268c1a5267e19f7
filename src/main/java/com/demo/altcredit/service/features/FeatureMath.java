package com.demo.altcredit.service.features;

/** Derivations shared by more than one provider. */
public final class FeatureMath {

    static final double DENOMINATOR_FLOOR = 1.0;

    private FeatureMath() {}

    /** numerator / max(denominator, 1.0); never divides by zero or a tiny value. */
    public static double safeRatio(double numerator, double denominator) {
        return numerator / Math.max(denominator, DENOMINATOR_FLOOR);
    }

    /** 1 / (1 + variance): higher variance means less stable income. */
    public static double incomeStability(double incomeVariance) {
        return safeRatio(1.0, 1.0 + incomeVariance);
    }

    public static double savingsRatio(double savingsBalance, double monthlyIncome) {
        return safeRatio(savingsBalance, monthlyIncome);
    }

    public static double netCashflow(double totalCredits, double totalDebits) {
        return totalCredits - totalDebits;
    }
}
