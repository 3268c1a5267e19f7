package com.demo.altcredit.service.features;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canonical feature order shared with model training. The ordinal of each constant is its
 * position in the vector, so constants must never be reordered, inserted or removed
 * without retraining the classifier.
 */
public enum Feature {

    // core financial (7)
    MONTHLY_INCOME("f_monthly_income", "Monthly income", FeatureGroup.CORE_FINANCIAL),
    INCOME_VARIANCE("f_income_variance", "Income variance", FeatureGroup.CORE_FINANCIAL),
    SAVINGS_BALANCE("f_savings_balance", "Savings balance", FeatureGroup.CORE_FINANCIAL),
    MONTHS_ACTIVE("f_months_active", "Months of economic activity", FeatureGroup.CORE_FINANCIAL),
    INCOME_STABILITY("f_income_stability", "Income stability", FeatureGroup.CORE_FINANCIAL),
    SAVINGS_RATIO("f_savings_ratio", "Savings-to-income ratio", FeatureGroup.CORE_FINANCIAL),
    LIQUIDITY_BUFFER("f_liquidity_buffer", "Liquidity buffer", FeatureGroup.CORE_FINANCIAL),

    // transaction behaviour (8)
    TOTAL_CREDITS("f_total_credits", "Total credits", FeatureGroup.TRANSACTION_BEHAVIOUR),
    TOTAL_DEBITS("f_total_debits", "Total debits", FeatureGroup.TRANSACTION_BEHAVIOUR),
    TOTAL_TRANSACTIONS("f_total_transactions", "Transaction volume", FeatureGroup.TRANSACTION_BEHAVIOUR),
    AVG_CREDIT_AMOUNT("f_avg_credit_amount", "Avg credit size", FeatureGroup.TRANSACTION_BEHAVIOUR),
    AVG_DEBIT_AMOUNT("f_avg_debit_amount", "Avg debit size", FeatureGroup.TRANSACTION_BEHAVIOUR),
    RECURRING_RATIO("f_recurring_ratio", "Recurring payment rate", FeatureGroup.TRANSACTION_BEHAVIOUR),
    NET_CASHFLOW("f_net_cashflow", "Net cashflow", FeatureGroup.TRANSACTION_BEHAVIOUR),
    CREDIT_DEBIT_RATIO("f_credit_debit_ratio", "Credit-to-debit ratio", FeatureGroup.TRANSACTION_BEHAVIOUR),

    // profile-specific raw signals (9)
    GPA("f_gpa", "GPA", FeatureGroup.PROFILE_SIGNALS),
    ATTENDANCE_RATE("f_attendance_rate", "Attendance rate", FeatureGroup.PROFILE_SIGNALS),
    PLATFORM_RATING("f_platform_rating", "Platform rating", FeatureGroup.PROFILE_SIGNALS),
    AVG_WEEKLY_HOURS("f_avg_weekly_hours", "Avg weekly hours worked", FeatureGroup.PROFILE_SIGNALS),
    BUSINESS_YEARS("f_business_years", "Years in business", FeatureGroup.PROFILE_SIGNALS),
    AVG_DAILY_REVENUE("f_avg_daily_revenue", "Avg daily revenue", FeatureGroup.PROFILE_SIGNALS),
    LAND_SIZE_ACRES("f_land_size_acres", "Land size (acres)", FeatureGroup.PROFILE_SIGNALS),
    SUBSIDY_AMOUNT("f_subsidy_amount", "Subsidy amount", FeatureGroup.PROFILE_SIGNALS),
    SEASONALITY_INDEX("f_seasonality_index", "Seasonality index", FeatureGroup.PROFILE_SIGNALS),

    // profile one-hot (4); salaried borrowers have no flag
    IS_STUDENT("f_is_student", "Student profile", FeatureGroup.PROFILE_FLAGS),
    IS_GIG("f_is_gig", "Gig worker profile", FeatureGroup.PROFILE_FLAGS),
    IS_SHOPKEEPER("f_is_shopkeeper", "Shopkeeper profile", FeatureGroup.PROFILE_FLAGS),
    IS_RURAL("f_is_rural", "Rural/agri profile", FeatureGroup.PROFILE_FLAGS),

    // engineered cross features (7)
    STABILITY_ADJUSTED_INCOME("stability_adjusted_income", "Stability-adjusted income", FeatureGroup.ENGINEERED),
    INCOME_RISK_INDEX("income_risk_index", "Income risk index", FeatureGroup.ENGINEERED),
    MISSED_PAYMENT_PROXY("missed_payment_proxy", "Missed payment signal", FeatureGroup.ENGINEERED),
    NET_CASHFLOW_RATIO("net_cashflow_ratio", "Net cashflow ratio", FeatureGroup.ENGINEERED),
    PROFILE_INCOME_SIGNAL("profile_income_signal", "Profile income signal", FeatureGroup.ENGINEERED),
    PROFILE_RATING_SIGNAL("profile_rating_signal", "Profile quality signal", FeatureGroup.ENGINEERED),
    TRANSACTION_DENSITY("transaction_density", "Transaction density", FeatureGroup.ENGINEERED);

    public static final int COUNT = values().length;

    private static final List<Feature> ORDER = List.of(values());
    private static final List<String> COLUMN_NAMES = ORDER.stream()
            .map(Feature::columnName)
            .collect(Collectors.toUnmodifiableList());
    private static final Map<String, Feature> BY_COLUMN = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(Feature::columnName, Function.identity())));

    private final String columnName;
    private final String label;
    private final FeatureGroup group;

    Feature(String columnName, String label, FeatureGroup group) {
        this.columnName = columnName;
        this.label = label;
        this.group = group;
    }

    public String columnName() { return columnName; }

    public String label() { return label; }

    public FeatureGroup group() { return group; }

    public static List<Feature> canonicalOrder() {
        return ORDER;
    }

    public static List<String> columnNames() {
        return COLUMN_NAMES;
    }

    public static Feature at(int index) {
        return ORDER.get(index);
    }

    /** @return the feature for a column name, or {@code null} when unknown */
    public static Feature byColumnName(String columnName) {
        return BY_COLUMN.get(columnName);
    }

    public static List<Feature> ofGroup(FeatureGroup group) {
        return ORDER.stream().filter(f -> f.group == group).collect(Collectors.toUnmodifiableList());
    }
}
