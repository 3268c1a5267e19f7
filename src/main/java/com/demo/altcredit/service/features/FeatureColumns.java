package com.demo.altcredit.service.features;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Raw feature columns as the model sees them before derivation: the borrower signals plus
 * the profile one-hot flags. Legacy callers send these directly.
 */
@Value
@Builder
public class FeatureColumns {

    @Builder.Default double monthlyIncome = 0.0;
    @Builder.Default double incomeVariance = 0.0;
    @Builder.Default double savingsBalance = 0.0;
    @Builder.Default double monthsActive = 0.0;

    @Builder.Default double totalCredits = 0.0;
    @Builder.Default double totalDebits = 0.0;
    @Builder.Default double totalTransactions = 0.0;
    @Builder.Default double avgCreditAmount = 0.0;
    @Builder.Default double avgDebitAmount = 0.0;
    @Builder.Default double recurringRatio = 0.0;

    @Builder.Default double gpa = 0.0;
    @Builder.Default double attendanceRate = 0.0;
    @Builder.Default double platformRating = 0.0;
    @Builder.Default double avgWeeklyHours = 0.0;
    @Builder.Default double businessYears = 0.0;
    @Builder.Default double avgDailyRevenue = 0.0;
    @Builder.Default double landSizeAcres = 0.0;
    @Builder.Default double subsidyAmount = 0.0;
    @Builder.Default double seasonalityIndex = 0.0;

    @Builder.Default double isStudent = 0.0;
    @Builder.Default double isGig = 0.0;
    @Builder.Default double isShopkeeper = 0.0;
    @Builder.Default double isRural = 0.0;

    public static FeatureColumns from(BorrowerRecord r) {
        Feature flag = r.getProfile().flag();
        return FeatureColumns.builder()
                .monthlyIncome(r.getMonthlyIncome())
                .incomeVariance(r.getIncomeVariance())
                .savingsBalance(r.getSavingsBalance())
                .monthsActive(r.getMonthsActive())
                .totalCredits(r.getTotalCredits())
                .totalDebits(r.getTotalDebits())
                .totalTransactions(r.getTotalTransactions())
                .avgCreditAmount(r.getAvgCreditAmount())
                .avgDebitAmount(r.getAvgDebitAmount())
                .recurringRatio(r.getRecurringRatio())
                .gpa(r.getGpa())
                .attendanceRate(r.getAttendanceRate())
                .platformRating(r.getPlatformRating())
                .avgWeeklyHours(r.getAvgWeeklyHours())
                .businessYears(r.getBusinessYears())
                .avgDailyRevenue(r.getAvgDailyRevenue())
                .landSizeAcres(r.getLandSizeAcres())
                .subsidyAmount(r.getSubsidyAmount())
                .seasonalityIndex(r.getSeasonalityIndex())
                .isStudent(flag == Feature.IS_STUDENT ? 1.0 : 0.0)
                .isGig(flag == Feature.IS_GIG ? 1.0 : 0.0)
                .isShopkeeper(flag == Feature.IS_SHOPKEEPER ? 1.0 : 0.0)
                .isRural(flag == Feature.IS_RURAL ? 1.0 : 0.0)
                .build();
    }

    /** Columns keyed by the feature slot they feed, in canonical order. */
    public Map<Feature, Double> asMap() {
        Map<Feature, Double> m = new EnumMap<>(Feature.class);
        m.put(Feature.MONTHLY_INCOME, monthlyIncome);
        m.put(Feature.INCOME_VARIANCE, incomeVariance);
        m.put(Feature.SAVINGS_BALANCE, savingsBalance);
        m.put(Feature.MONTHS_ACTIVE, monthsActive);
        m.put(Feature.TOTAL_CREDITS, totalCredits);
        m.put(Feature.TOTAL_DEBITS, totalDebits);
        m.put(Feature.TOTAL_TRANSACTIONS, totalTransactions);
        m.put(Feature.AVG_CREDIT_AMOUNT, avgCreditAmount);
        m.put(Feature.AVG_DEBIT_AMOUNT, avgDebitAmount);
        m.put(Feature.RECURRING_RATIO, recurringRatio);
        m.put(Feature.GPA, gpa);
        m.put(Feature.ATTENDANCE_RATE, attendanceRate);
        m.put(Feature.PLATFORM_RATING, platformRating);
        m.put(Feature.AVG_WEEKLY_HOURS, avgWeeklyHours);
        m.put(Feature.BUSINESS_YEARS, businessYears);
        m.put(Feature.AVG_DAILY_REVENUE, avgDailyRevenue);
        m.put(Feature.LAND_SIZE_ACRES, landSizeAcres);
        m.put(Feature.SUBSIDY_AMOUNT, subsidyAmount);
        m.put(Feature.SEASONALITY_INDEX, seasonalityIndex);
        m.put(Feature.IS_STUDENT, isStudent);
        m.put(Feature.IS_GIG, isGig);
        m.put(Feature.IS_SHOPKEEPER, isShopkeeper);
        m.put(Feature.IS_RURAL, isRural);
        return Collections.unmodifiableMap(m);
    }
}
