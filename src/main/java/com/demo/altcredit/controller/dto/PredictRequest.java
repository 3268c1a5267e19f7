package com.demo.altcredit.controller.dto;

import com.demo.altcredit.service.features.FeatureColumns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Legacy body: pre-computed {@code f_*} columns, one-hot flags included. Kept for older
 * integrations; new callers should send {@link ScoreRequest}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictRequest {

    @JsonProperty("f_monthly_income") @PositiveOrZero private Double monthlyIncome;
    @JsonProperty("f_income_variance") @PositiveOrZero private Double incomeVariance;
    @JsonProperty("f_savings_balance") @PositiveOrZero private Double savingsBalance;
    @JsonProperty("f_months_active") @PositiveOrZero private Double monthsActive;
    @JsonProperty("f_total_credits") @PositiveOrZero private Double totalCredits;
    @JsonProperty("f_total_debits") @PositiveOrZero private Double totalDebits;
    @JsonProperty("f_total_transactions") @PositiveOrZero private Double totalTransactions;
    @JsonProperty("f_avg_credit_amount") @PositiveOrZero private Double avgCreditAmount;
    @JsonProperty("f_avg_debit_amount") @PositiveOrZero private Double avgDebitAmount;
    @JsonProperty("f_recurring_ratio") @PositiveOrZero @DecimalMax("1.0") private Double recurringRatio;
    @JsonProperty("f_gpa") @PositiveOrZero @DecimalMax("4.0") private Double gpa;
    @JsonProperty("f_attendance_rate") @PositiveOrZero @DecimalMax("1.0") private Double attendanceRate;
    @JsonProperty("f_platform_rating") @PositiveOrZero @DecimalMax("5.0") private Double platformRating;
    @JsonProperty("f_avg_weekly_hours") @PositiveOrZero private Double avgWeeklyHours;
    @JsonProperty("f_business_years") @PositiveOrZero private Double businessYears;
    @JsonProperty("f_avg_daily_revenue") @PositiveOrZero private Double avgDailyRevenue;
    @JsonProperty("f_land_size_acres") @PositiveOrZero private Double landSizeAcres;
    @JsonProperty("f_subsidy_amount") @PositiveOrZero private Double subsidyAmount;
    @JsonProperty("f_seasonality_index") @PositiveOrZero @DecimalMax("1.0") private Double seasonalityIndex;
    @JsonProperty("f_is_student") @PositiveOrZero @DecimalMax("1.0") private Double isStudent;
    @JsonProperty("f_is_gig") @PositiveOrZero @DecimalMax("1.0") private Double isGig;
    @JsonProperty("f_is_shopkeeper") @PositiveOrZero @DecimalMax("1.0") private Double isShopkeeper;
    @JsonProperty("f_is_rural") @PositiveOrZero @DecimalMax("1.0") private Double isRural;

    public FeatureColumns toColumns() {
        return FeatureColumns.builder()
                .monthlyIncome(ScoreRequest.orZero(monthlyIncome))
                .incomeVariance(ScoreRequest.orZero(incomeVariance))
                .savingsBalance(ScoreRequest.orZero(savingsBalance))
                .monthsActive(ScoreRequest.orZero(monthsActive))
                .totalCredits(ScoreRequest.orZero(totalCredits))
                .totalDebits(ScoreRequest.orZero(totalDebits))
                .totalTransactions(ScoreRequest.orZero(totalTransactions))
                .avgCreditAmount(ScoreRequest.orZero(avgCreditAmount))
                .avgDebitAmount(ScoreRequest.orZero(avgDebitAmount))
                .recurringRatio(ScoreRequest.orZero(recurringRatio))
                .gpa(ScoreRequest.orZero(gpa))
                .attendanceRate(ScoreRequest.orZero(attendanceRate))
                .platformRating(ScoreRequest.orZero(platformRating))
                .avgWeeklyHours(ScoreRequest.orZero(avgWeeklyHours))
                .businessYears(ScoreRequest.orZero(businessYears))
                .avgDailyRevenue(ScoreRequest.orZero(avgDailyRevenue))
                .landSizeAcres(ScoreRequest.orZero(landSizeAcres))
                .subsidyAmount(ScoreRequest.orZero(subsidyAmount))
                .seasonalityIndex(ScoreRequest.orZero(seasonalityIndex))
                .isStudent(ScoreRequest.orZero(isStudent))
                .isGig(ScoreRequest.orZero(isGig))
                .isShopkeeper(ScoreRequest.orZero(isShopkeeper))
                .isRural(ScoreRequest.orZero(isRural))
                .build();
    }
}
