package com.demo.altcredit.controller.dto;

import com.demo.altcredit.service.features.BorrowerProfile;
import com.demo.altcredit.service.features.BorrowerRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Raw form fields from the web app; profile-specific fields are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoreRequest {

    static final String DEFAULT_PROFILE = "salaried";

    @Schema(description = "Borrower profile: salaried | student | gig | shopkeeper | rural",
            defaultValue = "salaried")
    @Builder.Default
    private String profileType = DEFAULT_PROFILE;

    @PositiveOrZero private Double monthlyIncome;
    @PositiveOrZero private Double incomeVariance;
    @PositiveOrZero private Double savingsBalance;
    @PositiveOrZero private Double monthsActive;
    @PositiveOrZero private Double totalCredits;
    @PositiveOrZero private Double totalDebits;
    @PositiveOrZero private Double totalTransactions;
    @PositiveOrZero private Double avgCreditAmount;
    @PositiveOrZero private Double avgDebitAmount;
    @PositiveOrZero @DecimalMax("1.0") private Double recurringRatio;

    // student
    @PositiveOrZero @DecimalMax("4.0") private Double gpa;
    @PositiveOrZero @DecimalMax("1.0") private Double attendanceRate;
    // gig
    @PositiveOrZero @DecimalMax("5.0") private Double platformRating;
    @PositiveOrZero private Double avgWeeklyHours;
    // shopkeeper
    @PositiveOrZero private Double businessYears;
    @PositiveOrZero private Double avgDailyRevenue;
    // rural
    @PositiveOrZero private Double landSizeAcres;
    @PositiveOrZero private Double subsidyAmount;
    @PositiveOrZero @DecimalMax("1.0") private Double seasonalityIndex;

    /** @throws com.demo.altcredit.service.BorrowerValidationException on an unknown profile tag */
    public BorrowerRecord toRecord() {
        return BorrowerRecord.builder()
                .profile(BorrowerProfile.fromTag(profileType == null ? DEFAULT_PROFILE : profileType))
                .monthlyIncome(orZero(monthlyIncome))
                .incomeVariance(orZero(incomeVariance))
                .savingsBalance(orZero(savingsBalance))
                .monthsActive(orZero(monthsActive))
                .totalCredits(orZero(totalCredits))
                .totalDebits(orZero(totalDebits))
                .totalTransactions(orZero(totalTransactions))
                .avgCreditAmount(orZero(avgCreditAmount))
                .avgDebitAmount(orZero(avgDebitAmount))
                .recurringRatio(orZero(recurringRatio))
                .gpa(orZero(gpa))
                .attendanceRate(orZero(attendanceRate))
                .platformRating(orZero(platformRating))
                .avgWeeklyHours(orZero(avgWeeklyHours))
                .businessYears(orZero(businessYears))
                .avgDailyRevenue(orZero(avgDailyRevenue))
                .landSizeAcres(orZero(landSizeAcres))
                .subsidyAmount(orZero(subsidyAmount))
                .seasonalityIndex(orZero(seasonalityIndex))
                .build();
    }

    static double orZero(Double v) {
        return v == null ? 0.0 : v;
    }
}
