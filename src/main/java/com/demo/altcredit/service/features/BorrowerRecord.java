package com.demo.altcredit.service.features;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Raw signals for one borrower. Signals that do not apply to the profile stay at 0.0.
 */
@Value
@Builder(toBuilder = true)
public class BorrowerRecord {

    @NonNull
    @Builder.Default
    BorrowerProfile profile = BorrowerProfile.SALARIED;

    // core financial
    @Builder.Default double monthlyIncome = 0.0;
    @Builder.Default double incomeVariance = 0.0;
    @Builder.Default double savingsBalance = 0.0;
    @Builder.Default double monthsActive = 0.0;

    // transaction behaviour
    @Builder.Default double totalCredits = 0.0;
    @Builder.Default double totalDebits = 0.0;
    @Builder.Default double totalTransactions = 0.0;
    @Builder.Default double avgCreditAmount = 0.0;
    @Builder.Default double avgDebitAmount = 0.0;
    @Builder.Default double recurringRatio = 0.0;

    // student / gig / shopkeeper / rural
    @Builder.Default double gpa = 0.0;
    @Builder.Default double attendanceRate = 0.0;
    @Builder.Default double platformRating = 0.0;
    @Builder.Default double avgWeeklyHours = 0.0;
    @Builder.Default double businessYears = 0.0;
    @Builder.Default double avgDailyRevenue = 0.0;
    @Builder.Default double landSizeAcres = 0.0;
    @Builder.Default double subsidyAmount = 0.0;
    @Builder.Default double seasonalityIndex = 0.0;
}
