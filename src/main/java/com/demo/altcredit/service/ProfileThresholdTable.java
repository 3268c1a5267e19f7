package com.demo.altcredit.service;

import com.demo.altcredit.service.features.BorrowerProfile;

/**
 * P(default) at or above which a borrower is predicted to default. Students and rural
 * borrowers have thinner histories, so their cut-off is lower.
 */
public final class ProfileThresholdTable {

    public static final double DEFAULT_THRESHOLD = 0.40;

    private ProfileThresholdTable() {}

    public static double thresholdFor(BorrowerProfile profile) {
        if (profile == null) return DEFAULT_THRESHOLD;
        return switch (profile) {
            case SALARIED -> 0.40;
            case STUDENT -> 0.35;
            case GIG -> 0.40;
            case SHOPKEEPER -> 0.40;
            case RURAL -> 0.35;
        };
    }
}
