package com.demo.altcredit.service;

/** Default probability → coarse risk band. Lower bounds are inclusive. */
public final class RiskBandClassifier {

    public static final double MEDIUM_FROM = 0.30;
    public static final double HIGH_FROM = 0.55;

    private RiskBandClassifier() {}

    public static RiskBand probabilityToRiskBand(double defaultProbability) {
        if (defaultProbability < MEDIUM_FROM) return RiskBand.LOW;
        if (defaultProbability < HIGH_FROM) return RiskBand.MEDIUM;
        return RiskBand.HIGH;
    }
}
