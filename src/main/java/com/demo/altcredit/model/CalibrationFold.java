package com.demo.altcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * One standardised logistic regression with its Platt calibration. Coefficients live in
 * scaled space: the model sees {@code (x - mean) / scale}.
 */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CalibrationFold {

    private final double[] mean;
    private final double[] scale;
    private final double[] coefficients;
    private final double intercept;
    // calibrated P(default) = 1 / (1 + exp(a * decision + b))
    private final double calibrationA;
    private final double calibrationB;

    public double decision(double[] x) {
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * (x[i] - mean[i]) / scale[i];
        }
        return z;
    }

    public double calibratedProbability(double[] x) {
        return 1.0 / (1.0 + Math.exp(calibrationA * decision(x) + calibrationB));
    }
}
