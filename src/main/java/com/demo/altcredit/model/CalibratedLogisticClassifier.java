package com.demo.altcredit.model;

import com.demo.altcredit.service.features.FeatureVector;

import java.util.List;

/** Mean of the calibrated fold probabilities, as a cross-validated calibrator predicts. */
public class CalibratedLogisticClassifier implements CreditClassifier {

    private final String version;
    private final List<CalibrationFold> folds;

    public CalibratedLogisticClassifier(String version, List<CalibrationFold> folds) {
        if (folds == null || folds.isEmpty()) {
            throw new IllegalArgumentException("At least one calibration fold is required");
        }
        this.version = version;
        this.folds = List.copyOf(folds);
    }

    @Override
    public double predictDefaultProbability(FeatureVector vector) {
        double[] x = vector.toArray();
        double sum = 0.0;
        for (CalibrationFold fold : folds) {
            sum += fold.calibratedProbability(x);
        }
        return sum / folds.size();
    }

    @Override
    public List<CalibrationFold> calibrationFolds() {
        return folds;
    }

    @Override
    public String version() {
        return version;
    }
}
