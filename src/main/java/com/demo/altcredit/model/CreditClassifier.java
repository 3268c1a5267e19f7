package com.demo.altcredit.model;

import com.demo.altcredit.service.features.FeatureVector;

import java.util.List;

/**
 * Trained default-risk classifier. Implementations are loaded once and shared read-only
 * by every scoring request, so they must be immutable.
 */
public interface CreditClassifier {

    /** P(default) for one borrower. */
    double predictDefaultProbability(FeatureVector vector);

    /** Linear sub-models of the calibrated ensemble, used to explain a prediction. */
    List<CalibrationFold> calibrationFolds();

    String version();
}
