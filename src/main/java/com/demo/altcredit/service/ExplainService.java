package com.demo.altcredit.service;

import com.demo.altcredit.model.CalibrationFold;
import com.demo.altcredit.model.CreditClassifier;
import com.demo.altcredit.service.dto.ScoreResponse;
import com.demo.altcredit.service.features.Feature;
import com.demo.altcredit.service.features.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks the features that pushed a prediction, using the fold-averaged logistic
 * coefficients in original feature units. Best effort: a failure yields no factors.
 */
@Slf4j
@Service
public class ExplainService {

    public static final int DEFAULT_TOP_N = 5;

    public List<ScoreResponse.TopFactor> topFactors(CreditClassifier classifier, FeatureVector vector) {
        return topFactors(classifier, vector, DEFAULT_TOP_N);
    }

    public List<ScoreResponse.TopFactor> topFactors(CreditClassifier classifier, FeatureVector vector, int n) {
        ExplanationOutcome outcome = explain(classifier, vector, n);
        if (!outcome.isExplained()) {
            log.warn("Top factors unavailable: {}", outcome.failureReason().orElse("unknown"),
                    outcome.cause().orElse(null));
        }
        return outcome.factors();
    }

    public ExplanationOutcome explain(CreditClassifier classifier, FeatureVector vector, int n) {
        try {
            double[] x = vector.toArray();
            double[] coef = averagedCoefficients(classifier.calibrationFolds(), x.length);

            // signed contribution to the log-odds of default
            double[] impacts = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                impacts[i] = coef[i] * x[i];
                if (!Double.isFinite(impacts[i])) {
                    return ExplanationOutcome.unavailable(
                            "non-finite impact for " + Feature.at(i).columnName(), null);
                }
            }

            // List.sort is stable: equal magnitudes keep feature order
            List<Integer> ranked = new ArrayList<>(impacts.length);
            for (int i = 0; i < impacts.length; i++) ranked.add(i);
            ranked.sort(Comparator.comparingDouble((Integer i) -> Math.abs(impacts[i])).reversed());

            List<ScoreResponse.TopFactor> factors = new ArrayList<>();
            for (int i : ranked.subList(0, Math.min(Math.max(n, 0), ranked.size()))) {
                double impact = impacts[i];
                factors.add(new ScoreResponse.TopFactor(
                        Feature.at(i).label(),
                        impact > 0 ? ScoreResponse.TopFactor.NEGATIVE : ScoreResponse.TopFactor.POSITIVE,
                        round(Math.abs(impact), 4)));
            }
            return ExplanationOutcome.explained(factors);
        } catch (RuntimeException e) {
            return ExplanationOutcome.unavailable(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /** Per-feature coefficient in original units (coef / scale), averaged over folds. */
    double[] averagedCoefficients(List<CalibrationFold> folds, int width) {
        if (folds == null || folds.isEmpty()) {
            throw new IllegalStateException("classifier exposes no calibration folds");
        }
        double[] sum = new double[width];
        for (CalibrationFold fold : folds) {
            double[] c = fold.getCoefficients();
            double[] s = fold.getScale();
            if (c == null || s == null || c.length != width || s.length != width) {
                throw new IllegalStateException("fold shape does not match a " + width + "-feature vector");
            }
            for (int i = 0; i < width; i++) {
                double unscaled = c[i] / s[i];
                if (!Double.isFinite(unscaled)) {
                    throw new ArithmeticException("coefficient " + i + " is not finite after unscaling");
                }
                sum[i] += unscaled;
            }
        }
        for (int i = 0; i < width; i++) {
            sum[i] /= folds.size();
        }
        return sum;
    }

    static double round(double value, int places) {
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
