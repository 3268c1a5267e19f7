package com.demo.altcredit.service;

import com.demo.altcredit.controller.dto.PredictRequest;
import com.demo.altcredit.controller.dto.ScoreRequest;
import com.demo.altcredit.model.CreditClassifier;
import com.demo.altcredit.model.ModelState;
import com.demo.altcredit.service.dto.BatchScoreResponse;
import com.demo.altcredit.service.dto.ScoreResponse;
import com.demo.altcredit.service.features.BorrowerProfile;
import com.demo.altcredit.service.features.BorrowerRecord;
import com.demo.altcredit.service.features.FeatureColumns;
import com.demo.altcredit.service.features.FeatureVector;
import com.demo.altcredit.service.features.FeatureVectorBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {

    public static final int MAX_BATCH_SIZE = 50;

    private final ModelState modelState;
    private final FeatureVectorBuilder featureVectorBuilder;
    private final ExplainService explainService;

    public ScoreResponse score(ScoreRequest request) {
        return score(request.toRecord());
    }

    public ScoreResponse score(BorrowerRecord record) {
        CreditClassifier classifier = modelState.require();
        return guarded(() -> evaluate(classifier, featureVectorBuilder.build(record), record.getProfile()));
    }

    /**
     * Scores every borrower in input order. All records are validated first, so one bad
     * profile tag fails the whole batch and nothing is returned for the others.
     */
    public BatchScoreResponse scoreBatch(List<ScoreRequest> borrowers) {
        if (borrowers == null || borrowers.isEmpty() || borrowers.size() > MAX_BATCH_SIZE) {
            throw new BorrowerValidationException("borrowers must contain between 1 and " + MAX_BATCH_SIZE
                    + " items, got " + (borrowers == null ? 0 : borrowers.size()));
        }
        List<BorrowerRecord> records = new ArrayList<>(borrowers.size());
        for (int i = 0; i < borrowers.size(); i++) {
            try {
                records.add(borrowers.get(i).toRecord());
            } catch (BorrowerValidationException e) {
                throw new BorrowerValidationException("borrowers[" + i + "]: " + e.getMessage());
            }
        }

        CreditClassifier classifier = modelState.require();
        List<ScoreResponse> results = new ArrayList<>(records.size());
        for (BorrowerRecord r : records) {
            results.add(guarded(() -> evaluate(classifier, featureVectorBuilder.build(r), r.getProfile())));
        }
        return BatchScoreResponse.of(results);
    }

    /** Pre-engineered columns from older integrations; always the salaried threshold. */
    public ScoreResponse scoreLegacy(PredictRequest request) {
        return scoreLegacy(request.toColumns());
    }

    public ScoreResponse scoreLegacy(FeatureColumns columns) {
        CreditClassifier classifier = modelState.require();
        return guarded(() -> evaluate(classifier, featureVectorBuilder.build(columns), BorrowerProfile.SALARIED));
    }

    public ScoreResponse evaluate(CreditClassifier classifier, FeatureVector vector, BorrowerProfile profile) {
        double pDefault = classifier.predictDefaultProbability(vector);
        if (!Double.isFinite(pDefault) || pDefault < 0.0 || pDefault > 1.0) {
            throw new ScoringException("Classifier returned an invalid probability: " + pDefault, null);
        }
        double pRepay = 1.0 - pDefault;
        double threshold = ProfileThresholdTable.thresholdFor(profile);

        ScoreResponse out = ScoreResponse.builder()
                .repaymentProbability(round6(pRepay))
                .defaultProbability(round6(pDefault))
                .alternativeCreditScore(ScoreMapper.probabilityToScore(pRepay))
                .predictedDefault(pDefault >= threshold)
                .riskBand(RiskBandClassifier.probabilityToRiskBand(pDefault))
                .topFactors(explainService.topFactors(classifier, vector))
                .build();
        log.debug("Scored {} borrower: pd={} score={} band={}",
                profile == null ? "unknown" : profile.tag(), out.getDefaultProbability(),
                out.getAlternativeCreditScore(), out.getRiskBand());
        return out;
    }

    // caller-facing errors pass through unchanged, anything else becomes a ScoringException
    private static ScoreResponse guarded(ScoringStep step) {
        try {
            return step.run();
        } catch (BorrowerValidationException | ModelNotLoadedException | ScoringException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScoringException(String.valueOf(e.getMessage()), e);
        }
    }

    private static double round6(double v) {
        return new BigDecimal(v).setScale(6, RoundingMode.HALF_EVEN).doubleValue();
    }

    @FunctionalInterface
    private interface ScoringStep {
        ScoreResponse run();
    }
}
