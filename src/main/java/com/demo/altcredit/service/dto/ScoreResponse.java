package com.demo.altcredit.service.dto;

import com.demo.altcredit.service.RiskBand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Scoring outcome for one borrower. JSON names are snake_case (see JacksonConfig). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreResponse {
    private double repaymentProbability;
    private double defaultProbability;
    private int alternativeCreditScore;
    private boolean predictedDefault;
    private RiskBand riskBand;
    private List<TopFactor> topFactors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopFactor {
        public static final String POSITIVE = "positive";
        public static final String NEGATIVE = "negative";

        private String label;
        private String direction; // "positive" helps the score, "negative" hurts it
        private double impact;
    }
}
