package com.demo.altcredit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/** Persisted form of a {@link CalibratedLogisticClassifier}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelArtifact {

    @JsonProperty("model_version")
    private String modelVersion;

    @JsonProperty("feature_order")
    private List<String> featureOrder;

    private List<Fold> folds;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Fold {
        private double[] mean;
        private double[] scale;
        private double[] coef;
        private double intercept;
        private Calibration calibration;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Calibration {
        private double a;
        private double b;
    }
}
