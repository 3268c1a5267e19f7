package com.demo.altcredit.model;

import com.demo.altcredit.service.features.Feature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a model artifact into a {@link CreditClassifier}. An artifact trained on a
 * different feature layout is refused: scoring it would silently produce wrong numbers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelArtifactLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final ModelRegistryClient registryClient;

    /** Registry first when one is configured, otherwise the resource at {@code location}. */
    public CreditClassifier load(String location) {
        if (registryClient.isConfigured()) {
            log.info("Fetching model artifact from {}", registryClient.artifactUrl());
            return fromArtifact(registryClient.fetchArtifact());
        }
        return loadResource(location);
    }

    public CreditClassifier loadResource(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ModelLoadException("Model file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return fromArtifact(objectMapper.readValue(in, ModelArtifact.class));
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read model artifact " + location + ": " + e.getMessage(), e);
        }
    }

    public CreditClassifier fromArtifact(ModelArtifact artifact) {
        if (artifact == null) {
            throw new ModelLoadException("Model artifact is empty");
        }
        if (!Feature.columnNames().equals(artifact.getFeatureOrder())) {
            throw new ModelLoadException("Artifact feature_order does not match the service feature order "
                    + Feature.columnNames());
        }
        if (artifact.getFolds() == null || artifact.getFolds().isEmpty()) {
            throw new ModelLoadException("Artifact has no calibration folds");
        }

        List<CalibrationFold> folds = new ArrayList<>();
        for (int i = 0; i < artifact.getFolds().size(); i++) {
            ModelArtifact.Fold f = artifact.getFolds().get(i);
            String where = "folds[" + i + "]";
            if (f == null || f.getCalibration() == null) {
                throw new ModelLoadException(where + " is missing calibration parameters");
            }
            requireVector(f.getMean(), where + ".mean", false);
            requireVector(f.getScale(), where + ".scale", true);
            requireVector(f.getCoef(), where + ".coef", false);
            folds.add(CalibrationFold.builder()
                    .mean(f.getMean().clone())
                    .scale(f.getScale().clone())
                    .coefficients(f.getCoef().clone())
                    .intercept(f.getIntercept())
                    .calibrationA(f.getCalibration().getA())
                    .calibrationB(f.getCalibration().getB())
                    .build());
        }

        String version = artifact.getModelVersion() == null ? "unversioned" : artifact.getModelVersion();
        log.info("Model artifact {} accepted with {} calibration folds", version, folds.size());
        return new CalibratedLogisticClassifier(version, folds);
    }

    private static void requireVector(double[] v, String name, boolean nonZero) {
        if (v == null || v.length != Feature.COUNT) {
            throw new ModelLoadException(name + " must have " + Feature.COUNT + " entries, got "
                    + (v == null ? "none" : v.length));
        }
        for (int i = 0; i < v.length; i++) {
            if (!Double.isFinite(v[i]) || (nonZero && v[i] == 0.0)) {
                throw new ModelLoadException(name + "[" + i + "] is invalid: " + v[i]);
            }
        }
    }
}
