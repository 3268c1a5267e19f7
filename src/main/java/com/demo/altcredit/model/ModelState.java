package com.demo.altcredit.model;

import com.demo.altcredit.service.ModelNotLoadedException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Holds the classifier for the lifetime of the process. It is installed once at startup;
 * when that fails the service stays up in a degraded state and scoring is refused.
 */
@Component
public class ModelState {

    private volatile CreditClassifier classifier;
    private volatile String failureReason;

    public synchronized void install(CreditClassifier loaded) {
        if (loaded == null) {
            throw new IllegalArgumentException("classifier must not be null");
        }
        if (classifier != null) {
            throw new IllegalStateException("Model already loaded (" + classifier.version() + ")");
        }
        classifier = loaded;
        failureReason = null;
    }

    public synchronized void markFailed(String reason) {
        classifier = null;
        failureReason = reason;
    }

    public synchronized void clear() {
        classifier = null;
        failureReason = null;
    }

    public boolean isLoaded() {
        return classifier != null;
    }

    public Optional<CreditClassifier> current() {
        return Optional.ofNullable(classifier);
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    public CreditClassifier require() {
        CreditClassifier c = classifier;
        if (c == null) {
            throw new ModelNotLoadedException(
                    "Model not loaded. Train and publish a model artifact, then restart the service.");
        }
        return c;
    }
}
