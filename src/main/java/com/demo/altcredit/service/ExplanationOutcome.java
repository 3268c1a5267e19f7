package com.demo.altcredit.service;

import com.demo.altcredit.service.dto.ScoreResponse;

import java.util.List;
import java.util.Optional;

/** Either the ranked factors, or no factors plus why they could not be computed. */
public final class ExplanationOutcome {

    private final List<ScoreResponse.TopFactor> factors;
    private final String failureReason;
    private final Throwable cause;

    private ExplanationOutcome(List<ScoreResponse.TopFactor> factors, String failureReason, Throwable cause) {
        this.factors = factors;
        this.failureReason = failureReason;
        this.cause = cause;
    }

    public static ExplanationOutcome explained(List<ScoreResponse.TopFactor> factors) {
        return new ExplanationOutcome(List.copyOf(factors), null, null);
    }

    public static ExplanationOutcome unavailable(String reason, Throwable cause) {
        return new ExplanationOutcome(List.of(), reason, cause);
    }

    public boolean isExplained() {
        return failureReason == null;
    }

    public List<ScoreResponse.TopFactor> factors() {
        return factors;
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }
}
