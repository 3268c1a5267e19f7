package com.demo.altcredit.service;

/** Unexpected failure while computing probabilities; carries the underlying message. */
public class ScoringException extends RuntimeException {

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
