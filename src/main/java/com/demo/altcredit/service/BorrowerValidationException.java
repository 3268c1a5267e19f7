package com.demo.altcredit.service;

/** Caller-side input problem: unknown profile tag, out-of-range signal, oversized batch. */
public class BorrowerValidationException extends IllegalArgumentException {

    public BorrowerValidationException(String message) {
        super(message);
    }
}
