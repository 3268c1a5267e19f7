package com.demo.altcredit.service;

public class ModelNotLoadedException extends IllegalStateException {

    public ModelNotLoadedException(String message) {
        super(message);
    }
}
