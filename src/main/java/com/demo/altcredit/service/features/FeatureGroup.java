package com.demo.altcredit.service.features;

/** Blocks of the feature vector, in the order they are laid out. */
public enum FeatureGroup {
    CORE_FINANCIAL,
    TRANSACTION_BEHAVIOUR,
    PROFILE_SIGNALS,
    PROFILE_FLAGS,
    ENGINEERED
}
