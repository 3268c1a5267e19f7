package com.demo.altcredit.service.features;

import java.util.Map;

public interface FeatureProvider {

    /** The block of the vector this provider fills; it must emit every feature of it. */
    FeatureGroup group();

    Map<Feature, Double> compute(FeatureColumns input);
}
