package com.demo.altcredit.service.features.providers;

import com.demo.altcredit.service.features.Feature;
import com.demo.altcredit.service.features.FeatureColumns;
import com.demo.altcredit.service.features.FeatureGroup;
import com.demo.altcredit.service.features.FeatureProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
public class ProfileFlagsFeaturesProvider implements FeatureProvider {

    @Override public FeatureGroup group() { return FeatureGroup.PROFILE_FLAGS; }

    @Override
    public Map<Feature, Double> compute(FeatureColumns in) {
        Map<Feature, Double> f = new EnumMap<>(Feature.class);
        f.put(Feature.IS_STUDENT, in.getIsStudent());
        f.put(Feature.IS_GIG, in.getIsGig());
        f.put(Feature.IS_SHOPKEEPER, in.getIsShopkeeper());
        f.put(Feature.IS_RURAL, in.getIsRural());
        return f;
    }
}
