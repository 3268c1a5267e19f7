package com.demo.altcredit.service.features;

import com.demo.altcredit.service.BorrowerValidationException;
import com.demo.altcredit.service.features.providers.CoreFinancialFeaturesProvider;
import com.demo.altcredit.service.features.providers.EngineeredFeaturesProvider;
import com.demo.altcredit.service.features.providers.ProfileFlagsFeaturesProvider;
import com.demo.altcredit.service.features.providers.ProfileSignalsFeaturesProvider;
import com.demo.altcredit.service.features.providers.TransactionFeaturesProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the model vector from one provider per {@link FeatureGroup}. The layout is
 * the same for training and inference, so any gap or overlap between providers is a
 * wiring error and fails fast instead of zero-filling.
 */
@Component
public class FeatureVectorBuilder {

    private final List<FeatureProvider> providers;

    public FeatureVectorBuilder(List<FeatureProvider> providers) {
        List<FeatureProvider> sorted = new ArrayList<>(providers);
        sorted.sort(Comparator.comparing(FeatureProvider::group));

        Set<FeatureGroup> seen = EnumSet.noneOf(FeatureGroup.class);
        for (FeatureProvider p : sorted) {
            if (!seen.add(p.group())) {
                throw new IllegalStateException("More than one provider for group " + p.group());
            }
        }
        Set<FeatureGroup> missing = EnumSet.allOf(FeatureGroup.class);
        missing.removeAll(seen);
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No provider for groups " + missing);
        }
        this.providers = List.copyOf(sorted);
    }

    public static FeatureVectorBuilder standard() {
        return new FeatureVectorBuilder(List.of(
                new CoreFinancialFeaturesProvider(),
                new TransactionFeaturesProvider(),
                new ProfileSignalsFeaturesProvider(),
                new ProfileFlagsFeaturesProvider(),
                new EngineeredFeaturesProvider()));
    }

    public FeatureVector build(BorrowerRecord record) {
        return build(FeatureColumns.from(record));
    }

    public FeatureVector build(FeatureColumns columns) {
        requireFinite(columns.asMap());

        double[] values = new double[Feature.COUNT];
        for (FeatureProvider p : providers) {
            List<Feature> slots = Feature.ofGroup(p.group());
            Map<Feature, Double> part = p.compute(columns);
            if (part == null || part.size() != slots.size() || !part.keySet().containsAll(slots)) {
                throw new IllegalStateException(p.getClass().getSimpleName()
                        + " must emit exactly " + slots + " but emitted "
                        + (part == null ? "null" : part.keySet()));
            }
            for (Feature f : slots) {
                values[f.ordinal()] = part.get(f);
            }
        }

        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                // only reachable through overflow on extreme inputs
                throw new BorrowerValidationException(
                        "Feature " + Feature.at(i).columnName() + " is not finite for the given input");
            }
        }
        return FeatureVector.of(values);
    }

    private static void requireFinite(Map<Feature, Double> raw) {
        for (Map.Entry<Feature, Double> e : raw.entrySet()) {
            if (!Double.isFinite(e.getValue())) {
                throw new BorrowerValidationException(e.getKey().columnName() + " must be a finite number");
            }
        }
    }
}
