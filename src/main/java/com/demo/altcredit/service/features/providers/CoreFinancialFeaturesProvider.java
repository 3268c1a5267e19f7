package com.demo.altcredit.service.features.providers;

import com.demo.altcredit.service.features.Feature;
import com.demo.altcredit.service.features.FeatureColumns;
import com.demo.altcredit.service.features.FeatureGroup;
import com.demo.altcredit.service.features.FeatureMath;
import com.demo.altcredit.service.features.FeatureProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
public class CoreFinancialFeaturesProvider implements FeatureProvider {

    @Override public FeatureGroup group() { return FeatureGroup.CORE_FINANCIAL; }

    @Override
    public Map<Feature, Double> compute(FeatureColumns in) {
        Map<Feature, Double> f = new EnumMap<>(Feature.class);
        f.put(Feature.MONTHLY_INCOME, in.getMonthlyIncome());
        f.put(Feature.INCOME_VARIANCE, in.getIncomeVariance());
        f.put(Feature.SAVINGS_BALANCE, in.getSavingsBalance());
        f.put(Feature.MONTHS_ACTIVE, in.getMonthsActive());
        f.put(Feature.INCOME_STABILITY, FeatureMath.incomeStability(in.getIncomeVariance()));

        double savingsRatio = FeatureMath.savingsRatio(in.getSavingsBalance(), in.getMonthlyIncome());
        f.put(Feature.SAVINGS_RATIO, savingsRatio);
        // same value as savings ratio; the trained coefficients depend on both slots
        f.put(Feature.LIQUIDITY_BUFFER, savingsRatio);
        return f;
    }
}
