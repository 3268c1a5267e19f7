package com.demo.altcredit.service.features.providers;

import com.demo.altcredit.service.features.Feature;
import com.demo.altcredit.service.features.FeatureColumns;
import com.demo.altcredit.service.features.FeatureGroup;
import com.demo.altcredit.service.features.FeatureMath;
import com.demo.altcredit.service.features.FeatureProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/** Cross features derived from the raw columns and the profile flags. */
@Component
public class EngineeredFeaturesProvider implements FeatureProvider {

    @Override public FeatureGroup group() { return FeatureGroup.ENGINEERED; }

    @Override
    public Map<Feature, Double> compute(FeatureColumns in) {
        double income = in.getMonthlyIncome();
        double stability = FeatureMath.incomeStability(in.getIncomeVariance());
        double netCashflow = FeatureMath.netCashflow(in.getTotalCredits(), in.getTotalDebits());

        Map<Feature, Double> f = new EnumMap<>(Feature.class);
        f.put(Feature.STABILITY_ADJUSTED_INCOME, income * stability);
        f.put(Feature.INCOME_RISK_INDEX, income * (1.0 - stability));
        // no missed-payment column upstream: large debits relative to credits stand in for it
        f.put(Feature.MISSED_PAYMENT_PROXY, Math.max(in.getAvgDebitAmount() - in.getAvgCreditAmount(), 0.0));
        f.put(Feature.NET_CASHFLOW_RATIO, FeatureMath.safeRatio(netCashflow, in.getTotalCredits()));

        // only the active profile's flag is non-zero, so each sum picks that profile's proxy
        f.put(Feature.PROFILE_INCOME_SIGNAL,
                in.getAvgDailyRevenue() * in.getIsShopkeeper()
                        + in.getSubsidyAmount() * in.getIsRural()
                        + in.getGpa() * in.getIsStudent()
                        + in.getPlatformRating() * in.getIsGig());
        f.put(Feature.PROFILE_RATING_SIGNAL,
                in.getPlatformRating() * in.getIsGig()
                        + in.getGpa() * in.getIsStudent()
                        + in.getAttendanceRate() * in.getIsStudent()
                        + in.getAvgWeeklyHours() * in.getIsGig());

        f.put(Feature.TRANSACTION_DENSITY, FeatureMath.safeRatio(in.getTotalTransactions(), in.getMonthsActive()));
        return f;
    }
}
