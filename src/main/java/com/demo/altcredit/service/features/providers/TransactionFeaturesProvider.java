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
public class TransactionFeaturesProvider implements FeatureProvider {

    @Override public FeatureGroup group() { return FeatureGroup.TRANSACTION_BEHAVIOUR; }

    @Override
    public Map<Feature, Double> compute(FeatureColumns in) {
        Map<Feature, Double> f = new EnumMap<>(Feature.class);
        f.put(Feature.TOTAL_CREDITS, in.getTotalCredits());
        f.put(Feature.TOTAL_DEBITS, in.getTotalDebits());
        f.put(Feature.TOTAL_TRANSACTIONS, in.getTotalTransactions());
        f.put(Feature.AVG_CREDIT_AMOUNT, in.getAvgCreditAmount());
        f.put(Feature.AVG_DEBIT_AMOUNT, in.getAvgDebitAmount());
        f.put(Feature.RECURRING_RATIO, in.getRecurringRatio());
        f.put(Feature.NET_CASHFLOW, FeatureMath.netCashflow(in.getTotalCredits(), in.getTotalDebits()));
        f.put(Feature.CREDIT_DEBIT_RATIO, FeatureMath.safeRatio(in.getTotalCredits(), in.getTotalDebits()));
        return f;
    }
}
