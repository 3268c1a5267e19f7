package com.demo.altcredit.service.features;

import com.demo.altcredit.service.BorrowerValidationException;
import com.demo.altcredit.service.features.providers.CoreFinancialFeaturesProvider;
import com.demo.altcredit.service.features.providers.EngineeredFeaturesProvider;
import com.demo.altcredit.service.features.providers.ProfileFlagsFeaturesProvider;
import com.demo.altcredit.service.features.providers.ProfileSignalsFeaturesProvider;
import com.demo.altcredit.service.features.providers.TransactionFeaturesProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FeatureVectorBuilder")
class FeatureVectorBuilderTest {

    private final FeatureVectorBuilder builder = FeatureVectorBuilder.standard();

    private static BorrowerRecord salariedExample() {
        return BorrowerRecord.builder()
                .profile(BorrowerProfile.SALARIED)
                .monthlyIncome(8000)
                .incomeVariance(200)
                .savingsBalance(15000)
                .monthsActive(24)
                .totalCredits(50000)
                .totalDebits(35000)
                .totalTransactions(120)
                .recurringRatio(0.4)
                .build();
    }

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        @DisplayName("Canonical order is grouped core, transaction, profile signals, flags, engineered")
        void canonicalOrder() {
            assertThat(Feature.COUNT).isEqualTo(7 + 8 + 9 + 4 + 7);
            assertThat(Feature.ofGroup(FeatureGroup.CORE_FINANCIAL)).hasSize(7);
            assertThat(Feature.ofGroup(FeatureGroup.TRANSACTION_BEHAVIOUR)).hasSize(8);
            assertThat(Feature.ofGroup(FeatureGroup.PROFILE_SIGNALS)).hasSize(9);
            assertThat(Feature.ofGroup(FeatureGroup.PROFILE_FLAGS)).hasSize(4);
            assertThat(Feature.ofGroup(FeatureGroup.ENGINEERED)).hasSize(7);

            // groups are contiguous and in declaration order
            FeatureGroup previous = FeatureGroup.CORE_FINANCIAL;
            for (Feature f : Feature.canonicalOrder()) {
                assertThat(f.group().compareTo(previous)).isGreaterThanOrEqualTo(0);
                previous = f.group();
            }

            assertThat(Feature.columnNames().get(0)).isEqualTo("f_monthly_income");
            assertThat(Feature.columnNames().get(6)).isEqualTo("f_liquidity_buffer");
            assertThat(Feature.columnNames().get(23)).isEqualTo("f_seasonality_index");
            assertThat(Feature.columnNames().get(27)).isEqualTo("f_is_rural");
            assertThat(Feature.columnNames().get(Feature.COUNT - 1)).isEqualTo("transaction_density");
        }

        @Test
        @DisplayName("Vector has one value per feature and is deterministic")
        void deterministic() {
            FeatureVector first = builder.build(salariedExample());
            FeatureVector second = builder.build(salariedExample());

            assertThat(first.size()).isEqualTo(Feature.COUNT);
            assertThat(first).isEqualTo(second);
            for (int i = 0; i < first.size(); i++) {
                assertThat(Double.doubleToRawLongBits(first.get(i)))
                        .isEqualTo(Double.doubleToRawLongBits(second.get(i)));
            }
        }

        @Test
        @DisplayName("Vector is immutable from the outside")
        void immutable() {
            FeatureVector v = builder.build(salariedExample());
            double[] copy = v.toArray();
            copy[0] = -1;
            assertThat(v.get(Feature.MONTHLY_INCOME)).isEqualTo(8000.0);
        }

        @Test
        @DisplayName("Named view follows the canonical order")
        void namedMap() {
            FeatureVector v = builder.build(salariedExample());
            assertThat(v.asNamedMap().keySet()).containsExactlyElementsOf(Feature.columnNames());
        }
    }

    @Nested
    @DisplayName("Derived features")
    class Derived {

        @Test
        @DisplayName("Salaried example produces the expected derived values")
        void salariedValues() {
            FeatureVector v = builder.build(salariedExample());
            double stability = 1.0 / 201.0;

            assertThat(v.get(Feature.INCOME_STABILITY)).isEqualTo(stability);
            assertThat(v.get(Feature.SAVINGS_RATIO)).isEqualTo(15000.0 / 8000.0);
            assertThat(v.get(Feature.NET_CASHFLOW)).isEqualTo(15000.0);
            assertThat(v.get(Feature.CREDIT_DEBIT_RATIO)).isEqualTo(50000.0 / 35000.0);
            assertThat(v.get(Feature.STABILITY_ADJUSTED_INCOME)).isEqualTo(8000.0 * stability);
            assertThat(v.get(Feature.INCOME_RISK_INDEX)).isEqualTo(8000.0 * (1.0 - stability));
            assertThat(v.get(Feature.MISSED_PAYMENT_PROXY)).isZero();
            assertThat(v.get(Feature.NET_CASHFLOW_RATIO)).isEqualTo(15000.0 / 50000.0);
            assertThat(v.get(Feature.TRANSACTION_DENSITY)).isEqualTo(5.0);
            assertThat(v.get(Feature.PROFILE_INCOME_SIGNAL)).isZero();
            assertThat(v.get(Feature.PROFILE_RATING_SIGNAL)).isZero();
        }

        @Test
        @DisplayName("Liquidity buffer duplicates the savings ratio")
        void liquidityBufferDuplicatesSavingsRatio() {
            FeatureVector v = builder.build(salariedExample().toBuilder().monthlyIncome(3300).build());
            assertThat(v.get(Feature.LIQUIDITY_BUFFER)).isEqualTo(v.get(Feature.SAVINGS_RATIO));
        }

        @Test
        @DisplayName("Missed-payment proxy is the positive gap between average debit and credit")
        void missedPaymentProxy() {
            FeatureVector v = builder.build(BorrowerRecord.builder()
                    .avgDebitAmount(700).avgCreditAmount(450).build());
            assertThat(v.get(Feature.MISSED_PAYMENT_PROXY)).isEqualTo(250.0);
        }

        @Test
        @DisplayName("Small denominators are floored at 1.0")
        void denominatorFloor() {
            FeatureVector v = builder.build(BorrowerRecord.builder()
                    .monthlyIncome(0.25).savingsBalance(10)
                    .totalDebits(0.5).totalCredits(3)
                    .monthsActive(0.1).totalTransactions(7)
                    .build());
            assertThat(v.get(Feature.SAVINGS_RATIO)).isEqualTo(10.0);
            assertThat(v.get(Feature.CREDIT_DEBIT_RATIO)).isEqualTo(3.0);
            assertThat(v.get(Feature.TRANSACTION_DENSITY)).isEqualTo(7.0);
        }

        @Test
        @DisplayName("All-zero record never yields NaN or infinity")
        void zeroInputsStayFinite() {
            FeatureVector v = builder.build(BorrowerRecord.builder().build());
            for (int i = 0; i < v.size(); i++) {
                assertThat(Double.isFinite(v.get(i))).as(Feature.at(i).columnName()).isTrue();
            }
            assertThat(v.get(Feature.INCOME_STABILITY)).isEqualTo(1.0);
            assertThat(v.get(Feature.NET_CASHFLOW_RATIO)).isZero();
        }

        @Test
        @DisplayName("Student signals feed the profile income and rating signals")
        void studentSignals() {
            FeatureVector v = builder.build(BorrowerRecord.builder()
                    .profile(BorrowerProfile.STUDENT)
                    .gpa(3.7).attendanceRate(0.9)
                    .platformRating(4.0) // ignored for students
                    .build());
            assertThat(v.get(Feature.PROFILE_INCOME_SIGNAL)).isEqualTo(3.7);
            assertThat(v.get(Feature.PROFILE_RATING_SIGNAL)).isEqualTo(3.7 + 0.9);
            assertThat(v.get(Feature.PLATFORM_RATING)).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Gig, shopkeeper and rural proxies use their own signals")
        void otherProfileSignals() {
            FeatureVector gig = builder.build(BorrowerRecord.builder()
                    .profile(BorrowerProfile.GIG).platformRating(4.2).avgWeeklyHours(35).build());
            assertThat(gig.get(Feature.PROFILE_INCOME_SIGNAL)).isEqualTo(4.2);
            assertThat(gig.get(Feature.PROFILE_RATING_SIGNAL)).isEqualTo(4.2 + 35);

            FeatureVector shop = builder.build(BorrowerRecord.builder()
                    .profile(BorrowerProfile.SHOPKEEPER).avgDailyRevenue(320).businessYears(6).build());
            assertThat(shop.get(Feature.PROFILE_INCOME_SIGNAL)).isEqualTo(320.0);
            assertThat(shop.get(Feature.PROFILE_RATING_SIGNAL)).isZero();

            FeatureVector rural = builder.build(BorrowerRecord.builder()
                    .profile(BorrowerProfile.RURAL).subsidyAmount(1200).landSizeAcres(3).build());
            assertThat(rural.get(Feature.PROFILE_INCOME_SIGNAL)).isEqualTo(1200.0);
        }
    }

    @Nested
    @DisplayName("Profile one-hot flags")
    class Flags {

        @ParameterizedTest
        @EnumSource(BorrowerProfile.class)
        @DisplayName("At most one flag is set, and only for its own profile")
        void oneFlagPerProfile(BorrowerProfile profile) {
            FeatureVector v = builder.build(BorrowerRecord.builder().profile(profile).build());
            double sum = 0;
            for (Feature f : Feature.ofGroup(FeatureGroup.PROFILE_FLAGS)) {
                double expected = f == profile.flag() ? 1.0 : 0.0;
                assertThat(v.get(f)).as(f.columnName()).isEqualTo(expected);
                sum += v.get(f);
            }
            assertThat(sum).isEqualTo(profile == BorrowerProfile.SALARIED ? 0.0 : 1.0);
        }

        @Test
        @DisplayName("Legacy columns keep the flags they were given")
        void legacyFlags() {
            FeatureVector v = builder.build(FeatureColumns.builder()
                    .isGig(1.0).platformRating(4.5).avgWeeklyHours(20).build());
            assertThat(v.get(Feature.IS_GIG)).isEqualTo(1.0);
            assertThat(v.get(Feature.PROFILE_RATING_SIGNAL)).isEqualTo(24.5);
        }
    }

    @Nested
    @DisplayName("Guards")
    class Guards {

        @Test
        @DisplayName("Non-finite input is rejected as a validation error")
        void nonFiniteInput() {
            assertThatThrownBy(() -> builder.build(BorrowerRecord.builder().monthlyIncome(Double.NaN).build()))
                    .isInstanceOf(BorrowerValidationException.class)
                    .hasMessageContaining("f_monthly_income");
        }

        @Test
        @DisplayName("Missing provider group fails at construction")
        void missingGroup() {
            assertThatThrownBy(() -> new FeatureVectorBuilder(List.of(
                    new CoreFinancialFeaturesProvider(),
                    new TransactionFeaturesProvider(),
                    new ProfileSignalsFeaturesProvider(),
                    new ProfileFlagsFeaturesProvider())))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("ENGINEERED");
        }

        @Test
        @DisplayName("Duplicate provider group fails at construction")
        void duplicateGroup() {
            assertThatThrownBy(() -> new FeatureVectorBuilder(List.of(
                    new CoreFinancialFeaturesProvider(),
                    new CoreFinancialFeaturesProvider(),
                    new TransactionFeaturesProvider(),
                    new ProfileSignalsFeaturesProvider(),
                    new ProfileFlagsFeaturesProvider(),
                    new EngineeredFeaturesProvider())))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("CORE_FINANCIAL");
        }

        @Test
        @DisplayName("Provider that leaves a slot empty is a wiring error, not a zero")
        void incompleteProvider() {
            FeatureProvider partial = new FeatureProvider() {
                @Override public FeatureGroup group() { return FeatureGroup.PROFILE_FLAGS; }

                @Override
                public Map<Feature, Double> compute(FeatureColumns input) {
                    Map<Feature, Double> m = new EnumMap<>(Feature.class);
                    m.put(Feature.IS_STUDENT, 0.0);
                    return m;
                }
            };
            FeatureVectorBuilder broken = new FeatureVectorBuilder(List.of(
                    new CoreFinancialFeaturesProvider(),
                    new TransactionFeaturesProvider(),
                    new ProfileSignalsFeaturesProvider(),
                    partial,
                    new EngineeredFeaturesProvider()));

            assertThatThrownBy(() -> broken.build(BorrowerRecord.builder().build()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("IS_GIG");
        }
    }
}
