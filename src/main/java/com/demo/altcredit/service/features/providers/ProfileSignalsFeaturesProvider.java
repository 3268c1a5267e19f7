package com.demo.altcredit.service.features.providers;

import com.demo.altcredit.service.features.Feature;
import com.demo.altcredit.service.features.FeatureColumns;
import com.demo.altcredit.service.features.FeatureGroup;
import com.demo.altcredit.service.features.FeatureProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/** Profile-specific raw signals, passed through as-is whatever the profile. */
@Component
public class ProfileSignalsFeaturesProvider implements FeatureProvider {

    @Override public FeatureGroup group() { return FeatureGroup.PROFILE_SIGNALS; }

    @Override
    public Map<Feature, Double> compute(FeatureColumns in) {
        Map<Feature, Double> f = new EnumMap<>(Feature.class);
        // student
        f.put(Feature.GPA, in.getGpa());
        f.put(Feature.ATTENDANCE_RATE, in.getAttendanceRate());
        // gig
        f.put(Feature.PLATFORM_RATING, in.getPlatformRating());
        f.put(Feature.AVG_WEEKLY_HOURS, in.getAvgWeeklyHours());
        // shopkeeper
        f.put(Feature.BUSINESS_YEARS, in.getBusinessYears());
        f.put(Feature.AVG_DAILY_REVENUE, in.getAvgDailyRevenue());
        // rural
        f.put(Feature.LAND_SIZE_ACRES, in.getLandSizeAcres());
        f.put(Feature.SUBSIDY_AMOUNT, in.getSubsidyAmount());
        f.put(Feature.SEASONALITY_INDEX, in.getSeasonalityIndex());
        return f;
    }
}
