package com.demo.altcredit.service.features;

import com.demo.altcredit.service.BorrowerValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public enum BorrowerProfile {
    SALARIED("salaried"),
    STUDENT("student"),
    GIG("gig"),
    SHOPKEEPER("shopkeeper"),
    RURAL("rural");

    private static final List<String> TAGS = Arrays.stream(values())
            .map(BorrowerProfile::tag)
            .collect(Collectors.toUnmodifiableList());

    private final String tag;

    BorrowerProfile(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /** One-hot slot for this profile; salaried borrowers have none. */
    public Feature flag() {
        return switch (this) {
            case STUDENT -> Feature.IS_STUDENT;
            case GIG -> Feature.IS_GIG;
            case SHOPKEEPER -> Feature.IS_SHOPKEEPER;
            case RURAL -> Feature.IS_RURAL;
            case SALARIED -> null;
        };
    }

    public static List<String> tags() {
        return TAGS;
    }

    /** Parses a tag case-insensitively after trimming. */
    public static BorrowerProfile fromTag(String raw) {
        String tag = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (BorrowerProfile p : values()) {
            if (p.tag.equals(tag)) return p;
        }
        throw new BorrowerValidationException(
                "profile_type must be one of " + TAGS + ". Got: '" + tag + "'");
    }
}
