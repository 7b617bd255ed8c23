package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * AMP/ASCO/CAP clinical actionability tiers.
 *
 * Tier I: strong clinical significance
 * Tier II: potential clinical significance
 * Tier III: unknown clinical significance
 * Tier IV: benign or likely benign
 */
public enum ActionabilityTier {
    TIER_I("Tier I", 0),
    TIER_II("Tier II", 1),
    TIER_III("Tier III", 2),
    TIER_IV("Tier IV", 3),
    UNKNOWN("Unknown", -1);

    /** Display order for reports. Unknown is deliberately left out. */
    public static final List<ActionabilityTier> REPORT_ORDER = List.of(TIER_I, TIER_II, TIER_III, TIER_IV);

    private final String label;
    private final int position;

    ActionabilityTier(String label, int position) {
        this.label = label;
        this.position = position;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isOrdered() {
        return position >= 0;
    }

    /**
     * Ordinal position, 0 for Tier I through 3 for Tier IV.
     */
    public int getPosition() {
        if (!isOrdered()) {
            throw new IllegalStateException(label + " has no ordinal position");
        }
        return position;
    }

    /**
     * Strict lookup used when loading curated data.
     */
    @JsonCreator
    public static ActionabilityTier fromLabel(String label) {
        ActionabilityTier tier = lookup(label);
        if (tier == null) {
            throw new IllegalArgumentException("Unknown actionability tier: " + label);
        }
        return tier;
    }

    /**
     * Lenient lookup used for model output: anything unrecognized maps to {@link #UNKNOWN}.
     */
    public static ActionabilityTier parseOrUnknown(String label) {
        ActionabilityTier tier = lookup(label);
        return tier != null ? tier : UNKNOWN;
    }

    /**
     * Returns true when the label names one of the tiers exactly (ignoring case and edge whitespace).
     */
    public static boolean isKnownLabel(String label) {
        return lookup(label) != null;
    }

    private static ActionabilityTier lookup(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (ActionabilityTier tier : values()) {
            if (tier.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return tier;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
