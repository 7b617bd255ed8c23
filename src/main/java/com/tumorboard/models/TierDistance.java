package com.tumorboard.models;

/**
 * Ordinal gap between a predicted and an expected tier.
 *
 * Only the four ordered tiers are comparable. When either side is
 * {@link ActionabilityTier#UNKNOWN} the distance is incomparable and has no numeric value;
 * {@link #asLegacyValue()} exists for serialized output only.
 */
public final class TierDistance {

    public static final int INCOMPARABLE_SENTINEL = 999;

    private static final TierDistance INCOMPARABLE = new TierDistance(false, -1);

    private final boolean comparable;
    private final int value;

    private TierDistance(boolean comparable, int value) {
        this.comparable = comparable;
        this.value = value;
    }

    public static TierDistance between(ActionabilityTier expected, ActionabilityTier predicted) {
        if (expected == null || predicted == null || !expected.isOrdered() || !predicted.isOrdered()) {
            return INCOMPARABLE;
        }
        return new TierDistance(true, Math.abs(expected.getPosition() - predicted.getPosition()));
    }

    public boolean isComparable() {
        return comparable;
    }

    /**
     * @throws IllegalStateException when the distance is incomparable
     */
    public int getValue() {
        if (!comparable) {
            throw new IllegalStateException("Tier distance is not comparable");
        }
        return value;
    }

    public int asLegacyValue() {
        return comparable ? value : INCOMPARABLE_SENTINEL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TierDistance)) return false;
        TierDistance that = (TierDistance) o;
        return comparable == that.comparable && value == that.value;
    }

    @Override
    public int hashCode() {
        return comparable ? value : -1;
    }

    @Override
    public String toString() {
        return comparable ? String.valueOf(value) : "incomparable";
    }
}
