package org.arenasync.arena.world;

/**
 * The fixed field set of an {@link EntitySnapshot}. The ordinal of each constant is its
 * bit position in a delta field mask, so the declaration order is part of the wire format.
 */
public enum EntityField {
    TYPE(false),
    POSITION_X(true),
    POSITION_Y(true),
    VELOCITY_X(true),
    VELOCITY_Y(true),
    ORIENTATION(true),
    HEALTH(true),
    OWNER(false);

    /**
     * Mask with every field bit set.
     */
    public static final int ALL_MASK = (1 << values().length) - 1;

    private final boolean continuous;

    EntityField(boolean continuous) {
        this.continuous = continuous;
    }

    /**
     * Continuous fields are doubles subject to jitter suppression; the others are
     * categorical and compared exactly.
     */
    public boolean isContinuous() {
        return continuous;
    }

    public int bit() {
        return 1 << ordinal();
    }

    public boolean isSetIn(int mask) {
        return (mask & bit()) != 0;
    }
}
