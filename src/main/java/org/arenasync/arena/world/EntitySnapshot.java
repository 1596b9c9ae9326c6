package org.arenasync.arena.world;

/**
 * Immutable state of one entity at one tick, as produced by the simulation.
 * <p>
 * Continuous fields are compared bit-for-bit ({@link Double#doubleToLongBits}) so that a
 * reconstructed state is byte-identical to the recorded one.
 *
 * @param entityId    Stable id while the entity is alive.
 * @param typeTag     Categorical entity type.
 * @param x           Position x.
 * @param y           Position y.
 * @param velocityX   Velocity x.
 * @param velocityY   Velocity y.
 * @param orientation Heading in radians.
 * @param health      Remaining health.
 * @param ownerId     Owning player's numeric handle, 0 when unowned.
 */
public record EntitySnapshot(
    long entityId,
    int typeTag,
    double x,
    double y,
    double velocityX,
    double velocityY,
    double orientation,
    double health,
    long ownerId
) {

    public double numeric(EntityField field) {
        return switch (field) {
            case POSITION_X -> x;
            case POSITION_Y -> y;
            case VELOCITY_X -> velocityX;
            case VELOCITY_Y -> velocityY;
            case ORIENTATION -> orientation;
            case HEALTH -> health;
            case TYPE -> typeTag;
            case OWNER -> ownerId;
        };
    }

    /**
     * Returns whether the given field holds exactly the same value in both snapshots.
     */
    public boolean sameField(EntitySnapshot other, EntityField field) {
        return switch (field) {
            case TYPE -> typeTag == other.typeTag;
            case OWNER -> ownerId == other.ownerId;
            default -> Double.doubleToLongBits(numeric(field)) == Double.doubleToLongBits(other.numeric(field));
        };
    }

    /**
     * Computes the mask of fields whose value differs from {@code baseline}.
     *
     * @param baseline The earlier state of the same entity.
     * @return Field bit mask, 0 if nothing changed.
     */
    public int diffMask(EntitySnapshot baseline) {
        int mask = 0;
        for (EntityField field : EntityField.values()) {
            if (!sameField(baseline, field)) {
                mask |= field.bit();
            }
        }
        return mask;
    }

    /**
     * Returns a copy of this snapshot with the masked fields taken from {@code source}.
     */
    public EntitySnapshot withFields(EntitySnapshot source, int mask) {
        if (mask == 0) {
            return this;
        }
        return new EntitySnapshot(
            entityId,
            EntityField.TYPE.isSetIn(mask) ? source.typeTag : typeTag,
            EntityField.POSITION_X.isSetIn(mask) ? source.x : x,
            EntityField.POSITION_Y.isSetIn(mask) ? source.y : y,
            EntityField.VELOCITY_X.isSetIn(mask) ? source.velocityX : velocityX,
            EntityField.VELOCITY_Y.isSetIn(mask) ? source.velocityY : velocityY,
            EntityField.ORIENTATION.isSetIn(mask) ? source.orientation : orientation,
            EntityField.HEALTH.isSetIn(mask) ? source.health : health,
            EntityField.OWNER.isSetIn(mask) ? source.ownerId : ownerId
        );
    }

    /**
     * Dead-band filter: every continuous field that moved less than {@code epsilon} away
     * from {@code previous} keeps the previous value. Categorical fields are untouched.
     *
     * @param previous The canonical state recorded for the previous tick.
     * @param epsilon  Jitter threshold, 0 disables the filter.
     * @return This snapshot, or a copy with jitter removed.
     */
    public EntitySnapshot absorbJitter(EntitySnapshot previous, double epsilon) {
        if (epsilon <= 0.0) {
            return this;
        }
        int keepMask = 0;
        for (EntityField field : EntityField.values()) {
            if (field.isContinuous() && !sameField(previous, field)
                    && Math.abs(numeric(field) - previous.numeric(field)) < epsilon) {
                keepMask |= field.bit();
            }
        }
        return withFields(previous, keepMask);
    }
}
