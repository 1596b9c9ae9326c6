package org.arenasync.arena.encoding;

import org.arenasync.arena.world.EntityField;
import org.arenasync.arena.world.EntitySnapshot;

/**
 * Field-level change of one entity between a baseline and a target tick.
 * Only the fields in {@code changedMask} are meaningful in {@code values}; the
 * others are not transmitted and must be ignored.
 *
 * @param entityId    The entity.
 * @param changedMask Bit mask of changed {@link EntityField}s, never 0.
 * @param values      Carrier of the new values of the masked fields.
 */
public record EntityUpdate(long entityId, int changedMask, EntitySnapshot values) {

    public EntityUpdate {
        if (changedMask == 0 || (changedMask & ~EntityField.ALL_MASK) != 0) {
            throw new IllegalArgumentException("Invalid field mask " + Integer.toBinaryString(changedMask) + " for entity " + entityId);
        }
        if (values.entityId() != entityId) {
            throw new IllegalArgumentException("Update values belong to entity " + values.entityId() + ", not " + entityId);
        }
    }

    public EntitySnapshot applyTo(EntitySnapshot baseline) {
        return baseline.withFields(values, changedMask);
    }

    public int changedFieldCount() {
        return Integer.bitCount(changedMask);
    }
}
