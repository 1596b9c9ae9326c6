package org.arenasync.arena.world;

/**
 * Circular area of interest a session subscribes to. Entities outside it are not
 * transmitted to that session.
 *
 * @param centerX Center x.
 * @param centerY Center y.
 * @param radius  Radius, {@link Double#POSITIVE_INFINITY} for the whole arena.
 */
public record Region(double centerX, double centerY, double radius) {

    public static final Region ALL = new Region(0.0, 0.0, Double.POSITIVE_INFINITY);

    public Region {
        if (Double.isNaN(radius) || radius < 0.0) {
            throw new IllegalArgumentException("Region radius must be non-negative, got " + radius);
        }
    }

    public boolean contains(EntitySnapshot entity) {
        if (Double.isInfinite(radius)) {
            return true;
        }
        double dx = entity.x() - centerX;
        double dy = entity.y() - centerY;
        return dx * dx + dy * dy <= radius * radius;
    }
}
