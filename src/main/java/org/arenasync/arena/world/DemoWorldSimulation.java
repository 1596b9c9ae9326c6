package org.arenasync.arena.world;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Minimal stand-in simulation so a node can run without a gameplay module: every
 * joined player steers a ship, and flying over a pickup scores points and respawns
 * the pickup elsewhere.
 * <p>
 * Configuration options:
 * <ul>
 *   <li><b>arenaRadius</b>: world radius (default: 500)</li>
 *   <li><b>pickups</b>: number of pickups (default: 24)</li>
 *   <li><b>shipSpeed</b>: distance per tick at full input (default: 4)</li>
 *   <li><b>pickupRadius</b>: collection distance (default: 12)</li>
 *   <li><b>pickupScore</b>: score per pickup (default: 10)</li>
 *   <li><b>seed</b>: random seed (default: 42)</li>
 * </ul>
 */
public class DemoWorldSimulation implements IWorldSimulation {

    private static final Logger log = LoggerFactory.getLogger(DemoWorldSimulation.class);

    public static final int TYPE_SHIP = 1;
    public static final int TYPE_PICKUP = 2;

    private static final long PICKUP_ID_BASE = 1L << 40;

    private final double arenaRadius;
    private final double shipSpeed;
    private final double pickupRadius;
    private final long pickupScore;
    private final Random random;

    private final Map<SessionId, Ship> ships = new LinkedHashMap<>();
    private final List<EntitySnapshot> pickups = new ArrayList<>();

    private static final class Ship {
        final long entityId;
        double x;
        double y;
        double vx;
        double vy;
        double orientation;
        long score;

        Ship(long entityId, double x, double y) {
            this.entityId = entityId;
            this.x = x;
            this.y = y;
        }
    }

    public DemoWorldSimulation(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "arenaRadius", 500.0,
            "pickups", 24,
            "shipSpeed", 4.0,
            "pickupRadius", 12.0,
            "pickupScore", 10,
            "seed", 42
        ));
        Config config = options.withFallback(defaults);
        this.arenaRadius = config.getDouble("arenaRadius");
        this.shipSpeed = config.getDouble("shipSpeed");
        this.pickupRadius = config.getDouble("pickupRadius");
        this.pickupScore = config.getLong("pickupScore");
        this.random = new Random(config.getLong("seed"));

        int pickupCount = config.getInt("pickups");
        for (int i = 0; i < pickupCount; i++) {
            pickups.add(spawnPickup(PICKUP_ID_BASE + i));
        }
        log.debug("Demo world created: radius={}, pickups={}", arenaRadius, pickupCount);
    }

    @Override
    public TickResult step(TickInput input) {
        for (PlayerEvent event : input.events()) {
            if (event.kind() == PlayerEvent.Kind.JOINED) {
                double[] position = randomPosition();
                ships.put(event.sessionId(), new Ship(event.sessionId().value(), position[0], position[1]));
            } else {
                ships.remove(event.sessionId());
            }
        }

        for (InputCommand command : input.inputs()) {
            Ship ship = ships.get(command.sessionId());
            if (ship == null) {
                continue;
            }
            ship.vx = clamp(command.moveX()) * shipSpeed;
            ship.vy = clamp(command.moveY()) * shipSpeed;
            ship.orientation = command.aim();
        }

        Map<SessionId, Long> scores = new HashMap<>();
        List<EntitySnapshot> entities = new ArrayList<>(ships.size() + pickups.size());
        for (Map.Entry<SessionId, Ship> entry : ships.entrySet()) {
            Ship ship = entry.getValue();
            ship.x += ship.vx;
            ship.y += ship.vy;
            double distance = Math.hypot(ship.x, ship.y);
            if (distance > arenaRadius) {
                ship.x = ship.x / distance * arenaRadius;
                ship.y = ship.y / distance * arenaRadius;
            }
            for (int i = 0; i < pickups.size(); i++) {
                EntitySnapshot pickup = pickups.get(i);
                if (Math.hypot(pickup.x() - ship.x, pickup.y() - ship.y) <= pickupRadius) {
                    ship.score += pickupScore;
                    scores.put(entry.getKey(), ship.score);
                    pickups.set(i, spawnPickup(pickup.entityId()));
                }
            }
            entities.add(new EntitySnapshot(ship.entityId, TYPE_SHIP, ship.x, ship.y, ship.vx, ship.vy,
                ship.orientation, 100.0, ship.entityId));
        }
        entities.addAll(pickups);
        return new TickResult(entities, scores);
    }

    private EntitySnapshot spawnPickup(long entityId) {
        double[] position = randomPosition();
        return new EntitySnapshot(entityId, TYPE_PICKUP, position[0], position[1], 0.0, 0.0, 0.0, 1.0, 0L);
    }

    private double[] randomPosition() {
        double angle = random.nextDouble() * Math.PI * 2.0;
        double distance = Math.sqrt(random.nextDouble()) * arenaRadius;
        return new double[]{Math.cos(angle) * distance, Math.sin(angle) * distance};
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
