package org.arenasync.arena.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.broadcast.Broadcaster;
import org.arenasync.arena.leaderboard.LeaderboardService;
import org.arenasync.arena.services.AbstractService;
import org.arenasync.arena.session.ConnectionManager;
import org.arenasync.arena.world.IWorldSimulation;
import org.arenasync.arena.world.TickInput;
import org.arenasync.arena.world.TickResult;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single authoritative tick loop.
 * <p>
 * Every tick: collect inputs and join/leave events, step the simulation, publish world
 * frames, forward scores, commit the leaderboard batch and sweep sessions. The loop
 * never blocks on I/O; a failing tick is logged, recorded and skipped, and the loop
 * carries on with the next one.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>tickRateHz</b>: ticks per second (default: 20)</li>
 * </ul>
 */
public class TickDriver extends AbstractService {

    private final IWorldSimulation simulation;
    private final ConnectionManager connections;
    private final Broadcaster broadcaster;
    private final LeaderboardService leaderboard;
    private final TickCounter ticks;
    private final Clock clock;
    private final long periodNanos;

    private final AtomicLong ticksRun = new AtomicLong();
    private final AtomicLong tickFailures = new AtomicLong();
    private final AtomicLong overruns = new AtomicLong();
    private volatile long lastTickMicros;

    public TickDriver(String name, Config options, IWorldSimulation simulation, ConnectionManager connections,
                      Broadcaster broadcaster, LeaderboardService leaderboard, TickCounter ticks, Clock clock) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of("tickRateHz", 20));
        Config config = options.withFallback(defaults);
        int tickRateHz = config.getInt("tickRateHz");
        if (tickRateHz <= 0 || tickRateHz > 1000) {
            throw new IllegalArgumentException("tickRateHz must be between 1 and 1000 for service '" + name + "'.");
        }
        this.simulation = simulation;
        this.connections = connections;
        this.broadcaster = broadcaster;
        this.leaderboard = leaderboard;
        this.ticks = ticks;
        this.clock = clock;
        this.periodNanos = TimeUnit.SECONDS.toNanos(1) / tickRateHz;
    }

    @Override
    protected void loop() throws InterruptedException {
        long deadline = System.nanoTime();
        while (isRunning()) {
            runTick();
            deadline += periodNanos;
            long wait = deadline - System.nanoTime();
            if (wait > 0) {
                TimeUnit.NANOSECONDS.sleep(wait);
            } else {
                overruns.incrementAndGet();
                if (-wait > periodNanos) {
                    // Skip the backlog instead of bursting to catch up.
                    deadline = System.nanoTime();
                }
            }
        }
    }

    /**
     * Runs one tick.
     *
     * @return The tick number.
     */
    public long runTick() {
        long started = System.nanoTime();
        long tick = ticks.advance();
        try {
            TickInput input = connections.drainTickInput(tick);
            TickResult result = simulation.step(input);
            broadcaster.publish(tick, result.entities());
            connections.updateScores(result.scores());
            leaderboard.commitTick(tick);
        } catch (RuntimeException e) {
            tickFailures.incrementAndGet();
            log.warn("Tick {} failed: {}", tick, e.getMessage());
            log.debug("Tick failure details:", e);
            recordError("TICK_FAILED", "Tick failed", "tick=" + tick + ", " + e.getClass().getSimpleName());
        }
        try {
            connections.sweep(clock.instant());
        } catch (RuntimeException e) {
            log.warn("Session sweep at tick {} failed: {}", tick, e.getMessage());
            log.debug("Sweep failure details:", e);
            recordError("SWEEP_FAILED", "Session sweep failed", "tick=" + tick);
        }
        ticksRun.incrementAndGet();
        lastTickMicros = TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - started);
        return tick;
    }

    public long currentTick() {
        return ticks.getAsLong();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("current_tick", ticks.getAsLong());
        metrics.put("ticks", ticksRun.get());
        metrics.put("tick_failures", tickFailures.get());
        metrics.put("overruns", overruns.get());
        metrics.put("last_tick_micros", lastTickMicros);
    }
}
