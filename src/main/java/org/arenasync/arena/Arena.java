package org.arenasync.arena;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.IMonitorable;
import org.arenasync.arena.api.IService;
import org.arenasync.arena.broadcast.Broadcaster;
import org.arenasync.arena.chat.ChatService;
import org.arenasync.arena.chat.WordListModerationFilter;
import org.arenasync.arena.encoding.SnapshotEncoder;
import org.arenasync.arena.engine.TickCounter;
import org.arenasync.arena.engine.TickDriver;
import org.arenasync.arena.leaderboard.LeaderboardPublisher;
import org.arenasync.arena.leaderboard.LeaderboardService;
import org.arenasync.arena.persistence.IPlayerStore;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.arena.resources.ComponentFactory;
import org.arenasync.arena.session.ConnectionManager;
import org.arenasync.arena.session.HmacTokenVerifier;
import org.arenasync.arena.session.IBotClassifier;
import org.arenasync.arena.session.ITokenVerifier;
import org.arenasync.arena.session.IpRateLimiter;
import org.arenasync.arena.session.UserAgentBotClassifier;
import org.arenasync.arena.world.IWorldSimulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One arena region: the tick loop and everything it drives, wired from a single
 * {@code arena} configuration block.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>region</b>: region identifier, used in logs (default: "default")</li>
 *   <li><b>simulation</b>: {@code className}/{@code options} of the {@link IWorldSimulation}</li>
 *   <li><b>persistence.store</b>: {@code className}/{@code options} of the {@link IPlayerStore}</li>
 *   <li><b>persistence.shutdownGraceMs</b>: time allowed for the final write flush (default: 5000)</li>
 *   <li><b>tick, encoder, broadcast, sessions, rateLimit, botClassifier, auth, chat,
 *       leaderboard, persistence</b>: option blocks of the individual components</li>
 * </ul>
 */
public class Arena {

    private static final Logger LOGGER = LoggerFactory.getLogger(Arena.class);

    private final String region;
    private final Clock clock;
    private final Duration shutdownGrace;
    private final TickCounter ticks = new TickCounter();
    private final IPlayerStore store;
    private final PersistenceGateway gateway;
    private final SnapshotEncoder encoder;
    private final Broadcaster broadcaster;
    private final LeaderboardService leaderboard;
    private final ChatService chat;
    private final ConnectionManager connections;
    private final TickDriver tickDriver;
    private final LeaderboardPublisher publisher;
    private final ITokenVerifier tokenVerifier;

    /**
     * Creates an arena whose simulation and player store are instantiated from configuration.
     *
     * @param config The {@code arena} configuration block.
     * @param clock  The wall clock.
     */
    public Arena(final Config config, final Clock clock) {
        this(config, clock,
            ComponentFactory.create("simulation", IWorldSimulation.class, config.getConfig("simulation")),
            ComponentFactory.create("player-store", IPlayerStore.class, config.getConfig("persistence.store")));
    }

    /**
     * Creates an arena around an explicitly provided simulation and store.
     *
     * @param config     The {@code arena} configuration block.
     * @param clock      The wall clock.
     * @param simulation The gameplay simulation.
     * @param store      The durable player store.
     */
    public Arena(final Config config, final Clock clock, final IWorldSimulation simulation, final IPlayerStore store) {
        this.region = config.hasPath("region") ? config.getString("region") : "default";
        this.clock = clock;
        this.store = store;
        this.shutdownGrace = Duration.ofMillis(config.hasPath("persistence.shutdownGraceMs")
            ? config.getLong("persistence.shutdownGraceMs") : 5000L);

        this.gateway = new PersistenceGateway("persistence", block(config, "persistence"), store, clock);
        this.encoder = new SnapshotEncoder("encoder", block(config, "encoder"));
        this.broadcaster = new Broadcaster("broadcaster", block(config, "broadcast"), encoder);
        this.leaderboard = new LeaderboardService("leaderboard", block(config, "leaderboard"), clock);
        this.chat = new ChatService("chat", block(config, "chat"),
            new WordListModerationFilter(block(config, "chat.moderation")), broadcaster, ticks);
        this.tokenVerifier = new HmacTokenVerifier(block(config, "auth"), clock);
        IBotClassifier botClassifier = new UserAgentBotClassifier(block(config, "botClassifier"));
        IpRateLimiter rateLimiter = new IpRateLimiter(block(config, "rateLimit"));
        this.connections = new ConnectionManager("connections", block(config, "sessions"), tokenVerifier, botClassifier,
            rateLimiter, gateway, broadcaster, encoder, chat, leaderboard, clock, ticks);
        this.tickDriver = new TickDriver("arena-" + region + "-tick", block(config, "tick"), simulation, connections,
            broadcaster, leaderboard, ticks, clock);
        this.publisher = new LeaderboardPublisher("arena-" + region + "-leaderboard", block(config, "leaderboard"),
            leaderboard, broadcaster, gateway, ticks, clock);
    }

    private static Config block(final Config config, final String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    /**
     * Starts the tick loop and the leaderboard publisher.
     */
    public void start() {
        tickDriver.start();
        publisher.start();
        LOGGER.info("Arena '{}' started", region);
    }

    /**
     * Stops the arena: ticking ends, every session is closed with a shutdown notice,
     * and the persistence gateway gets a bounded final flush.
     */
    public void stop() {
        LOGGER.info("Stopping arena '{}'...", region);
        stopService(publisher);
        stopService(tickDriver);
        connections.closeAll();
        broadcaster.shutdown();
        gateway.shutdown(shutdownGrace);
        LOGGER.info("Arena '{}' stopped at tick {}", region, ticks.getAsLong());
    }

    private void stopService(final IService service) {
        if (service.getCurrentState() == IService.State.RUNNING) {
            service.stop();
        }
    }

    /**
     * Returns the monitorable components by name, in a stable order.
     */
    public Map<String, IMonitorable> components() {
        Map<String, IMonitorable> components = new LinkedHashMap<>();
        components.put("tick", tickDriver);
        components.put("encoder", encoder);
        components.put("broadcaster", broadcaster);
        components.put("connections", connections);
        components.put("chat", chat);
        components.put("leaderboard", leaderboard);
        components.put("leaderboard-publisher", publisher);
        components.put("persistence", gateway);
        if (store instanceof IMonitorable monitorable) {
            components.put("store", monitorable);
        }
        return components;
    }

    public String region() {
        return region;
    }

    public Clock clock() {
        return clock;
    }

    public long currentTick() {
        return ticks.getAsLong();
    }

    public ConnectionManager connections() {
        return connections;
    }

    public Broadcaster broadcaster() {
        return broadcaster;
    }

    public SnapshotEncoder encoder() {
        return encoder;
    }

    public LeaderboardService leaderboard() {
        return leaderboard;
    }

    public LeaderboardPublisher publisher() {
        return publisher;
    }

    public ChatService chat() {
        return chat;
    }

    public PersistenceGateway persistence() {
        return gateway;
    }

    public TickDriver tickDriver() {
        return tickDriver;
    }

    public ITokenVerifier tokenVerifier() {
        return tokenVerifier;
    }
}
