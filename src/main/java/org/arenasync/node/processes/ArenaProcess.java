package org.arenasync.node.processes;

import com.typesafe.config.Config;
import org.arenasync.arena.Arena;
import org.arenasync.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Hosts one {@link Arena} inside the node. The process options are the arena's configuration
 * block; the arena is exposed to dependent processes such as the HTTP server.
 */
public class ArenaProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArenaProcess.class);

    private final Arena arena;
    private volatile boolean started;

    public ArenaProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.arena = new Arena(options, Clock.systemUTC());
    }

    @Override
    public void start() {
        arena.start();
        started = true;
        LOGGER.info("Arena '{}' ticking", arena.region());
    }

    @Override
    public void stop() {
        if (!started) {
            return;
        }
        started = false;
        arena.stop();
    }

    @Override
    public Object getExposedService() {
        return arena;
    }
}
