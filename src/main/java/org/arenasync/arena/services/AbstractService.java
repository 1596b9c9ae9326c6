package org.arenasync.arena.services;

import com.typesafe.config.Config;
import org.arenasync.arena.api.IMonitorable;
import org.arenasync.arena.api.IService;
import org.arenasync.arena.api.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for the arena's looping components. Each instance owns one named
 * thread that runs {@link #loop()} until {@link #stop()} interrupts it.
 * <p>
 * A loop that throws leaves the service in {@link State#ERROR}; transient
 * failures go through {@link #recordError(String, String, String)} instead and
 * show up on the health endpoint.
 */
public abstract class AbstractService implements IService, IMonitorable {

    private static final long JOIN_TIMEOUT_MS = 5000;
    private static final int MAX_ERRORS = 1000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private volatile Thread worker;

    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
    }

    @Override
    public final void start() {
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException("Service '" + serviceName + "' cannot start from state " + state.get());
        }
        Thread thread = new Thread(this::runLoop, serviceName);
        worker = thread;
        thread.start();
        log.info("{} '{}' started", getClass().getSimpleName(), serviceName);
    }

    @Override
    public final void stop() {
        if (state.get() != State.RUNNING) {
            throw new IllegalStateException("Service '" + serviceName + "' cannot stop from state " + state.get());
        }
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.error("{} '{}' did not stop within {} ms", getClass().getSimpleName(), serviceName, JOIN_TIMEOUT_MS);
                state.set(State.ERROR);
                return;
            }
        }
        state.compareAndSet(State.RUNNING, State.STOPPED);
        log.debug("{} '{}' stopped", getClass().getSimpleName(), serviceName);
    }

    @Override
    public State getCurrentState() {
        return state.get();
    }

    private void runLoop() {
        try {
            loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("{} '{}' failed: {}", getClass().getSimpleName(), serviceName, e.getMessage());
            log.debug("Failure details:", e);
            state.set(State.ERROR);
        } finally {
            state.compareAndSet(State.RUNNING, State.STOPPED);
        }
    }

    /**
     * Body of the service thread. Implementations return, or rethrow the
     * interruption, once {@link #isRunning()} turns false.
     *
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    protected abstract void loop() throws InterruptedException;

    protected boolean isRunning() {
        return state.get() == State.RUNNING && !Thread.currentThread().isInterrupted();
    }

    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > MAX_ERRORS) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return state.get() != State.ERROR && errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    protected void addCustomMetrics(Map<String, Number> metrics) {
    }
}
