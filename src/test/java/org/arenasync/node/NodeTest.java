package org.arenasync.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.junit.extensions.logging.ExpectLog;
import org.arenasync.junit.extensions.logging.LogLevel;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.arenasync.node.spi.IProcess;
import org.arenasync.node.spi.IServiceProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Node: configuration parsing, dependency injection and process lifecycle.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class NodeTest {

    static final List<String> EVENTS = new CopyOnWriteArrayList<>();

    private Node node;

    @BeforeEach
    void setUp() {
        EVENTS.clear();
    }

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.stop();
            node = null;
        }
    }

    public static class ProviderProcess implements IProcess, IServiceProvider {
        private final String name;

        public ProviderProcess(final String name, final Map<String, Object> dependencies, final Config options) {
            this.name = name;
        }

        @Override
        public void start() {
            EVENTS.add("start " + name);
        }

        @Override
        public void stop() {
            EVENTS.add("stop " + name);
        }

        @Override
        public Object getExposedService() {
            return "service-of-" + name;
        }
    }

    public static class ConsumerProcess implements IProcess {
        private final String name;
        final Map<String, Object> dependencies;

        public ConsumerProcess(final String name, final Map<String, Object> dependencies, final Config options) {
            this.name = name;
            this.dependencies = dependencies;
        }

        @Override
        public void start() {
            EVENTS.add("start " + name);
        }

        @Override
        public void stop() {
            EVENTS.add("stop " + name);
        }
    }

    public static class FailingStartProcess implements IProcess {
        public FailingStartProcess(final String name, final Map<String, Object> dependencies, final Config options) {
        }

        @Override
        public void start() {
            throw new IllegalStateException("cannot start");
        }

        @Override
        public void stop() {
        }
    }

    @Test
    @DisplayName("Processes are instantiated dependencies first, regardless of declaration order")
    void constructor_ordersByDependencies() {
        node = new Node(ConfigFactory.parseString("""
            node.processes {
              web {
                className = "org.arenasync.node.NodeTest$ConsumerProcess"
                require { backend = "arena", self = "node" }
              }
              arena {
                className = "org.arenasync.node.NodeTest$ProviderProcess"
              }
            }
            """));

        assertThat(node.getProcessNames()).containsExactly("arena", "web");
        ConsumerProcess web = (ConsumerProcess) node.getProcess("web").orElseThrow();
        assertThat(web.dependencies).containsEntry("backend", "service-of-arena").containsEntry("self", node);
    }

    @Test
    @DisplayName("Start runs in dependency order and stop runs in reverse, only once")
    void startAndStop_followDependencyOrder() {
        node = new Node(ConfigFactory.parseString("""
            node.processes {
              web {
                className = "org.arenasync.node.NodeTest$ConsumerProcess"
                require { backend = "arena" }
              }
              arena {
                className = "org.arenasync.node.NodeTest$ProviderProcess"
              }
            }
            """));

        node.start();
        node.stop();
        node.stop();

        assertThat(EVENTS).containsExactly("start arena", "start web", "stop web", "stop arena");
        assertThat(node.isStopped()).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Node", messagePattern = "Failed to initialize process 'broken'.*")
    @DisplayName("A process with an unknown class is skipped")
    void constructor_skipsUnknownClass() {
        node = new Node(ConfigFactory.parseString("""
            node.processes {
              broken { className = "org.arenasync.DoesNotExist" }
              arena { className = "org.arenasync.node.NodeTest$ProviderProcess" }
            }
            """));

        assertThat(node.getProcessNames()).containsExactly("arena");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Node", messagePattern = "Failed to initialize the node\\.")
    @DisplayName("Circular dependencies fail node initialization")
    void constructor_rejectsCycles() {
        assertThatThrownBy(() -> new Node(ConfigFactory.parseString("""
            node.processes {
              a { className = "org.arenasync.node.NodeTest$ConsumerProcess", require { x = "b" } }
              b { className = "org.arenasync.node.NodeTest$ConsumerProcess", require { x = "a" } }
            }
            """)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Node initialization failed");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Node", messagePattern = "Failed to initialize the node\\.")
    @DisplayName("Requiring an undeclared process fails node initialization")
    void constructor_rejectsUndeclaredRequirement() {
        assertThatThrownBy(() -> new Node(ConfigFactory.parseString("""
            node.processes {
              web { className = "org.arenasync.node.NodeTest$ConsumerProcess", require { backend = "arena" } }
            }
            """)))
            .isInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("Process 'web' requires undeclared process 'arena'");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Node", messagePattern = "Failed to start process 'bad'.*")
    @DisplayName("A failing process start does not prevent the others from starting")
    void start_continuesAfterFailure() {
        node = new Node(ConfigFactory.parseString("""
            node.processes {
              bad { className = "org.arenasync.node.NodeTest$FailingStartProcess" }
              arena { className = "org.arenasync.node.NodeTest$ProviderProcess" }
            }
            """));

        node.start();

        assertThat(EVENTS).containsExactly("start arena");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Node", messagePattern = "Configuration path 'node.processes' not found.*")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Node", messagePattern = "No processes configured to start.*")
    @DisplayName("A node without processes starts idle")
    void start_withoutProcesses() {
        node = new Node(ConfigFactory.empty());
        node.start();

        assertThat(node.getProcessNames()).isEmpty();
    }
}
