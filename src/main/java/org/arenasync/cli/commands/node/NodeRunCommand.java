package org.arenasync.cli.commands.node;

import com.typesafe.config.Config;
import org.arenasync.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the arena node and blocks until it is stopped."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Override
    public Integer call() {
        final Config config = parent.getParent().getConfig();
        LOGGER.info("Starting node in foreground...");

        final Node node = new Node(config);
        node.start();

        // Keep the main thread alive until the node is stopped (shutdown hook or HTTP stop).
        try {
            while (!node.isStopped()) {
                Thread.sleep(500);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
        }
        LOGGER.info("Node stopped.");
        return 0;
    }
}
