package org.arenasync.arena.protocol;

import org.arenasync.arena.chat.ChatScope;
import org.arenasync.arena.world.Region;

/**
 * Messages a client may send on its session channel.
 */
public sealed interface InboundMessage
    permits InboundMessage.Ack, InboundMessage.Input, InboundMessage.Chat, InboundMessage.Subscribe, InboundMessage.Leave {

    /**
     * The client has reconstructed the world state of {@code tick}.
     */
    record Ack(long tick) implements InboundMessage {
    }

    /**
     * Player input for the simulation.
     */
    record Input(long clientTick, double moveX, double moveY, double aim, boolean action) implements InboundMessage {
    }

    /**
     * Chat text; {@code target} is the whisper recipient's display name, empty otherwise.
     */
    record Chat(ChatScope scope, String target, String text) implements InboundMessage {
    }

    /**
     * Subscribes to (or moves) the area of interest. The first one activates the session.
     */
    record Subscribe(Region region) implements InboundMessage {
    }

    /**
     * Client-initiated disconnect.
     */
    record Leave() implements InboundMessage {
    }
}
