package org.arenasync.arena.chat;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.broadcast.Broadcaster;
import org.arenasync.arena.protocol.EncodedFrame;
import org.arenasync.arena.protocol.FrameCodec;
import org.arenasync.arena.resources.AbstractResource;
import org.arenasync.arena.utils.KeyedRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Gates chat through rate limiting and moderation, then routes it by scope.
 * <p>
 * Only the moderated text is ever encoded. Chat frames are critical: once accepted,
 * a message reaches every recipient in order or the recipient is drained as a slow
 * consumer. Accepted messages are written to the {@code org.arenasync.chat} log.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>maxLength</b>: longest accepted message in characters (default: 200)</li>
 *   <li><b>ratePeriodMs</b>: sustained interval between messages (default: 1000)</li>
 *   <li><b>burst</b>: messages allowed in a burst (default: 5)</li>
 * </ul>
 */
public class ChatService extends AbstractResource {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);
    private static final Logger chatLog = LoggerFactory.getLogger("org.arenasync.chat");

    private final IModerationFilter filter;
    private final Broadcaster broadcaster;
    private final LongSupplier currentTick;
    private final int maxLength;
    private final KeyedRateLimiter<SessionId> limiter;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong filtered = new AtomicLong();
    private final AtomicLong refused = new AtomicLong();

    public ChatService(String name, Config options, IModerationFilter filter, Broadcaster broadcaster, LongSupplier currentTick) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "maxLength", 200,
            "ratePeriodMs", 1000,
            "burst", 5
        ));
        Config config = options.withFallback(defaults);
        this.filter = filter;
        this.broadcaster = broadcaster;
        this.currentTick = currentTick;
        this.maxLength = config.getInt("maxLength");
        this.limiter = new KeyedRateLimiter<>(Duration.ofMillis(config.getLong("ratePeriodMs")), config.getInt("burst"));
    }

    /**
     * Moderates and routes one message.
     *
     * @param sender The sending participant.
     * @param scope  Delivery scope.
     * @param target Whisper recipient's display name; ignored for other scopes.
     * @param text   Raw text.
     * @param roster Every participant currently able to receive chat.
     * @return The outcome; anything but DELIVERED and DELIVERED_FILTERED means nothing was sent.
     */
    public ChatOutcome submit(ChatParticipant sender, ChatScope scope, String target, String text, Collection<ChatParticipant> roster) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return refuse(ChatOutcome.EMPTY);
        }
        if (trimmed.length() > maxLength) {
            return refuse(ChatOutcome.TOO_LONG);
        }
        if (limiter.shouldLimit(sender.sessionId())) {
            return refuse(ChatOutcome.RATE_LIMITED);
        }
        ModerationVerdict verdict = filter.moderate(trimmed);
        if (verdict.rejected()) {
            chatLog.info("rejected sender={} scope={} text=\"{}\"", sender.displayName(), scope, verdict.text());
            return refuse(ChatOutcome.REJECTED);
        }

        List<ChatParticipant> recipients = recipients(sender, scope, target, roster);
        if (recipients.isEmpty()) {
            return refuse(ChatOutcome.UNKNOWN_TARGET);
        }
        ChatMessage message = new ChatMessage(sender.sessionId(), sender.displayName(), text, verdict.text(), scope,
            scope == ChatScope.WHISPER ? target : null);
        EncodedFrame frame = FrameCodec.encodeChat(currentTick.getAsLong(), message);
        for (ChatParticipant recipient : recipients) {
            broadcaster.sendCritical(recipient.sessionId(), frame);
        }
        chatLog.info("sender={} scope={} recipients={} text=\"{}\"", sender.displayName(), scope, recipients.size(), verdict.text());
        delivered.incrementAndGet();
        if (verdict.altered()) {
            filtered.incrementAndGet();
            return ChatOutcome.DELIVERED_FILTERED;
        }
        return ChatOutcome.DELIVERED;
    }

    private List<ChatParticipant> recipients(ChatParticipant sender, ChatScope scope, String target, Collection<ChatParticipant> roster) {
        List<ChatParticipant> recipients = new ArrayList<>();
        switch (scope) {
            case BROADCAST -> recipients.addAll(roster);
            case TEAM -> {
                if (sender.teamId() == null) {
                    recipients.add(sender);
                } else {
                    for (ChatParticipant participant : roster) {
                        if (sender.teamId().equals(participant.teamId())) {
                            recipients.add(participant);
                        }
                    }
                }
            }
            case WHISPER -> {
                for (ChatParticipant participant : roster) {
                    if (!participant.sessionId().equals(sender.sessionId()) && participant.displayName().equalsIgnoreCase(target)) {
                        recipients.add(participant);
                        // Echo to the sender so both sides see the same line.
                        recipients.add(sender);
                        break;
                    }
                }
            }
        }
        return recipients;
    }

    private ChatOutcome refuse(ChatOutcome outcome) {
        refused.incrementAndGet();
        log.debug("Chat message refused: {}", outcome);
        return outcome;
    }

    /**
     * Sends an operator message to every session. Announcements skip the rate limit
     * but are moderated like player chat.
     *
     * @param alias Name shown as the sender.
     * @param text  Message text.
     * @return REJECTED if moderation refused the text, otherwise DELIVERED or DELIVERED_FILTERED.
     */
    public ChatOutcome announce(String alias, String text) {
        Objects.requireNonNull(text, "text");
        ModerationVerdict verdict = filter.moderate(text.strip());
        if (verdict.rejected()) {
            chatLog.info("rejected announcement alias={} text=\"{}\"", alias, verdict.text());
            return refuse(ChatOutcome.REJECTED);
        }
        ChatMessage message = new ChatMessage(null, alias, text, verdict.text(), ChatScope.BROADCAST, null);
        broadcaster.broadcastCritical(FrameCodec.encodeChat(currentTick.getAsLong(), message));
        chatLog.info("announcement alias={} text=\"{}\"", alias, verdict.text());
        delivered.incrementAndGet();
        if (verdict.altered()) {
            filtered.incrementAndGet();
            return ChatOutcome.DELIVERED_FILTERED;
        }
        return ChatOutcome.DELIVERED;
    }

    /**
     * Drops the rate limit state of a closed session.
     */
    public void forget(SessionId sessionId) {
        limiter.forget(sessionId);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("messages_delivered", delivered.get());
        metrics.put("messages_filtered", filtered.get());
        metrics.put("messages_refused", refused.get());
    }
}
