package org.arenasync.arena.protocol;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import org.arenasync.arena.chat.ChatMessage;
import org.arenasync.arena.chat.ChatScope;
import org.arenasync.arena.encoding.DeltaFrame;
import org.arenasync.arena.encoding.EntityUpdate;
import org.arenasync.arena.encoding.FullSnapshot;
import org.arenasync.arena.encoding.WorldFrame;
import org.arenasync.arena.leaderboard.LeaderboardEntry;
import org.arenasync.arena.leaderboard.LeaderboardSnapshot;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.world.EntityField;
import org.arenasync.arena.world.EntitySnapshot;
import org.arenasync.arena.world.Region;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary wire format of the session channel, built on protobuf's coded streams.
 * <p>
 * Outbound frame: {@code uint64 tick, uint32 kind, body}. Inbound message:
 * {@code uint32 kind, body}. Integers are varints (ids zig-zag encoded), doubles are
 * fixed64 so reconstructed values are bit-identical to the recorded ones.
 * <p>
 * Entity bodies list fields in {@link EntityField} order; a delta update writes its
 * field mask followed by the masked fields only.
 */
public final class FrameCodec {

    /**
     * Largest inbound message accepted from a client.
     */
    public static final int MAX_INBOUND_BYTES = 4096;

    private static final int IN_ACK = 0;
    private static final int IN_INPUT = 1;
    private static final int IN_CHAT = 2;
    private static final int IN_SUBSCRIBE = 3;
    private static final int IN_LEAVE = 4;

    private FrameCodec() {
    }

    /**
     * Header of a decoded outbound frame.
     */
    public record Header(long tick, FrameKind kind) {
    }

    /**
     * Decoded notice frame. {@code detail} carries the session id on {@link NoticeCode#SESSION_ACCEPTED}.
     */
    public record Notice(NoticeCode code, long detail, String message) {
    }

    /**
     * Decoded chat frame as seen by a recipient.
     */
    public record ChatLine(String senderName, ChatScope scope, String text) {
    }

    // ---------------------------------------------------------------- outbound

    public static EncodedFrame encodeWorld(WorldFrame frame) {
        if (frame instanceof FullSnapshot full) {
            return write(full.tick(), FrameKind.FULL_SNAPSHOT, out -> {
                out.writeUInt32NoTag(full.entities().size());
                for (EntitySnapshot entity : full.entities()) {
                    writeEntity(out, entity);
                }
            });
        }
        DeltaFrame delta = (DeltaFrame) frame;
        return write(delta.tick(), FrameKind.DELTA, out -> {
            out.writeUInt64NoTag(delta.baselineTick());
            out.writeUInt32NoTag(delta.added().size());
            for (EntitySnapshot entity : delta.added()) {
                writeEntity(out, entity);
            }
            out.writeUInt32NoTag(delta.updated().size());
            for (EntityUpdate update : delta.updated()) {
                out.writeSInt64NoTag(update.entityId());
                out.writeUInt32NoTag(update.changedMask());
                writeFields(out, update.values(), update.changedMask());
            }
            out.writeUInt32NoTag(delta.removed().size());
            for (Long id : delta.removed()) {
                out.writeSInt64NoTag(id);
            }
        });
    }

    public static EncodedFrame encodeLeaderboard(long tick, LeaderboardSnapshot snapshot, int limit) {
        List<LeaderboardEntry> entries = snapshot.top(limit);
        return write(tick, FrameKind.LEADERBOARD, out -> {
            out.writeUInt64NoTag(snapshot.version());
            out.writeUInt32NoTag(entries.size());
            for (LeaderboardEntry entry : entries) {
                out.writeUInt32NoTag(entry.rank());
                out.writeStringNoTag(entry.playerId().value());
                out.writeStringNoTag(entry.displayName());
                out.writeSInt64NoTag(entry.score());
            }
        });
    }

    /**
     * Encodes a moderated chat message. Only the filtered text goes on the wire.
     */
    public static EncodedFrame encodeChat(long tick, ChatMessage message) {
        return write(tick, FrameKind.CHAT, out -> {
            out.writeStringNoTag(message.senderName());
            out.writeUInt32NoTag(message.scope().ordinal());
            out.writeStringNoTag(message.filteredText());
        });
    }

    public static EncodedFrame encodeNotice(long tick, NoticeCode code, long detail, String message) {
        return write(tick, FrameKind.NOTICE, out -> {
            out.writeUInt32NoTag(code.code());
            out.writeUInt64NoTag(detail);
            out.writeStringNoTag(message == null ? "" : message);
        });
    }

    public static Header decodeHeader(byte[] payload) throws ProtocolException {
        return read(payload, in -> readHeader(in));
    }

    public static WorldFrame decodeWorld(byte[] payload) throws ProtocolException {
        return read(payload, in -> {
            Header header = readHeader(in);
            if (header.kind() == FrameKind.FULL_SNAPSHOT) {
                int count = readCount(in);
                List<EntitySnapshot> entities = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    entities.add(readEntity(in));
                }
                return new FullSnapshot(header.tick(), entities);
            }
            if (header.kind() != FrameKind.DELTA) {
                throw new ProtocolException("Not a world frame: " + header.kind());
            }
            long baselineTick = in.readUInt64();
            int addedCount = readCount(in);
            List<EntitySnapshot> added = new ArrayList<>(addedCount);
            for (int i = 0; i < addedCount; i++) {
                added.add(readEntity(in));
            }
            int updatedCount = readCount(in);
            List<EntityUpdate> updated = new ArrayList<>(updatedCount);
            for (int i = 0; i < updatedCount; i++) {
                long id = in.readSInt64();
                int mask = in.readUInt32();
                EntitySnapshot values = readFields(in, new EntitySnapshot(id, 0, 0, 0, 0, 0, 0, 0, 0), mask);
                updated.add(new EntityUpdate(id, mask, values));
            }
            int removedCount = readCount(in);
            List<Long> removed = new ArrayList<>(removedCount);
            for (int i = 0; i < removedCount; i++) {
                removed.add(in.readSInt64());
            }
            return new DeltaFrame(baselineTick, header.tick(), added, updated, removed);
        });
    }

    public static List<LeaderboardEntry> decodeLeaderboard(byte[] payload) throws ProtocolException {
        return read(payload, in -> {
            expectKind(readHeader(in), FrameKind.LEADERBOARD);
            in.readUInt64();
            int count = readCount(in);
            List<LeaderboardEntry> entries = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int rank = in.readUInt32();
                PlayerId playerId = new PlayerId(in.readString());
                String name = in.readString();
                entries.add(new LeaderboardEntry(playerId, name, in.readSInt64(), rank));
            }
            return entries;
        });
    }

    public static ChatLine decodeChat(byte[] payload) throws ProtocolException {
        return read(payload, in -> {
            expectKind(readHeader(in), FrameKind.CHAT);
            String sender = in.readString();
            ChatScope scope = ChatScope.fromCode(in.readUInt32());
            return new ChatLine(sender, scope, in.readString());
        });
    }

    public static Notice decodeNotice(byte[] payload) throws ProtocolException {
        return read(payload, in -> {
            expectKind(readHeader(in), FrameKind.NOTICE);
            NoticeCode code = NoticeCode.fromCode(in.readUInt32());
            long detail = in.readUInt64();
            return new Notice(code, detail, in.readString());
        });
    }

    // ---------------------------------------------------------------- inbound

    public static byte[] encodeInbound(InboundMessage message) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            if (message instanceof InboundMessage.Ack ack) {
                out.writeUInt32NoTag(IN_ACK);
                out.writeUInt64NoTag(ack.tick());
            } else if (message instanceof InboundMessage.Input input) {
                out.writeUInt32NoTag(IN_INPUT);
                out.writeUInt64NoTag(input.clientTick());
                out.writeDoubleNoTag(input.moveX());
                out.writeDoubleNoTag(input.moveY());
                out.writeDoubleNoTag(input.aim());
                out.writeBoolNoTag(input.action());
            } else if (message instanceof InboundMessage.Chat chat) {
                out.writeUInt32NoTag(IN_CHAT);
                out.writeUInt32NoTag(chat.scope().ordinal());
                out.writeStringNoTag(chat.target() == null ? "" : chat.target());
                out.writeStringNoTag(chat.text());
            } else if (message instanceof InboundMessage.Subscribe subscribe) {
                out.writeUInt32NoTag(IN_SUBSCRIBE);
                out.writeDoubleNoTag(subscribe.region().centerX());
                out.writeDoubleNoTag(subscribe.region().centerY());
                out.writeDoubleNoTag(subscribe.region().radius());
            } else {
                out.writeUInt32NoTag(IN_LEAVE);
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Parses a client message.
     *
     * @throws ProtocolException if the bytes are truncated, oversized, carry an unknown
     *                           kind, trailing bytes or out-of-range values.
     */
    public static InboundMessage decodeInbound(byte[] payload) throws ProtocolException {
        if (payload.length == 0) {
            throw new ProtocolException("Empty message");
        }
        if (payload.length > MAX_INBOUND_BYTES) {
            throw new ProtocolException("Message of " + payload.length + " bytes exceeds limit of " + MAX_INBOUND_BYTES);
        }
        return read(payload, in -> {
            int kind = in.readUInt32();
            InboundMessage message;
            switch (kind) {
                case IN_ACK -> message = new InboundMessage.Ack(in.readUInt64());
                case IN_INPUT -> {
                    long clientTick = in.readUInt64();
                    double moveX = finite(in.readDouble(), "moveX");
                    double moveY = finite(in.readDouble(), "moveY");
                    double aim = finite(in.readDouble(), "aim");
                    message = new InboundMessage.Input(clientTick, moveX, moveY, aim, in.readBool());
                }
                case IN_CHAT -> {
                    int scopeCode = in.readUInt32();
                    if (scopeCode >= ChatScope.values().length) {
                        throw new ProtocolException("Unknown chat scope " + scopeCode);
                    }
                    String target = in.readString();
                    message = new InboundMessage.Chat(ChatScope.fromCode(scopeCode), target, in.readString());
                }
                case IN_SUBSCRIBE -> {
                    double cx = finite(in.readDouble(), "centerX");
                    double cy = finite(in.readDouble(), "centerY");
                    double radius = in.readDouble();
                    if (Double.isNaN(radius) || radius < 0.0) {
                        throw new ProtocolException("Invalid region radius " + radius);
                    }
                    message = new InboundMessage.Subscribe(new Region(cx, cy, radius));
                }
                case IN_LEAVE -> message = new InboundMessage.Leave();
                default -> throw new ProtocolException("Unknown inbound message kind " + kind);
            }
            if (!in.isAtEnd()) {
                throw new ProtocolException("Trailing bytes after " + message.getClass().getSimpleName());
            }
            return message;
        });
    }

    // ---------------------------------------------------------------- helpers

    @FunctionalInterface
    private interface BodyWriter {
        void write(CodedOutputStream out) throws IOException;
    }

    @FunctionalInterface
    private interface BodyReader<T> {
        T read(CodedInputStream in) throws IOException, ProtocolException;
    }

    private static EncodedFrame write(long tick, FrameKind kind, BodyWriter body) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(256);
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            out.writeUInt64NoTag(tick);
            out.writeUInt32NoTag(kind.code());
            body.write(out);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode " + kind + " frame for tick " + tick, e);
        }
        return new EncodedFrame(tick, kind, bytes.toByteArray());
    }

    private static <T> T read(byte[] payload, BodyReader<T> body) throws ProtocolException {
        CodedInputStream in = CodedInputStream.newInstance(payload);
        try {
            return body.read(in);
        } catch (IOException e) {
            throw new ProtocolException("Malformed message: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid value: " + e.getMessage(), e);
        }
    }

    private static Header readHeader(CodedInputStream in) throws IOException {
        long tick = in.readUInt64();
        return new Header(tick, FrameKind.fromCode(in.readUInt32()));
    }

    private static void expectKind(Header header, FrameKind expected) throws ProtocolException {
        if (header.kind() != expected) {
            throw new ProtocolException("Expected " + expected + " frame but got " + header.kind());
        }
    }

    private static int readCount(CodedInputStream in) throws IOException, ProtocolException {
        int count = in.readUInt32();
        if (count < 0 || count > 1_000_000) {
            throw new ProtocolException("Implausible element count " + count);
        }
        return count;
    }

    private static double finite(double value, String field) throws ProtocolException {
        if (!Double.isFinite(value)) {
            throw new ProtocolException("Non-finite " + field);
        }
        return value;
    }

    private static void writeEntity(CodedOutputStream out, EntitySnapshot entity) throws IOException {
        out.writeSInt64NoTag(entity.entityId());
        writeFields(out, entity, EntityField.ALL_MASK);
    }

    private static EntitySnapshot readEntity(CodedInputStream in) throws IOException {
        long id = in.readSInt64();
        return readFields(in, new EntitySnapshot(id, 0, 0, 0, 0, 0, 0, 0, 0), EntityField.ALL_MASK);
    }

    private static void writeFields(CodedOutputStream out, EntitySnapshot entity, int mask) throws IOException {
        for (EntityField field : EntityField.values()) {
            if (!field.isSetIn(mask)) {
                continue;
            }
            switch (field) {
                case TYPE -> out.writeSInt32NoTag(entity.typeTag());
                case OWNER -> out.writeSInt64NoTag(entity.ownerId());
                default -> out.writeDoubleNoTag(entity.numeric(field));
            }
        }
    }

    private static EntitySnapshot readFields(CodedInputStream in, EntitySnapshot base, int mask) throws IOException {
        int typeTag = base.typeTag();
        double[] numeric = new double[EntityField.values().length];
        long ownerId = base.ownerId();
        for (EntityField field : EntityField.values()) {
            if (!field.isSetIn(mask)) {
                numeric[field.ordinal()] = base.numeric(field);
                continue;
            }
            switch (field) {
                case TYPE -> typeTag = in.readSInt32();
                case OWNER -> ownerId = in.readSInt64();
                default -> numeric[field.ordinal()] = in.readDouble();
            }
        }
        return new EntitySnapshot(
            base.entityId(),
            typeTag,
            numeric[EntityField.POSITION_X.ordinal()],
            numeric[EntityField.POSITION_Y.ordinal()],
            numeric[EntityField.VELOCITY_X.ordinal()],
            numeric[EntityField.VELOCITY_Y.ordinal()],
            numeric[EntityField.ORIENTATION.ordinal()],
            numeric[EntityField.HEALTH.ordinal()],
            ownerId
        );
    }
}
