package org.arenasync.arena.protocol;

import com.google.protobuf.CodedOutputStream;
import org.arenasync.arena.chat.ChatMessage;
import org.arenasync.arena.chat.ChatScope;
import org.arenasync.arena.encoding.DeltaFrame;
import org.arenasync.arena.encoding.EntityUpdate;
import org.arenasync.arena.encoding.FullSnapshot;
import org.arenasync.arena.encoding.WorldFrame;
import org.arenasync.arena.world.EntityField;
import org.arenasync.arena.world.EntitySnapshot;
import org.arenasync.arena.world.Region;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FrameCodecTest {

    private static final EntitySnapshot SHIP = new EntitySnapshot(-7, 1, 0.1 + 0.2, -3.5, 1e-9, Double.MAX_VALUE, Math.PI, 99.5, 42);

    @Test
    @DisplayName("Full snapshots carry bit-identical doubles and negative ids")
    void fullSnapshot_isBitExact() throws Exception {
        EncodedFrame encoded = FrameCodec.encodeWorld(new FullSnapshot(17, List.of(SHIP)));

        assertEquals(FrameKind.FULL_SNAPSHOT, encoded.kind());
        assertThat(encoded.isCritical()).isFalse();
        WorldFrame decoded = FrameCodec.decodeWorld(encoded.payload());
        assertThat(decoded).isEqualTo(new FullSnapshot(17, List.of(SHIP)));
    }

    @Test
    @DisplayName("Delta updates transmit only the masked fields")
    void deltaUpdate_writesMaskedFieldsOnly() throws Exception {
        int mask = EntityField.POSITION_X.bit() | EntityField.HEALTH.bit();
        DeltaFrame delta = new DeltaFrame(16, 17, List.of(), List.of(new EntityUpdate(SHIP.entityId(), mask, SHIP)), List.of(5L));
        DeltaFrame full = new DeltaFrame(16, 17, List.of(), List.of(new EntityUpdate(SHIP.entityId(), EntityField.ALL_MASK, SHIP)), List.of(5L));

        EncodedFrame encoded = FrameCodec.encodeWorld(delta);
        DeltaFrame decoded = (DeltaFrame) FrameCodec.decodeWorld(encoded.payload());

        assertThat(encoded.size()).isLessThan(FrameCodec.encodeWorld(full).size());
        assertThat(decoded.baselineTick()).isEqualTo(16);
        assertThat(decoded.removed()).containsExactly(5L);
        EntityUpdate update = decoded.updated().get(0);
        assertThat(update.changedMask()).isEqualTo(mask);
        assertThat(update.values().x()).isEqualTo(SHIP.x());
        assertThat(update.values().health()).isEqualTo(SHIP.health());
    }

    @Test
    @DisplayName("Chat frames carry the filtered text only")
    void chat_carriesFilteredText() throws Exception {
        ChatMessage message = new ChatMessage(null, "ana", "raw badword", "raw *******", ChatScope.TEAM, null);

        FrameCodec.ChatLine line = FrameCodec.decodeChat(FrameCodec.encodeChat(3, message).payload());

        assertThat(line).isEqualTo(new FrameCodec.ChatLine("ana", ChatScope.TEAM, "raw *******"));
        assertThat(FrameCodec.encodeChat(3, message).isCritical()).isTrue();
    }

    @Test
    @DisplayName("Notice frames decode code, detail and message")
    void notice_decodes() throws Exception {
        EncodedFrame frame = FrameCodec.encodeNotice(9, NoticeCode.SESSION_ACCEPTED, 12, null);

        FrameCodec.Notice notice = FrameCodec.decodeNotice(frame.payload());

        assertThat(notice).isEqualTo(new FrameCodec.Notice(NoticeCode.SESSION_ACCEPTED, 12, ""));
        assertThat(FrameCodec.decodeHeader(frame.payload())).isEqualTo(new FrameCodec.Header(9, FrameKind.NOTICE));
    }

    @Test
    @DisplayName("Reading a frame as the wrong kind fails")
    void wrongKind_isRejected() {
        byte[] notice = FrameCodec.encodeNotice(1, NoticeCode.CLOSING, 0, "bye").payload();

        assertThatThrownBy(() -> FrameCodec.decodeChat(notice)).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> FrameCodec.decodeWorld(notice)).isInstanceOf(ProtocolException.class);
    }

    @Test
    @DisplayName("Inbound messages survive encoding")
    void inbound_decodesWhatClientsSend() throws Exception {
        List<InboundMessage> messages = List.of(
            new InboundMessage.Ack(41),
            new InboundMessage.Input(40, 0.5, -1.0, 1.25, true),
            new InboundMessage.Chat(ChatScope.WHISPER, "bob", "hi"),
            new InboundMessage.Subscribe(new Region(10, 20, 30)),
            new InboundMessage.Leave()
        );
        for (InboundMessage message : messages) {
            assertThat(FrameCodec.decodeInbound(FrameCodec.encodeInbound(message))).isEqualTo(message);
        }
    }

    @Test
    @DisplayName("Malformed inbound messages are rejected")
    void malformedInbound_isRejected() throws IOException {
        byte[] ack = FrameCodec.encodeInbound(new InboundMessage.Ack(5));

        assertThatThrownBy(() -> FrameCodec.decodeInbound(new byte[0])).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> FrameCodec.decodeInbound(new byte[FrameCodec.MAX_INBOUND_BYTES + 1]))
            .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> FrameCodec.decodeInbound(Arrays.copyOf(ack, ack.length + 1)))
            .hasMessageContaining("Trailing");
        assertThatThrownBy(() -> FrameCodec.decodeInbound(new byte[] {99}))
            .hasMessageContaining("Unknown inbound message kind");
        assertThatThrownBy(() -> FrameCodec.decodeInbound(new byte[] {1, 3}))
            .isInstanceOf(ProtocolException.class);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        out.writeUInt32NoTag(3);
        out.writeDoubleNoTag(Double.NaN);
        out.writeDoubleNoTag(0.0);
        out.writeDoubleNoTag(1.0);
        out.flush();
        assertThatThrownBy(() -> FrameCodec.decodeInbound(bytes.toByteArray())).hasMessageContaining("Non-finite");
    }
}
