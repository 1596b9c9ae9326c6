package org.arenasync.node.processes.http.api.arena;

import io.javalin.websocket.WsContext;
import org.arenasync.arena.broadcast.IFrameSink;
import org.arenasync.arena.protocol.EncodedFrame;
import org.eclipse.jetty.websocket.api.WriteCallback;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;

/**
 * Binds a session's outbound channel to its WebSocket. Frames are sent as binary
 * messages with Jetty's asynchronous write; the broadcaster never has two writes in
 * flight on one session.
 */
class WebSocketFrameSink implements IFrameSink {

    private final WsContext ctx;

    WebSocketFrameSink(final WsContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public CompletableFuture<Void> send(final EncodedFrame frame) {
        if (!ctx.session.isOpen()) {
            return CompletableFuture.failedFuture(new IOException("WebSocket already closed"));
        }
        CompletableFuture<Void> written = new CompletableFuture<>();
        try {
            ctx.session.getRemote().sendBytes(ByteBuffer.wrap(frame.payload()), new WriteCallback() {
                @Override
                public void writeFailed(Throwable cause) {
                    written.completeExceptionally(cause);
                }

                @Override
                public void writeSuccess() {
                    written.complete(null);
                }
            });
        } catch (RuntimeException e) {
            written.completeExceptionally(e);
        }
        return written;
    }

    @Override
    public void close(final int code, final String reason) {
        if (ctx.session.isOpen()) {
            ctx.closeSession(code, reason);
        }
    }
}
