package org.arenasync.arena.session;

import org.arenasync.arena.protocol.NoticeCode;

/**
 * Why a session ended. The code is sent as the WebSocket close code.
 */
public enum CloseReason {
    CLIENT_LEAVE(4000, NoticeCode.CLOSING),
    IDLE_TIMEOUT(4001, NoticeCode.IDLE_TIMEOUT),
    PROTOCOL_VIOLATION(4002, NoticeCode.PROTOCOL_VIOLATION),
    SLOW_CONSUMER(4003, NoticeCode.SLOW_CONSUMER),
    TRANSPORT_ERROR(4004, NoticeCode.CLOSING),
    SERVER_SHUTDOWN(4005, NoticeCode.SERVER_SHUTDOWN),
    /** The same verified player opened a newer session. */
    SUPERSEDED(4006, NoticeCode.CLOSING);

    private final int code;
    private final NoticeCode notice;

    CloseReason(int code, NoticeCode notice) {
        this.code = code;
        this.notice = notice;
    }

    public int code() {
        return code;
    }

    public NoticeCode notice() {
        return notice;
    }
}
