package com.dreambig.chat.server.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ChatTransport} over a Spring {@link WebSocketSession}. Sends go through
 * {@link ConcurrentWebSocketSessionDecorator} because broadcasts reach one socket from many threads.
 */
public class WebSocketTransport implements ChatTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final WebSocketSession session;

    public WebSocketTransport(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session " + session.getId() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (SessionLimitExceededException e) {
            // send time or buffer limit exceeded; the decorator has already closed the session
            throw new IOException(e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new IOException("session " + session.getId() + " is not writable", e);
        }
    }

    @Override
    public void close(CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("[WARN] close failed session={} {}", session.getId(), e.getMessage());
        }
    }
}
