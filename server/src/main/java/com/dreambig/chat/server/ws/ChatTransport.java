package com.dreambig.chat.server.ws;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * The write side of one client connection.
 */
public interface ChatTransport {

    String id();

    boolean isOpen();

    /**
     * @throws IOException when the connection is closed or the write fails
     */
    void send(String text) throws IOException;

    /** Never throws; closing an already closed transport is a no-op. */
    void close(CloseStatus status);
}
