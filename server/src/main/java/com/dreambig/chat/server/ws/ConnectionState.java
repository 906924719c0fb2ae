package com.dreambig.chat.server.ws;

/**
 * Per-connection lifecycle. Transitions only move forward.
 */
public enum ConnectionState {
    CONNECTING, OPEN, CLOSING, CLOSED
}
