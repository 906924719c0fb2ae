package com.dreambig.chat.server.protocol;

/**
 * The frame is not a JSON object. Fatal for the connection that sent it.
 */
public class MalformedFrameException extends Exception {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
