package com.dreambig.chat.server.store;

/**
 * The message store could not complete a read or write.
 */
public class MessageStoreException extends RuntimeException {

    public MessageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
