package com.communitybot.service;

/**
 * Raised by platform ports when a call to the chat platform fails.
 */
public class PlatformException extends Exception {
    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
