package com.questrail.telemetry.codec.impl;

/**
 * Internal signal for a frame whose marker or header is unusable.
 */
final class FramingException extends Exception
{
    private final boolean shortHeader;

    FramingException(String message, boolean shortHeader) {
        super(message);
        this.shortHeader = shortHeader;
    }

    boolean shortHeader() {
        return shortHeader;
    }
}
