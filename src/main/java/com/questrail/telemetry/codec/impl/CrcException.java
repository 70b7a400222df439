package com.questrail.telemetry.codec.impl;

/**
 * Internal signal for a missing or mismatching CRC trailer.
 */
final class CrcException extends Exception
{
    CrcException(String message) {
        super(message);
    }
}
