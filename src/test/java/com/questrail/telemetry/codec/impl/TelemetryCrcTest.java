package com.questrail.telemetry.codec.impl;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class TelemetryCrcTest {

    @Test
    void matchesCrc16ArcCheckValue() {
        byte[] data = "123456789".getBytes(StandardCharsets.US_ASCII);
        assertEquals(0xBB3D, TelemetryCrc.compute(data, 0, data.length));
    }

    @Test
    void emptyInputYieldsInitValue() {
        assertEquals(0x0000, TelemetryCrc.compute(new byte[0], 0, 0));
    }

    @Test
    void writeThenValidateCoversEverythingAfterMarker() throws Exception {
        byte[] frame = new byte[12];
        for (int i = 0; i < 10; i++) {
            frame[i] = (byte) (i * 17);
        }
        TelemetryCrc.write(frame, 0, 10);
        TelemetryCrc.validate(frame, 0, 10);

        // The marker is outside the CRC.
        frame[0] ^= 0x55;
        TelemetryCrc.validate(frame, 0, 10);

        frame[5] ^= 0x01;
        assertThrows(CrcException.class, () -> TelemetryCrc.validate(frame, 0, 10));
    }

    @Test
    void crcIsLittleEndian() {
        byte[] frame = new byte[4];
        frame[1] = 0x42;
        TelemetryCrc.write(frame, 0, 2);

        int crc = TelemetryCrc.compute(frame, 1, 1);
        assertEquals(crc & 0xFF, frame[2] & 0xFF);
        assertEquals((crc >>> 8) & 0xFF, frame[3] & 0xFF);
    }

    @Test
    void missingTrailerIsRejected() {
        assertThrows(CrcException.class, () -> TelemetryCrc.validate(new byte[11], 0, 10));
    }
}
