package com.questrail.brickhub.protocol.codec;

import com.questrail.brickhub.protocol.model.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HubMessageEncoder}.
 *
 * These tests validate the outbound semantic boundary:
 *   HubMessage -> bytes written to the hub
 */
final class HubMessageEncoderTest
{
    private final HubMessageEncoder encoder = new HubMessageEncoder();

    @Test
    void encodePropertyRequest()
    {
        assertArrayEquals(new byte[] { 0x05, 0x00, 0x01, 0x0D, 0x05 },
                encoder.encode(HubProperties.request(HubProperties.PRIMARY_MAC)));
    }

    @Test
    void encodeHubAction()
    {
        assertArrayEquals(new byte[] { 0x04, 0x00, 0x02, 0x02 },
                encoder.encode(new HubAction(HubAction.DISCONNECT)));
    }

    @Test
    void encodeAlertRequestWithoutStatus()
    {
        assertArrayEquals(new byte[] { 0x05, 0x00, 0x03, 0x01, 0x03 },
                encoder.encode(HubAlert.request(HubAlert.LOW_VOLTAGE)));
    }

    @Test
    void encodePortOutputWithFeedback()
    {
        PortOutput output = new PortOutput(0x01,
                PortOutput.STARTUP_IMMEDIATELY | PortOutput.COMPLETION_FEEDBACK,
                PortOutput.SUBCMD_START_POWER,
                new byte[] { 0x64 });

        assertTrue(output.needsReply());
        assertArrayEquals(new byte[] { 0x07, 0x00, (byte) 0x81, 0x01, 0x11, 0x01, 0x64 }, encoder.encode(output));
    }

    @Test
    void encodeInputFormatSetup()
    {
        assertArrayEquals(
                new byte[] { 0x0A, 0x00, 0x41, 0x02, 0x08, (byte) 0xFF, 0x00, 0x00, 0x00, 0x00 },
                encoder.encode(new PortInputFormatSetupSingle(0x02, 0x08, 0xFF, false)));
    }

    @Test
    void encodeAttachedEventAsTheHubSendsIt()
    {
        byte[] encoded = encoder.encode(HubAttachedIo.attached(0x3A, HubAttachedIo.DEV_TILT_INTERNAL, 1, 2));

        assertEquals(15, encoded.length);
        assertEquals(15, encoded[0]);
        assertEquals(HubAttachedIo.TYPE, encoded[2]);
        assertEquals(0x28, encoded[5]);
        assertEquals(0x01, encoded[7]);
        assertEquals(0x02, encoded[11]);
    }

    @Test
    void oversizedFrameIsRejected()
    {
        PortOutput huge = new PortOutput(0x00, PortOutput.STARTUP_IMMEDIATELY, 0x51, new byte[130]);

        assertThrows(IllegalArgumentException.class, () -> encoder.encode(huge));
    }

    @Test
    void largestSingleByteLengthFrameIsAccepted()
    {
        PortOutput largest = new PortOutput(0x00, PortOutput.STARTUP_IMMEDIATELY, 0x51, new byte[121]);

        byte[] encoded = encoder.encode(largest);
        assertEquals(127, encoded.length);
        assertEquals(127, encoded[0]);
    }
}
