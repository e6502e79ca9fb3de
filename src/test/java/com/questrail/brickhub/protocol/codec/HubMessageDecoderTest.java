package com.questrail.brickhub.protocol.codec;

import com.questrail.brickhub.protocol.model.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HubMessageDecoder}.
 *
 * These tests validate the inbound semantic boundary:
 *   notification bytes -> UpstreamMessage
 */
final class HubMessageDecoderTest
{
    private final HubMessageDecoder decoder = new HubMessageDecoder();

    private static byte[] bytes(int... values)
    {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    @Test
    void decodeAttachedEvent()
    {
        UpstreamMessage msg = decoder.decode(bytes(
                0x0F, 0x00, 0x04, 0x00, 0x01, 0x27, 0x00,
                0x00, 0x00, 0x00, 0x10,
                0x00, 0x00, 0x00, 0x10));

        HubAttachedIo attached = assertInstanceOf(HubAttachedIo.class, msg);
        assertEquals(0x00, attached.port());
        assertEquals(HubAttachedIo.EVENT_ATTACHED, attached.event());
        assertEquals(HubAttachedIo.DEV_MOTOR_INTERNAL_TACHO, attached.deviceType());
        assertEquals(0x10000000, attached.hardwareRevision());
        assertTrue(attached.virtualPorts().isEmpty());
    }

    @Test
    void decodeVirtualAttachedEvent()
    {
        HubAttachedIo attached = assertInstanceOf(HubAttachedIo.class,
                decoder.decode(bytes(0x09, 0x00, 0x04, 0x10, 0x02, 0x27, 0x00, 0x00, 0x01)));

        assertEquals(0x10, attached.port());
        assertEquals(HubAttachedIo.EVENT_ATTACHED_VIRTUAL, attached.event());
        assertEquals(new VirtualPorts(0x00, 0x01), attached.virtualPorts().orElseThrow());
    }

    @Test
    void decodeDetachedEvent()
    {
        HubAttachedIo attached = assertInstanceOf(HubAttachedIo.class,
                decoder.decode(bytes(0x05, 0x00, 0x04, 0x02, 0x00)));

        assertTrue(attached.isDetach());
        assertEquals(0x02, attached.port());
    }

    @Test
    void decodeHubPropertiesUpdate()
    {
        HubProperties properties = assertInstanceOf(HubProperties.class,
                decoder.decode(bytes(0x09, 0x00, 0x01, 0x01, 0x06, 'M', 'o', 'v', 'e')));

        assertEquals(HubProperties.ADVERTISE_NAME, properties.property());
        assertEquals(HubProperties.UPSTREAM_UPDATE, properties.operation());
        assertEquals("Move", properties.parametersAsText());
    }

    @Test
    void decodeHubAlertUpdate()
    {
        HubAlert alert = assertInstanceOf(HubAlert.class,
                decoder.decode(bytes(0x06, 0x00, 0x03, 0x01, 0x04, 0xFF)));

        assertEquals(HubAlert.LOW_VOLTAGE, alert.alert());
        assertFalse(alert.isOk());
    }

    @Test
    void decodeGenericError()
    {
        GenericError error = assertInstanceOf(GenericError.class,
                decoder.decode(bytes(0x05, 0x00, 0x05, 0x01, 0x06)));

        assertEquals(0x01, error.commandType());
        assertEquals(GenericError.INVALID_USE, error.errorCode());
        assertEquals("Command 0x01 caused error 0x06: Invalid use (e.g. parameter error(s))", error.message());
    }

    @Test
    void decodePortValues()
    {
        PortValueSingle single = assertInstanceOf(PortValueSingle.class,
                decoder.decode(bytes(0x06, 0x00, 0x45, 0x3A, 0x07, 0x08)));
        assertEquals(0x3A, single.port());
        assertArrayEquals(bytes(0x07, 0x08), single.value());

        PortValueCombined combined = assertInstanceOf(PortValueCombined.class,
                decoder.decode(bytes(0x05, 0x00, 0x46, 0x10, 0x01)));
        assertEquals(0x10, combined.port());
    }

    @Test
    void decodePortInputFormat()
    {
        PortInputFormatSingle format = assertInstanceOf(PortInputFormatSingle.class,
                decoder.decode(bytes(0x0A, 0x00, 0x47, 0x3A, 0x02, 0x05, 0x00, 0x00, 0x00, 0x01)));

        assertEquals(0x3A, format.port());
        assertEquals(0x02, format.mode());
        assertEquals(5L, format.deltaInterval());
        assertTrue(format.notificationsEnabled());
    }

    @Test
    void decodePortOutputFeedbackUsesFirstPair()
    {
        PortOutputFeedback feedback = assertInstanceOf(PortOutputFeedback.class,
                decoder.decode(bytes(0x07, 0x00, 0x82, 0x00, 0x0A, 0x01, 0x0A)));

        assertEquals(0x00, feedback.port());
        assertEquals(PortOutputFeedback.COMPLETED | PortOutputFeedback.IDLE, feedback.status());
    }

    @Test
    void unknownTypeIsRejected()
    {
        MessageDecodeException e = assertThrows(MessageDecodeException.class,
                () -> decoder.decode(bytes(0x04, 0x00, 0x7F, 0x00)));
        assertTrue(e.getMessage().contains("0x7f"));
    }

    @Test
    void lengthMismatchIsRejected()
    {
        assertThrows(MessageDecodeException.class, () -> decoder.decode(bytes(0x09, 0x00, 0x05, 0x01, 0x06)));
    }

    @Test
    void extendedLengthIsRejected()
    {
        assertThrows(MessageDecodeException.class, () -> decoder.decode(bytes(0x81, 0x01, 0x00, 0x45)));
    }

    @Test
    void frameShorterThanHeaderIsRejected()
    {
        assertThrows(MessageDecodeException.class, () -> decoder.decode(bytes(0x02, 0x00)));
    }

    @Test
    void truncatedAttachedPayloadIsRejected()
    {
        assertThrows(MessageDecodeException.class,
                () -> decoder.decode(bytes(0x07, 0x00, 0x04, 0x00, 0x01, 0x27, 0x00)));
    }

    @Test
    void unknownAttachmentEventIsRejected()
    {
        assertThrows(MessageDecodeException.class, () -> decoder.decode(bytes(0x05, 0x00, 0x04, 0x00, 0x07)));
    }

    @Test
    void invalidVirtualPairIsWrapped()
    {
        MessageDecodeException e = assertThrows(MessageDecodeException.class,
                () -> decoder.decode(bytes(0x09, 0x00, 0x04, 0x10, 0x02, 0x27, 0x00, 0x01, 0x01)));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void supportedTypesCoverEveryUpstreamMessage()
    {
        assertEquals(9, decoder.supportedTypes().size());
        assertTrue(decoder.supportedTypes().contains(HubAttachedIo.TYPE));
        assertTrue(decoder.supportedTypes().contains(PortOutputFeedback.TYPE));
        assertFalse(decoder.supportedTypes().contains(PortOutput.TYPE));
    }
}
