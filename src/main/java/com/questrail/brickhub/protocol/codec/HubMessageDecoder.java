package com.questrail.brickhub.protocol.codec;

import com.questrail.brickhub.protocol.model.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * HubMessageDecoder
 * ============================================================================
 * Converts raw notification bytes into a semantic {@link UpstreamMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class forms the boundary between:
 *
 * <ul>
 *   <li><b>Protocol mechanics</b> (length byte, hub id, payload layout)</li>
 *   <li><b>Protocol semantics</b> (upstream messages with defined meaning)</li>
 * </ul>
 *
 * The hub engine, the attachment tracker and the peripherals operate
 * exclusively on {@link UpstreamMessage} and never on payload bytes.
 *
 * <h2>Registry</h2>
 * Payload decoders are keyed by the one-byte message type found at offset 2
 * of every frame. A type without a registered decoder is a protocol
 * violation: the remainder of the stream cannot be interpreted reliably, so
 * decoding fails with {@link MessageDecodeException}.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Correlate replies with requests</li>
 *   <li>Dispatch messages</li>
 *   <li>Decode downstream-only messages</li>
 * </ul>
 */
public final class HubMessageDecoder
{
    /**
     * Strategy interface for decoding the payload of one message type.
     */
    @FunctionalInterface
    public interface PayloadDecoder {
        UpstreamMessage decode(byte[] payload);
    }

    private final Map<Integer, PayloadDecoder> decoders;

    public HubMessageDecoder() {
        Map<Integer, PayloadDecoder> registry = new HashMap<>();
        registry.put(HubProperties.TYPE, HubMessageDecoder::decodeHubProperties);
        registry.put(HubAction.TYPE, HubMessageDecoder::decodeHubAction);
        registry.put(HubAlert.TYPE, HubMessageDecoder::decodeHubAlert);
        registry.put(HubAttachedIo.TYPE, HubMessageDecoder::decodeHubAttachedIo);
        registry.put(GenericError.TYPE, HubMessageDecoder::decodeGenericError);
        registry.put(PortValueSingle.TYPE, HubMessageDecoder::decodePortValueSingle);
        registry.put(PortValueCombined.TYPE, HubMessageDecoder::decodePortValueCombined);
        registry.put(PortInputFormatSingle.TYPE, HubMessageDecoder::decodePortInputFormatSingle);
        registry.put(PortOutputFeedback.TYPE, HubMessageDecoder::decodePortOutputFeedback);
        this.decoders = Collections.unmodifiableMap(registry);
    }

    /**
     * Decodes one complete notification frame.
     *
     * @param data raw bytes as delivered by the connection
     * @return semantic upstream message
     *
     * @throws MessageDecodeException if the bytes cannot be mapped to a
     *         known upstream message
     */
    public UpstreamMessage decode(byte[] data) {
        Objects.requireNonNull(data, "data");

        HubFrame frame = HubFraming.unwrap(data);
        PayloadDecoder decoder = decoders.get(frame.type());
        if (decoder == null) {
            throw new MessageDecodeException(String.format(
                    "Unknown hub message type byte: 0x%02x in %s", frame.type(), HubBytes.toHex(data)));
        }

        try {
            return decoder.decode(frame.payload());
        } catch (MessageDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessageDecodeException(String.format(
                    "Failed to decode message type 0x%02x from %s", frame.type(), HubBytes.toHex(data)), e);
        }
    }

    /**
     * @return message type bytes this decoder understands
     */
    public Set<Integer> supportedTypes() {
        return decoders.keySet();
    }

    // ========================================================================
    // Hub-level messages
    // ========================================================================

    private static HubProperties decodeHubProperties(byte[] payload) {
        requireLength(payload, 2, "HubProperties ($01)");
        byte[] parameters = new byte[payload.length - 2];
        System.arraycopy(payload, 2, parameters, 0, parameters.length);
        return new HubProperties(HubBytes.u8(payload, 0), HubBytes.u8(payload, 1), parameters);
    }

    private static HubAction decodeHubAction(byte[] payload) {
        requireLength(payload, 1, "HubAction ($02)");
        return new HubAction(HubBytes.u8(payload, 0));
    }

    private static HubAlert decodeHubAlert(byte[] payload) {
        requireLength(payload, 2, "HubAlert ($03)");
        int status = payload.length > 2 ? HubBytes.u8(payload, 2) : HubAlert.STATUS_OK;
        return new HubAlert(HubBytes.u8(payload, 0), HubBytes.u8(payload, 1), status);
    }

    private static HubAttachedIo decodeHubAttachedIo(byte[] payload) {
        requireLength(payload, 2, "HubAttachedIo ($04)");
        final int port = HubBytes.u8(payload, 0);
        final int event = HubBytes.u8(payload, 1);

        return switch (event) {
            case HubAttachedIo.EVENT_DETACHED -> HubAttachedIo.detached(port);
            case HubAttachedIo.EVENT_ATTACHED -> {
                requireLength(payload, 12, "HubAttachedIo ($04) attached event");
                yield HubAttachedIo.attached(
                        port,
                        HubBytes.u16(payload, 2),
                        (int) HubBytes.u32(payload, 4),
                        (int) HubBytes.u32(payload, 8));
            }
            case HubAttachedIo.EVENT_ATTACHED_VIRTUAL -> {
                requireLength(payload, 6, "HubAttachedIo ($04) virtual attached event");
                yield HubAttachedIo.attachedVirtual(
                        port,
                        HubBytes.u16(payload, 2),
                        new VirtualPorts(HubBytes.u8(payload, 4), HubBytes.u8(payload, 5)));
            }
            default -> throw new MessageDecodeException(String.format(
                    "Unknown attachment event 0x%02x on port 0x%02x", event, port));
        };
    }

    private static GenericError decodeGenericError(byte[] payload) {
        requireLength(payload, 2, "GenericError ($05)");
        return new GenericError(HubBytes.u8(payload, 0), HubBytes.u8(payload, 1));
    }

    // ========================================================================
    // Port-level messages
    // ========================================================================

    private static PortValueSingle decodePortValueSingle(byte[] payload) {
        requireLength(payload, 1, "PortValueSingle ($45)");
        return new PortValueSingle(HubBytes.u8(payload, 0), tail(payload, 1));
    }

    private static PortValueCombined decodePortValueCombined(byte[] payload) {
        requireLength(payload, 1, "PortValueCombined ($46)");
        return new PortValueCombined(HubBytes.u8(payload, 0), tail(payload, 1));
    }

    private static PortInputFormatSingle decodePortInputFormatSingle(byte[] payload) {
        requireLength(payload, 7, "PortInputFormatSingle ($47)");
        return new PortInputFormatSingle(
                HubBytes.u8(payload, 0),
                HubBytes.u8(payload, 1),
                HubBytes.u32(payload, 2),
                HubBytes.u8(payload, 6) != 0);
    }

    private static PortOutputFeedback decodePortOutputFeedback(byte[] payload) {
        // The hub may append further port/status pairs; only the first is used.
        requireLength(payload, 2, "PortOutputFeedback ($82)");
        return new PortOutputFeedback(HubBytes.u8(payload, 0), HubBytes.u8(payload, 1));
    }

    private static byte[] tail(byte[] payload, int from) {
        byte[] out = new byte[payload.length - from];
        System.arraycopy(payload, from, out, 0, out.length);
        return out;
    }

    private static void requireLength(byte[] payload, int minimum, String what) {
        if (payload.length < minimum) {
            throw new MessageDecodeException(what + " requires at least " + minimum
                    + " payload bytes, got " + payload.length);
        }
    }
}
