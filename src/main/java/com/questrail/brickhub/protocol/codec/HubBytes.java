package com.questrail.brickhub.protocol.codec;

/**
 * Little-endian field helpers and hex formatting for hub frames.
 */
public final class HubBytes
{
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HubBytes() {}

    public static int u8(byte[] data, int offset) {
        return data[offset] & 0xFF;
    }

    public static int u16(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8);
    }

    public static long u32(byte[] data, int offset) {
        return ((long) u16(data, offset)) | ((long) u16(data, offset + 2) << 16);
    }

    public static void putU16(byte[] data, int offset, int value) {
        data[offset] = (byte) value;
        data[offset + 1] = (byte) (value >>> 8);
    }

    public static void putU32(byte[] data, int offset, long value) {
        putU16(data, offset, (int) (value & 0xFFFF));
        putU16(data, offset + 2, (int) ((value >>> 16) & 0xFFFF));
    }

    /**
     * Formats bytes as contiguous lowercase hex, e.g. {@code 0f0004}.
     */
    public static String toHex(byte[] data) {
        char[] out = new char[data.length * 2];
        for (int i = 0; i < data.length; i++) {
            int b = data[i] & 0xFF;
            out[i * 2] = HEX[b >>> 4];
            out[i * 2 + 1] = HEX[b & 0x0F];
        }
        return new String(out);
    }

    /**
     * Parses contiguous hex (either case) into bytes.
     *
     * @throws IllegalArgumentException if the text is not valid hex
     */
    public static byte[] fromHex(String hex) {
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have an even length: " + hex);
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(hex.charAt(i * 2), 16);
            int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex string: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
