package com.winmd.generator.codegen.blob;

import lombok.experimental.UtilityClass;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Byte-level encodings used inside custom attribute blobs.
 *
 * All functions are pure; out-of-domain input raises {@link IllegalArgumentException}.
 */
@UtilityClass
public class AttributeBlobEncoder {

    public static final int GUID_LENGTH = 16;
    public static final int MAX_PASCAL_LENGTH = 0x7F;
    public static final int MAX_COMPRESSED_LENGTH = 0x1FFF_FFFF;

    private static final HexFormat HEX = HexFormat.ofDelimiter(" ").withUpperCase();

    /**
     * Encodes a non-negative number into exactly {@code byteCount} bytes, least significant first.
     */
    public byte[] littleEndian(long number, int byteCount) {
        if (byteCount < 1 || byteCount > 8) {
            throw new IllegalArgumentException("byte count must be between 1 and 8, got " + byteCount);
        }
        if (number < 0) {
            throw new IllegalArgumentException("cannot encode negative number " + number);
        }
        if (byteCount < 8 && (number >>> (8 * byteCount)) != 0) {
            throw new IllegalArgumentException(number + " does not fit in " + byteCount + " bytes");
        }
        byte[] bytes = new byte[byteCount];
        for (int i = 0; i < byteCount; i++) {
            bytes[i] = (byte) (number >>> (8 * i));
        }
        return bytes;
    }

    /**
     * Inverse of {@link #littleEndian(long, int)}.
     */
    public long fromLittleEndian(byte[] bytes) {
        if (bytes.length < 1 || bytes.length > 8) {
            throw new IllegalArgumentException("byte count must be between 1 and 8, got " + bytes.length);
        }
        long number = 0;
        for (int i = bytes.length - 1; i >= 0; i--) {
            number = (number << 8) | (bytes[i] & 0xFF);
        }
        return number;
    }

    /**
     * Reorders a GUID from written order into the field-wise little-endian order of
     * {@code GuidAttribute(uint32, uint16, uint16, uint8 x 8)}:
     * the 4-byte field and both 2-byte fields are reversed, the last 8 bytes stay as they are.
     */
    public byte[] reorderGuid(byte[] canonical) {
        if (canonical.length != GUID_LENGTH) {
            throw new IllegalArgumentException("GUID must be " + GUID_LENGTH + " bytes, got " + canonical.length);
        }
        byte[] reordered = new byte[GUID_LENGTH];
        reordered[0] = canonical[3];
        reordered[1] = canonical[2];
        reordered[2] = canonical[1];
        reordered[3] = canonical[0];
        reordered[4] = canonical[5];
        reordered[5] = canonical[4];
        reordered[6] = canonical[7];
        reordered[7] = canonical[6];
        System.arraycopy(canonical, 8, reordered, 8, 8);
        return reordered;
    }

    /**
     * UTF-8 text prefixed by a single length byte; at most 127 bytes of text.
     */
    public byte[] pascalString(String text) {
        byte[] encoded = text.getBytes(StandardCharsets.UTF_8);
        if (encoded.length > MAX_PASCAL_LENGTH) {
            throw new IllegalArgumentException("text too long for a single length byte: " + encoded.length + " bytes");
        }
        return concat(new byte[] {(byte) encoded.length}, encoded);
    }

    /**
     * UTF-8 text prefixed by an ECMA-335 compressed length (SerString).
     */
    public byte[] compressedString(String text) {
        byte[] encoded = text.getBytes(StandardCharsets.UTF_8);
        return concat(compressedLength(encoded.length), encoded);
    }

    /**
     * 1, 2 or 4 byte big-endian length with the width tagged in the top bits
     * ({@code 0xxxxxxx}, {@code 10xxxxxx}, {@code 110xxxxx}).
     */
    public byte[] compressedLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        if (length <= 0x7F) {
            return new byte[] {(byte) length};
        }
        if (length <= 0x3FFF) {
            return new byte[] {
                    (byte) (((length >> 8) & 0x3F) | 0x80),
                    (byte) (length & 0xFF)
            };
        }
        if (length <= MAX_COMPRESSED_LENGTH) {
            return new byte[] {
                    (byte) (((length >> 24) & 0x1F) | 0xC0),
                    (byte) ((length >> 16) & 0xFF),
                    (byte) ((length >> 8) & 0xFF),
                    (byte) (length & 0xFF)
            };
        }
        throw new IllegalArgumentException("text too long for a compressed length: " + length + " bytes");
    }

    public byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    /**
     * Space separated upper-case hex, as written inside an IL blob.
     */
    public String hex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }
}
