package com.winmd.generator.model;

import lombok.NonNull;
import lombok.Value;

import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named GUID constant exposed as a static field.
 */
@Value
public class GuidConstant {

    private static final Pattern GUID_PATTERN = Pattern.compile(
            "^\\{?([0-9A-Fa-f]{8})-([0-9A-Fa-f]{4})-([0-9A-Fa-f]{4})-([0-9A-Fa-f]{4})-([0-9A-Fa-f]{12})}?$");

    @NonNull
    String name;
    @NonNull
    byte[] bytes;
    @NonNull
    String display;

    private GuidConstant(String name, byte[] bytes) {
        if (bytes.length != 16) {
            throw new IllegalArgumentException("GUID must be 16 bytes, got " + bytes.length);
        }
        this.name = name;
        this.bytes = bytes.clone();
        this.display = format(bytes);
    }

    /**
     * Parses {@code xxxxxxxx-xxxx-xxxx-xxxx-xxxxxxxxxxxx}, optionally wrapped in braces.
     */
    public static GuidConstant parse(String name, String text) {
        Matcher matcher = GUID_PATTERN.matcher(text == null ? "" : text.trim());
        if (!matcher.matches() || text.trim().startsWith("{") != text.trim().endsWith("}")) {
            throw new IllegalArgumentException("invalid GUID '" + text + "'");
        }
        StringBuilder hex = new StringBuilder(32);
        for (int i = 1; i <= 5; i++) {
            hex.append(matcher.group(i));
        }
        return new GuidConstant(name, HexFormat.of().parseHex(hex));
    }

    public static GuidConstant of(String name, byte[] bytes) {
        return new GuidConstant(name, bytes);
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Canonical upper-case display form of 16 bytes in written order.
     */
    public static String format(byte[] bytes) {
        String hex = HexFormat.of().formatHex(bytes).toUpperCase(Locale.ROOT);
        return hex.substring(0, 8) + "-" + hex.substring(8, 12) + "-" + hex.substring(12, 16)
                + "-" + hex.substring(16, 20) + "-" + hex.substring(20);
    }
}
