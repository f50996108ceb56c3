// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.util;

import java.util.Arrays;
import java.util.Locale;

/**
 * Hex encoding for transaction and block hashes.
 *
 * <p>
 * CometBFT reports hashes as uppercase hex without a prefix, while users
 * often paste them lowercase or {@code 0x}-prefixed. {@link #normalize(String)}
 * maps all of these to one canonical lowercase, unprefixed form, which is the
 * form used as a lookup key.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix, in either case.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final int len = hexLength / 2;
        final byte[] result = new byte[len];

        for (int i = 0; i < len; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }

        return result;
    }

    /**
     * Encodes bytes as lowercase hex without a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return lowercase hex string
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Canonicalizes a hash string: strips any {@code 0x} prefix and lowercases it.
     *
     * @param hash the hash in any accepted spelling
     * @return the lowercase, unprefixed hash
     * @throws IllegalArgumentException if the input is null, empty, of odd length or not hex
     */
    public static String normalize(final String hash) {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
        final String digits = hasPrefix(hash) ? hash.substring(2) : hash;
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("hash cannot be empty");
        }
        if ((digits.length() & 1) == 1) {
            throw new IllegalArgumentException("hash must have even length: " + hash);
        }
        for (int i = 0; i < digits.length(); i++) {
            toNibble(digits.charAt(i), hash);
        }
        return digits.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns {@code true} if the provided string starts with {@code 0x}
     * (case-insensitive).
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
