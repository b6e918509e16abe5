// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.tessera.primitives.Hex;

/**
 * Hex-encoded 32-byte hash (Keccak-256).
 * <p>
 * Used for validation request identifiers, content hashes and integrity hashes
 * of off-chain documents.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes)</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /** The all-zero hash, meaning "no hash supplied". */
    public static final Hash ZERO = new Hash("0x" + "0".repeat(64));

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash("0x" + Hex.encodeNoPrefix(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
