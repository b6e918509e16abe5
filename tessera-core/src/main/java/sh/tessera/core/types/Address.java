// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.tessera.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * Identifies every party that interacts with the registries: agent owners,
 * delegated wallets, feedback authors, validators and incident reporters.
 * The registries also have addresses of their own, used as signing and
 * identifier domains.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so checksummed and plain spellings compare equal.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address. Never a valid owner, wallet, validator or caller; used by
     * queries to report "no address".
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether this is {@link #ZERO}.
     *
     * @return true for the zero address
     */
    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    /**
     * Decodes this address to a 20-byte array.
     *
     * @return a fresh 20-byte array
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
