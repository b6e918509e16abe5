// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Objects;

import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Fixed-width 32-byte word encoding, as used by static ABI types.
 *
 * <p>Unsigned integers and addresses are left-padded; signed integers use
 * two's complement across the full word. Concatenating words gives an
 * unambiguous preimage, because every value occupies exactly one slot.
 *
 * <pre>{@code
 * byte[] preimage = Words.builder()
 *     .address(requester)
 *     .uint(sequence)
 *     .bytes32(contentHash)
 *     .toByteArray();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Words {

    /** Size of one slot. */
    public static final int WORD_SIZE = 32;

    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);

    private Words() {
    }

    /**
     * Encodes a non-negative integer of at most {@code bits} bits.
     *
     * @param value the value
     * @param bits  the declared width (8..256)
     * @return one word
     * @throws IllegalArgumentException if the value is negative or too wide
     */
    public static byte[] uint(final BigInteger value, final int bits) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint" + bits + " cannot be negative: " + value);
        }
        if (value.bitLength() > bits) {
            throw new IllegalArgumentException("value exceeds uint" + bits + ": " + value);
        }
        return leftPad(unsigned(value));
    }

    public static byte[] uint(final BigInteger value) {
        return uint(value, 256);
    }

    public static byte[] uint(final long value) {
        return uint(BigInteger.valueOf(value), 256);
    }

    /**
     * Encodes a signed integer of at most {@code bits} bits in two's complement.
     *
     * @param value the value
     * @param bits  the declared width (8..256)
     * @return one word
     * @throws IllegalArgumentException if the value does not fit
     */
    public static byte[] signed(final BigInteger value, final int bits) {
        Objects.requireNonNull(value, "value");
        final BigInteger min = BigInteger.ONE.shiftLeft(bits - 1).negate();
        final BigInteger max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new IllegalArgumentException("value outside int" + bits + ": " + value);
        }
        return leftPad(unsigned(value.signum() < 0 ? value.add(TWO_256) : value));
    }

    public static byte[] address(final Address address) {
        Objects.requireNonNull(address, "address");
        return leftPad(address.toBytes());
    }

    public static byte[] bytes32(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        return hash.toBytes();
    }

    public static byte[] bool(final boolean value) {
        final byte[] word = new byte[WORD_SIZE];
        word[WORD_SIZE - 1] = (byte) (value ? 1 : 0);
        return word;
    }

    /**
     * Right-pads up to 32 bytes of fixed-size data ({@code bytesN}).
     *
     * @param data between 1 and 32 bytes
     * @return one word
     */
    public static byte[] fixedBytes(final byte[] data) {
        Objects.requireNonNull(data, "data");
        if (data.length == 0 || data.length > WORD_SIZE) {
            throw new IllegalArgumentException("fixed bytes must be 1-32 bytes, got " + data.length);
        }
        final byte[] word = new byte[WORD_SIZE];
        System.arraycopy(data, 0, word, 0, data.length);
        return word;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static byte[] unsigned(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            final byte[] trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return bytes;
    }

    private static byte[] leftPad(final byte[] bytes) {
        if (bytes.length == WORD_SIZE) {
            return bytes;
        }
        final byte[] word = new byte[WORD_SIZE];
        System.arraycopy(bytes, 0, word, WORD_SIZE - bytes.length, bytes.length);
        return word;
    }

    /**
     * Accumulates words into one preimage.
     */
    public static final class Builder {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        Builder() {
        }

        public Builder address(final Address address) {
            out.writeBytes(Words.address(address));
            return this;
        }

        public Builder uint(final BigInteger value) {
            out.writeBytes(Words.uint(value));
            return this;
        }

        public Builder uint(final long value) {
            out.writeBytes(Words.uint(value));
            return this;
        }

        public Builder bytes32(final Hash hash) {
            out.writeBytes(Words.bytes32(hash));
            return this;
        }

        public Builder word(final byte[] word) {
            if (word.length != WORD_SIZE) {
                throw new IllegalArgumentException("word must be 32 bytes, got " + word.length);
            }
            out.writeBytes(word);
            return this;
        }

        public byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
