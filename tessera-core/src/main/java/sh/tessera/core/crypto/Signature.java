// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.tessera.primitives.Hex;

/**
 * secp256k1 ECDSA signature as {@code (r, s, v)}.
 *
 * <p>Signatures produced by {@link PrivateKey#sign} carry {@code v} as the raw
 * y-parity (0 or 1). Signatures handed to the Identity Registry as wallet
 * delegation proofs use the EIP-191/712 convention {@code v = 27 + yParity}.
 *
 * <p>The compact 65-byte form is {@code r || s || v}, matching what wallets
 * return from {@code eth_signTypedData_v4}.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature
 * @param v recovery value (0, 1, 27 or 28)
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    private static final int COMPONENT_LENGTH = 32;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.length != COMPONENT_LENGTH) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != COMPONENT_LENGTH) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        r = Arrays.copyOf(r, COMPONENT_LENGTH);
        s = Arrays.copyOf(s, COMPONENT_LENGTH);
    }

    /**
     * Parses the 65-byte compact form {@code r || s || v}.
     *
     * @param compact hex string of exactly 65 bytes
     * @return the signature
     * @throws IllegalArgumentException if the input is not 65 bytes of hex
     */
    public static Signature fromHex(final String compact) {
        final byte[] bytes = Hex.decode(compact);
        if (bytes.length != 65) {
            throw new IllegalArgumentException("Compact signature must be 65 bytes, got " + bytes.length);
        }
        return new Signature(
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64),
                bytes[64] & 0xFF);
    }

    /**
     * Returns the 65-byte compact form as {@code 0x}-prefixed hex.
     *
     * @return compact hex
     */
    public String toHex() {
        final byte[] out = new byte[65];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return Hex.encode(out);
    }

    /**
     * Returns the y-parity encoded in {@code v}.
     *
     * @return 0 or 1
     * @throws IllegalArgumentException if {@code v} is not one of 0, 1, 27, 28
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == 27 || v == 28) {
            return v - 27;
        }
        throw new IllegalArgumentException("Unsupported v value: " + v);
    }

    /**
     * Returns this signature with {@code v} shifted to the 27/28 convention.
     *
     * @return an equivalent signature with v = 27 + yParity
     */
    public Signature withEthereumV() {
        return new Signature(r, s, 27 + recoveryId());
    }

    BigInteger rValue() {
        return new BigInteger(1, r);
    }

    BigInteger sValue() {
        return new BigInteger(1, s);
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Signature other)) {
            return false;
        }
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[v=" + v + ", 65 bytes]";
    }
}
