// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.tessera.core.types.Address;
import sh.tessera.primitives.Hex;

/**
 * secp256k1 private key with deterministic signing and signer recovery.
 *
 * <ul>
 * <li>Deterministic ECDSA nonces (RFC 6979, HMAC-SHA256)</li>
 * <li>Low-s normalization, so every signature it produces is canonical</li>
 * <li>Static address recovery used to verify wallet delegation proofs</li>
 * </ul>
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x59c6...");
 * Signature sig = key.sign(digest);
 * assert PrivateKey.recoverAddress(digest, sig).equals(key.toAddress());
 * }</pre>
 *
 * <p>{@link #destroy()} drops the key material references; later use fails with
 * {@link IllegalStateException}.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;
    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }
        try {
            final BigInteger value = new BigInteger(1, keyBytes);
            if (value.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (value.compareTo(Secp256k1.CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.privateKeyValue = value;
            this.publicKey = MULTIPLIER.multiply(Secp256k1.CURVE.getG(), value).normalize();
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key (with or without 0x prefix)
     * @return private key instance
     * @throws IllegalArgumentException if the hex is invalid or the key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString));
    }

    /**
     * Creates a private key from raw bytes. The array is zeroed afterwards.
     *
     * @param keyBytes 32-byte private key
     * @return private key instance
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * Derives the address controlled by this key.
     *
     * @return the address
     * @throws IllegalStateException if the key has been destroyed
     */
    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return Secp256k1.toAddress(pubKey);
    }

    /**
     * Signs a 32-byte digest.
     *
     * @param digest the digest to sign
     * @return low-s signature with v = yParity (0 or 1)
     * @throws IllegalArgumentException if the digest is not 32 bytes
     * @throws IllegalStateException    if the key has been destroyed
     */
    public Signature sign(final byte[] digest) {
        Objects.requireNonNull(digest, "digest cannot be null");
        if (digest.length != 32) {
            throw new IllegalArgumentException("Digest must be 32 bytes, got " + digest.length);
        }
        final BigInteger d;
        synchronized (this) {
            checkNotDestroyed();
            d = privateKeyValue;
        }

        final BigInteger n = Secp256k1.CURVE.getN();
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, d, digest);
        final BigInteger z = new BigInteger(1, digest);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(Secp256k1.CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(d))).mod(n);
            if (s.signum() == 0) {
                continue;
            }
            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            if (s.compareTo(Secp256k1.HALF_ORDER) > 0) {
                // (r, n - s) signs with -R, whose y has the opposite parity
                s = n.subtract(s);
                v ^= 1;
            }
            return new Signature(Secp256k1.toBytes32(r), Secp256k1.toBytes32(s), v);
        }
    }

    /**
     * Returns whether a signature is in canonical form: r and s in range, s in the
     * lower half of the curve order, and a recognised v.
     *
     * @param signature the signature to check
     * @return true if canonical
     */
    public static boolean isCanonical(final Signature signature) {
        Objects.requireNonNull(signature, "signature cannot be null");
        final int v = signature.v();
        if (v != 0 && v != 1 && v != 27 && v != 28) {
            return false;
        }
        return Secp256k1.isCanonical(signature.rValue(), signature.sValue());
    }

    /**
     * Recovers the address that produced a signature over a digest.
     *
     * @param digest    32-byte digest that was signed
     * @param signature the signature
     * @return recovered address
     * @throws IllegalArgumentException if the inputs do not describe a recoverable key
     */
    public static Address recoverAddress(final byte[] digest, final Signature signature) {
        Objects.requireNonNull(digest, "digest cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (digest.length != 32) {
            throw new IllegalArgumentException("Digest must be 32 bytes");
        }

        final BigInteger n = Secp256k1.CURVE.getN();
        final BigInteger r = signature.rValue();
        final BigInteger s = signature.sValue();
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            throw new IllegalArgumentException("Signature components out of range");
        }

        final ECPoint bigR;
        try {
            bigR = Secp256k1.CURVE.getCurve().decodePoint(compressed(r, signature.recoveryId() == 1));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }
        if (!bigR.isValid() || !bigR.multiply(n).isInfinity()) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }

        // Q = r^-1 (sR - eG)
        final BigInteger e = new BigInteger(1, digest);
        final BigInteger rInv = r.modInverse(n);
        final ECPoint q = bigR.multiply(rInv.multiply(s).mod(n))
                .subtract(Secp256k1.CURVE.getG().multiply(rInv.multiply(e).mod(n)))
                .normalize();
        if (q.isInfinity()) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return Secp256k1.toAddress(q);
    }

    private static byte[] compressed(final BigInteger x, final boolean oddY) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (oddY ? 0x03 : 0x02);
        System.arraycopy(Secp256k1.toBytes32(x), 0, encoded, 1, 32);
        return encoded;
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
