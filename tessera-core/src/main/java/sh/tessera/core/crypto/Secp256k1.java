// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;

import sh.tessera.core.types.Address;

/**
 * secp256k1 curve parameters and the canonical-form rules signatures must meet.
 */
final class Secp256k1 {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());

    static final BigInteger HALF_ORDER = CURVE.getN().shiftRight(1);

    private Secp256k1() {
    }

    /**
     * r and s in [1, n), s in the lower half of the order (EIP-2).
     */
    static boolean isCanonical(final BigInteger r, final BigInteger s) {
        return r.signum() > 0
                && s.signum() > 0
                && r.compareTo(CURVE.getN()) < 0
                && s.compareTo(HALF_ORDER) <= 0;
    }

    /**
     * Address = last 20 bytes of keccak256(uncompressed public key without the 0x04 tag).
     */
    static Address toAddress(final ECPoint publicKey) {
        final byte[] encoded = publicKey.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        final byte[] result = new byte[32];
        if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            // drop BigInteger's sign byte
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
