// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import sh.tessera.core.types.Address;

/**
 * Something that controls an address and can sign 32-byte digests for it.
 * <p>
 * Implementations may hold a raw key, or forward to a KMS or hardware wallet.
 * Used on the client side to produce wallet delegation proofs.
 */
public interface Signer {

    /**
     * Returns the address this signer controls.
     *
     * @return the address
     */
    Address address();

    /**
     * Signs a 32-byte digest as-is, with no message prefix.
     *
     * @param digest the 32-byte digest (already domain-separated by the caller)
     * @return signature with v = 27 or 28
     */
    Signature signDigest(byte[] digest);
}
