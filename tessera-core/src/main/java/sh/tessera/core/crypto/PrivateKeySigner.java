// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import sh.tessera.core.types.Address;

/**
 * {@link Signer} backed by an in-memory {@link PrivateKey}.
 */
public final class PrivateKeySigner implements Signer {

    private final PrivateKey privateKey;
    private final Address address;

    /**
     * Creates a signer from a hex-encoded private key.
     *
     * @param privateKeyHex the private key (with or without 0x prefix)
     * @throws IllegalArgumentException if the private key is invalid
     */
    public PrivateKeySigner(final String privateKeyHex) {
        this(PrivateKey.fromHex(privateKeyHex));
    }

    public PrivateKeySigner(final PrivateKey privateKey) {
        this.privateKey = privateKey;
        this.address = privateKey.toAddress();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Signature signDigest(final byte[] digest) {
        return privateKey.sign(digest).withEthereumV();
    }

    @Override
    public String toString() {
        return "PrivateKeySigner[address=" + address + "]";
    }
}
