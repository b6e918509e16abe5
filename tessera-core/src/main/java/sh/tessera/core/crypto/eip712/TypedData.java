// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import java.util.Objects;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.Signer;
import sh.tessera.core.types.Hash;

/**
 * A domain, a type definition and a message, ready to hash or sign.
 *
 * <pre>{@code
 * var typedData = TypedData.create(domain, AgentWalletBinding.DEFINITION, binding);
 * Hash digest = typedData.hash();
 * Signature sig = typedData.sign(walletSigner);
 * }</pre>
 *
 * @param <T> the message type
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public final class TypedData<T> {

    private static final byte[] EIP712_PREFIX = new byte[] {0x19, 0x01};

    private final Eip712Domain domain;
    private final TypeDefinition<T> definition;
    private final T message;

    private TypedData(Eip712Domain domain, TypeDefinition<T> definition, T message) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.message = Objects.requireNonNull(message, "message");
    }

    public static <T> TypedData<T> create(Eip712Domain domain, TypeDefinition<T> definition, T message) {
        return new TypedData<>(domain, definition, message);
    }

    /**
     * Computes {@code keccak256(0x19 0x01 || domainSeparator || hashStruct(message))}.
     *
     * @return the digest a wallet signs
     */
    public Hash hash() {
        byte[] structHash = TypedDataEncoder.hashStruct(
            definition.primaryType(),
            definition.types(),
            definition.extractor().apply(message));
        return Hash.fromBytes(Keccak256.hash(EIP712_PREFIX, domain.separator().toBytes(), structHash));
    }

    /**
     * Signs the digest from {@link #hash()}.
     *
     * @param signer the signer
     * @return signature with v = 27 or 28
     */
    public Signature sign(Signer signer) {
        Objects.requireNonNull(signer, "signer");
        return signer.signDigest(hash().toBytes());
    }

    public Eip712Domain domain() {
        return domain;
    }

    public TypeDefinition<T> definition() {
        return definition;
    }

    public T message() {
        return message;
    }
}
