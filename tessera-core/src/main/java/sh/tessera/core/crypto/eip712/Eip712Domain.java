// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * EIP-712 domain separator fields.
 * <p>
 * Every field is optional; only the ones that are set take part in the separator.
 * The Identity Registry binds wallet proofs to its name, version, chain id and
 * its own address, so a proof made for one deployment is useless on another.
 *
 * @param name              protocol name, or null
 * @param version           signing domain version, or null
 * @param chainId           chain id, or null
 * @param verifyingContract address that verifies the signature, or null
 * @param salt              disambiguation salt, or null
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public record Eip712Domain(
        @Nullable String name,
        @Nullable String version,
        @Nullable Long chainId,
        @Nullable Address verifyingContract,
        @Nullable Hash salt
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Computes {@code hashStruct(EIP712Domain)} over the fields that are set.
     *
     * @return the 32-byte domain separator
     */
    public Hash separator() {
        return TypedDataEncoder.hashDomain(this);
    }

    /**
     * Builder for {@link Eip712Domain}.
     */
    public static final class Builder {
        private String name;
        private String version;
        private Long chainId;
        private Address verifyingContract;
        private Hash salt;

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder verifyingContract(Address verifyingContract) {
            this.verifyingContract = verifyingContract;
            return this;
        }

        public Builder salt(Hash salt) {
            this.salt = salt;
            return this;
        }

        public Eip712Domain build() {
            return new Eip712Domain(name, version, chainId, verifyingContract, salt);
        }
    }
}
