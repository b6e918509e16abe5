// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.crypto.PrivateKey;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.eip712.Eip712Domain;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Verifies secp256k1 signatures over the EIP-712 digest of a wallet binding.
 *
 * <p>Accepts only {@code v} of 27 or 28, r and s inside the curve order, and
 * low-s form. The recovered signer must equal the wallet being bound.
 */
public final class Eip712ControlProofVerifier implements ControlProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(Eip712ControlProofVerifier.class);

    @Override
    public boolean verify(final AgentWalletBinding binding, final Eip712Domain domain, final Signature signature) {
        Objects.requireNonNull(binding, "binding");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(signature, "signature");

        if (signature.v() != 27 && signature.v() != 28) {
            log.debug("Rejecting wallet proof for agent {}: v={}", binding.agentId(), signature.v());
            return false;
        }
        if (!PrivateKey.isCanonical(signature)) {
            log.debug("Rejecting non-canonical wallet proof for agent {}", binding.agentId());
            return false;
        }

        final Hash digest = WalletBindings.digest(binding, domain);
        final Address recovered;
        try {
            recovered = PrivateKey.recoverAddress(digest.toBytes(), signature);
        } catch (IllegalArgumentException e) {
            log.debug("Unrecoverable wallet proof for agent {}: {}", binding.agentId(), e.getMessage());
            return false;
        }
        return recovered.equals(binding.wallet());
    }
}
