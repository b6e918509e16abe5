// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import java.math.BigInteger;
import java.util.Objects;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.agent.RegistryId;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.Signer;
import sh.tessera.core.crypto.eip712.Eip712Domain;
import sh.tessera.core.crypto.eip712.TypedData;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Client-side helpers for producing the proof that {@link IdentityRegistry#setAgentWallet}
 * expects.
 *
 * <p>Example: bind a wallet to an agent
 * <pre>{@code
 * var domain = identity.walletBindingDomain();
 * var binding = WalletBindings.binding(agentId, walletSigner.address(),
 *         identity.walletNonce(agentId), deadline);
 * Signature proof = WalletBindings.sign(binding, domain, walletSigner);
 * identity.setAgentWallet(owner, agentId, walletSigner.address(), deadline, proof);
 * }</pre>
 */
public final class WalletBindings {

    public static final String DOMAIN_NAME = "TesseraIdentityRegistry";
    public static final String DOMAIN_VERSION = "1";

    private WalletBindings() {}

    /**
     * Builds the signing domain of an Identity Registry deployment.
     *
     * @param identityRegistry chain id and address of the Identity Registry
     * @return the domain
     */
    public static Eip712Domain domain(final RegistryId identityRegistry) {
        Objects.requireNonNull(identityRegistry, "identityRegistry");
        return Eip712Domain.builder()
                .name(DOMAIN_NAME)
                .version(DOMAIN_VERSION)
                .chainId(identityRegistry.chainId())
                .verifyingContract(identityRegistry.address())
                .build();
    }

    public static AgentWalletBinding binding(final AgentId agentId, final Address wallet,
                                             final BigInteger nonce, final long deadline) {
        Objects.requireNonNull(agentId, "agentId");
        return new AgentWalletBinding(agentId.value(), wallet, nonce, BigInteger.valueOf(deadline));
    }

    public static Hash digest(final AgentWalletBinding binding, final Eip712Domain domain) {
        return TypedData.create(domain, AgentWalletBinding.DEFINITION, binding).hash();
    }

    /**
     * Signs a binding with the wallet's key.
     *
     * @param binding      the binding
     * @param domain       the registry's signing domain
     * @param walletSigner signer for {@code binding.wallet()}
     * @return signature with v = 27 or 28
     * @throws IllegalArgumentException if the signer is not the wallet being bound
     */
    public static Signature sign(final AgentWalletBinding binding, final Eip712Domain domain,
                                 final Signer walletSigner) {
        Objects.requireNonNull(binding, "binding");
        Objects.requireNonNull(walletSigner, "walletSigner");
        if (!walletSigner.address().equals(binding.wallet())) {
            throw new IllegalArgumentException(
                    "signer " + walletSigner.address() + " is not the bound wallet " + binding.wallet());
        }
        return TypedData.create(domain, AgentWalletBinding.DEFINITION, binding).sign(walletSigner);
    }
}
