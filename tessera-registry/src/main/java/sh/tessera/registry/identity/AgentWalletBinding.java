// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.tessera.core.crypto.eip712.TypeDefinition;
import sh.tessera.core.crypto.eip712.TypedDataField;
import sh.tessera.core.types.Address;

/**
 * EIP-712 message a wallet signs to prove it consents to acting for an agent.
 *
 * <p>The nonce is the agent's current {@link IdentityRegistry#walletNonce wallet nonce};
 * each successful binding consumes it, so a signature can be used at most once.
 *
 * @param agentId  the agent id
 * @param wallet   the wallet being bound (and the expected signer)
 * @param nonce    the agent's wallet nonce
 * @param deadline unix time after which the signature is no longer accepted
 */
public record AgentWalletBinding(BigInteger agentId, Address wallet, BigInteger nonce, BigInteger deadline) {

    /** EIP-712 type definition for AgentWalletBinding. */
    public static final TypeDefinition<AgentWalletBinding> DEFINITION =
            TypeDefinition.forRecord(
                    AgentWalletBinding.class,
                    "AgentWalletBinding",
                    Map.of("AgentWalletBinding", List.of(
                            TypedDataField.of("agentId", "uint256"),
                            TypedDataField.of("wallet", "address"),
                            TypedDataField.of("nonce", "uint256"),
                            TypedDataField.of("deadline", "uint256"))));

    public AgentWalletBinding {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(wallet, "wallet");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(deadline, "deadline");
    }
}
