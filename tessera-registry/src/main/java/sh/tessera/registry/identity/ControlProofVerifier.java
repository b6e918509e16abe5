// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.identity;

import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.eip712.Eip712Domain;

/**
 * Decides whether a signature proves that {@link AgentWalletBinding#wallet()} controls
 * the wallet and consents to the binding.
 *
 * <p>Implementations must reject malformed and non-canonical signatures. Nonce and
 * deadline checks are done by the registry before the verifier is consulted.
 */
@FunctionalInterface
public interface ControlProofVerifier {

    boolean verify(AgentWalletBinding binding, Eip712Domain domain, Signature signature);
}
