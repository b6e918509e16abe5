// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import sh.tessera.core.types.Address;

/**
 * An owner granted or revoked operator rights over all of its agents.
 *
 * @param owner    the owner
 * @param operator the operator
 * @param approved whether rights are now granted
 */
public record OperatorApproval(Address owner, Address operator, boolean approved) implements LedgerEvent {
}
