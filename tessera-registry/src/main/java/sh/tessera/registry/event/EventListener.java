// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

/**
 * Receives events after the operation that emitted them has committed.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(LedgerEvent event);
}
