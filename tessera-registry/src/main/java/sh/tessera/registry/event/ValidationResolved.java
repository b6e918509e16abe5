// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.event;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.registry.validation.ValidationStatus;

/**
 * A validation request left Pending. Cancellations carry no outcome, tag or result.
 *
 * @param requestId  the request
 * @param status     the terminal status
 * @param resolvedBy validator for completion or rejection, requester for cancellation
 * @param outcome    0-100, or null for cancellation
 * @param tag        category tag, possibly empty
 * @param resultUri  result details, possibly empty
 * @param resultHash result hash, or null
 * @param timestamp  time in unix seconds
 */
public record ValidationResolved(
        Hash requestId,
        ValidationStatus status,
        Address resolvedBy,
        @Nullable Integer outcome,
        String tag,
        String resultUri,
        @Nullable Hash resultHash,
        long timestamp) implements LedgerEvent {
}
