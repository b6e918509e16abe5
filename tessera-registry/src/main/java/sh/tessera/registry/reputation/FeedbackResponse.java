// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * One entry of a feedback item's response thread.
 *
 * @param responder owner or delegate at the time of the response
 * @param text      response text
 * @param uri       optional reference, empty when absent
 * @param hash      optional reference hash
 * @param timestamp unix seconds
 */
public record FeedbackResponse(Address responder, String text, String uri, @Nullable Hash hash, long timestamp) {

    public FeedbackResponse {
        Objects.requireNonNull(responder, "responder");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(uri, "uri");
    }
}
