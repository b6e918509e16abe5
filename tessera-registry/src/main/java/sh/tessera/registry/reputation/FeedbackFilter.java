// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.types.Address;

/**
 * Selects feedback by author and tags.
 *
 * <p>An empty author set matches any author. Each tag matches the feedback tag in the
 * same position; a null or empty tag places no constraint.
 *
 * @param authors authors to include, empty for all
 * @param tag1    required primary tag, or null
 * @param tag2    required secondary tag, or null
 */
public record FeedbackFilter(Set<Address> authors, @Nullable String tag1, @Nullable String tag2) {

    private static final FeedbackFilter ANY = new FeedbackFilter(Set.of(), null, null);

    public FeedbackFilter {
        authors = Set.copyOf(Objects.requireNonNull(authors, "authors"));
    }

    public static FeedbackFilter any() {
        return ANY;
    }

    public static FeedbackFilter byAuthors(final Collection<Address> authors) {
        return new FeedbackFilter(Set.copyOf(authors), null, null);
    }

    public static FeedbackFilter byTags(final @Nullable String tag1, final @Nullable String tag2) {
        return new FeedbackFilter(Set.of(), tag1, tag2);
    }

    public FeedbackFilter withTags(final @Nullable String newTag1, final @Nullable String newTag2) {
        return new FeedbackFilter(authors, newTag1, newTag2);
    }

    public boolean matches(final Feedback feedback) {
        if (!authors.isEmpty() && !authors.contains(feedback.author())) {
            return false;
        }
        return tagMatches(tag1, feedback.tag1()) && tagMatches(tag2, feedback.tag2());
    }

    private static boolean tagMatches(final @Nullable String wanted, final String actual) {
        return wanted == null || wanted.isEmpty() || wanted.equals(actual);
    }
}
