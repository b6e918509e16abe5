// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry.reputation;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.agent.FeedbackValue;
import sh.tessera.core.types.Hash;

/**
 * Everything a caller supplies when submitting feedback. Optional strings default to
 * empty.
 *
 * <pre>{@code
 * FeedbackInput input = FeedbackInput.builder("fast and correct", Sentiment.POSITIVE)
 *         .score(FeedbackValue.of(9977, 2))
 *         .tags("latency", "")
 *         .endpoint("https://agent.example/api")
 *         .build();
 * }</pre>
 */
public record FeedbackInput(
        String content,
        Sentiment sentiment,
        @Nullable FeedbackValue score,
        String tag1,
        String tag2,
        String endpoint,
        String feedbackUri,
        @Nullable Hash feedbackHash) {

    public FeedbackInput {
        Objects.requireNonNull(sentiment, "sentiment");
        content = content == null ? "" : content;
        tag1 = tag1 == null ? "" : tag1;
        tag2 = tag2 == null ? "" : tag2;
        endpoint = endpoint == null ? "" : endpoint;
        feedbackUri = feedbackUri == null ? "" : feedbackUri;
    }

    public static FeedbackInput of(final String content, final Sentiment sentiment) {
        return builder(content, sentiment).build();
    }

    public static Builder builder(final String content, final Sentiment sentiment) {
        return new Builder(content, sentiment);
    }

    /**
     * Builder for {@link FeedbackInput}.
     */
    public static final class Builder {
        private final String content;
        private final Sentiment sentiment;
        private FeedbackValue score;
        private String tag1 = "";
        private String tag2 = "";
        private String endpoint = "";
        private String feedbackUri = "";
        private Hash feedbackHash;

        private Builder(final String content, final Sentiment sentiment) {
            this.content = content;
            this.sentiment = sentiment;
        }

        public Builder score(final @Nullable FeedbackValue score) {
            this.score = score;
            return this;
        }

        public Builder tags(final @Nullable String tag1, final @Nullable String tag2) {
            this.tag1 = tag1;
            this.tag2 = tag2;
            return this;
        }

        public Builder endpoint(final @Nullable String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder feedbackUri(final @Nullable String feedbackUri) {
            this.feedbackUri = feedbackUri;
            return this;
        }

        public Builder feedbackHash(final @Nullable Hash feedbackHash) {
            this.feedbackHash = feedbackHash;
            return this;
        }

        public FeedbackInput build() {
            return new FeedbackInput(content, sentiment, score, tag1, tag2, endpoint, feedbackUri, feedbackHash);
        }
    }
}
