// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

/**
 * Field-length ceilings enforced by every registry.
 *
 * <p>All lengths are in Java {@code char}s and must be positive.
 *
 * <pre>{@code
 * RegistryLimits limits = RegistryLimits.builder()
 *         .maxResponses(10)
 *         .build();
 * }</pre>
 *
 * @param maxUriLength         any URI field
 * @param maxTextLength        free text (feedback content, response text)
 * @param maxTagLength         tags and incident categories
 * @param maxEndpointLength    the endpoint a feedback item rates
 * @param maxMetadataKeyLength agent metadata keys
 * @param maxResponses         response entries per feedback item
 * @since 0.1.0
 */
public record RegistryLimits(
        int maxUriLength,
        int maxTextLength,
        int maxTagLength,
        int maxEndpointLength,
        int maxMetadataKeyLength,
        int maxResponses) {

    public static final int DEFAULT_MAX_URI_LENGTH = 2048;
    public static final int DEFAULT_MAX_TEXT_LENGTH = 2048;
    public static final int DEFAULT_MAX_TAG_LENGTH = 128;
    public static final int DEFAULT_MAX_ENDPOINT_LENGTH = 512;
    public static final int DEFAULT_MAX_METADATA_KEY_LENGTH = 128;
    public static final int DEFAULT_MAX_RESPONSES = 30;

    public RegistryLimits {
        requirePositive("maxUriLength", maxUriLength);
        requirePositive("maxTextLength", maxTextLength);
        requirePositive("maxTagLength", maxTagLength);
        requirePositive("maxEndpointLength", maxEndpointLength);
        requirePositive("maxMetadataKeyLength", maxMetadataKeyLength);
        requirePositive("maxResponses", maxResponses);
    }

    public static RegistryLimits defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(final String name, final int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    /**
     * Builder for {@link RegistryLimits}, starting from the defaults.
     */
    public static final class Builder {
        private int maxUriLength = DEFAULT_MAX_URI_LENGTH;
        private int maxTextLength = DEFAULT_MAX_TEXT_LENGTH;
        private int maxTagLength = DEFAULT_MAX_TAG_LENGTH;
        private int maxEndpointLength = DEFAULT_MAX_ENDPOINT_LENGTH;
        private int maxMetadataKeyLength = DEFAULT_MAX_METADATA_KEY_LENGTH;
        private int maxResponses = DEFAULT_MAX_RESPONSES;

        private Builder() {
        }

        public Builder maxUriLength(final int maxUriLength) {
            this.maxUriLength = maxUriLength;
            return this;
        }

        public Builder maxTextLength(final int maxTextLength) {
            this.maxTextLength = maxTextLength;
            return this;
        }

        public Builder maxTagLength(final int maxTagLength) {
            this.maxTagLength = maxTagLength;
            return this;
        }

        public Builder maxEndpointLength(final int maxEndpointLength) {
            this.maxEndpointLength = maxEndpointLength;
            return this;
        }

        public Builder maxMetadataKeyLength(final int maxMetadataKeyLength) {
            this.maxMetadataKeyLength = maxMetadataKeyLength;
            return this;
        }

        public Builder maxResponses(final int maxResponses) {
            this.maxResponses = maxResponses;
            return this;
        }

        public RegistryLimits build() {
            return new RegistryLimits(maxUriLength, maxTextLength, maxTagLength,
                    maxEndpointLength, maxMetadataKeyLength, maxResponses);
        }
    }
}
