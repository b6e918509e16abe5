// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.agent;

import java.util.Arrays;
import java.util.Objects;

/**
 * Agent metadata key-value pair. Keys are strings, values are arbitrary bytes.
 *
 * @param key   the metadata key
 * @param value the metadata value
 */
public record MetadataEntry(String key, byte[] value) {

    public MetadataEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    public static MetadataEntry of(String key, byte[] value) {
        return new MetadataEntry(key, value);
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MetadataEntry other)) return false;
        return key.equals(other.key) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        return "MetadataEntry[key=" + key + ", value=(" + value.length + " bytes)]";
    }
}
