// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.agent;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MetadataEntryTest {

    @Test
    void copiesValueOnTheWayInAndOut() {
        byte[] value = {1, 2, 3};
        MetadataEntry entry = MetadataEntry.of("model", value);

        value[0] = 9;
        assertEquals(1, entry.value()[0]);

        entry.value()[1] = 9;
        assertEquals(2, entry.value()[1]);
    }

    @Test
    void equalityComparesContent() {
        assertEquals(MetadataEntry.of("k", new byte[] {1}), MetadataEntry.of("k", new byte[] {1}));
        assertNotEquals(MetadataEntry.of("k", new byte[] {1}), MetadataEntry.of("k", new byte[] {2}));
    }
}
