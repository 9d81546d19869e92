package dev.mars.journal.api.codec;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.journal.api.Hash;
import dev.mars.journal.api.SimpleEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
@DisplayName("Event Hasher Tests")
class EventHasherTest {

    private final EventHasher hasher = new EventHasher();

    @Test
    void testEqualEventsHashEqually() {
        SimpleEvent a = new SimpleEvent("e1", "order-1", 1000, null, "created", Map.of("qty", 3));
        SimpleEvent b = new SimpleEvent("e1", "order-1", 1000, null, "created", Map.of("qty", 3));

        assertEquals(hasher.hash(a), hasher.hash(b));
        assertEquals(a.hash(), hasher.hash(a));
    }

    @Test
    @DisplayName("Every field contributes to the hash")
    void testEachFieldChangesHash() {
        Hash parent = Hash.sha256("parent");
        SimpleEvent base = new SimpleEvent("e1", "order-1", 1000, parent, "created", Map.of("qty", 3));
        Hash baseHash = base.hash();

        assertNotEquals(baseHash, new SimpleEvent("e2", "order-1", 1000, parent, "created", Map.of("qty", 3)).hash());
        assertNotEquals(baseHash, new SimpleEvent("e1", "order-2", 1000, parent, "created", Map.of("qty", 3)).hash());
        assertNotEquals(baseHash, new SimpleEvent("e1", "order-1", 1001, parent, "created", Map.of("qty", 3)).hash());
        assertNotEquals(baseHash, new SimpleEvent("e1", "order-1", 1000, null, "created", Map.of("qty", 3)).hash());
        assertNotEquals(baseHash, new SimpleEvent("e1", "order-1", 1000, parent, "shipped", Map.of("qty", 3)).hash());
        assertNotEquals(baseHash, new SimpleEvent("e1", "order-1", 1000, parent, "created", Map.of("qty", 4)).hash());
    }

    @Test
    void testMapInsertionOrderDoesNotMatter() {
        Map<String, Object> xy = new LinkedHashMap<>();
        xy.put("x", 1);
        xy.put("y", 2);
        Map<String, Object> yx = new LinkedHashMap<>();
        yx.put("y", 2);
        yx.put("x", 1);

        SimpleEvent a = new SimpleEvent("e1", "order-1", 1000, null, "created", xy);
        SimpleEvent b = new SimpleEvent("e1", "order-1", 1000, null, "created", yx);

        assertEquals(hasher.canonicalForm(a), hasher.canonicalForm(b));
        assertEquals(a.hash(), b.hash());
    }

    @Test
    void testCanonicalFormIsSortedAndCompact() {
        Hash parent = Hash.sha256("parent");
        SimpleEvent event = new SimpleEvent("e1", "order-1", 1000, parent, "created", Map.of("qty", 3));

        String canonical = hasher.canonicalForm(event);

        assertFalse(canonical.contains(" "));
        assertTrue(canonical.startsWith("{\"aggregateId\":\"order-1\""), canonical);
        assertTrue(canonical.contains("\"currentVersion\":\"" + parent + "\""), canonical);
        assertTrue(canonical.indexOf("\"id\"") < canonical.indexOf("\"timestamp\""), canonical);
        assertTrue(canonical.indexOf("\"timestamp\"") < canonical.indexOf("\"type\""), canonical);
    }
}
