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

package dev.mars.arazzo.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtensionsTest {
    
    private final JsonNodeFactory factory = JsonNodeFactory.instance;
    
    @Test
    void testEmpty() {
        assertTrue(Extensions.empty().isEmpty());
        assertSame(Extensions.empty(), Extensions.of(Map.of()));
        assertSame(Extensions.empty(), Extensions.of(null));
    }
    
    @Test
    void testKeysMustCarryPrefix() {
        Map<String, JsonNode> values = Map.of("foo", factory.textNode("bar"));
        assertThrows(IllegalArgumentException.class, () -> Extensions.of(values));
        assertTrue(Extensions.isExtensionKey("x-foo"));
        assertFalse(Extensions.isExtensionKey("X-foo"));
        assertFalse(Extensions.isExtensionKey(null));
    }
    
    @Test
    void testValuesAreCopiedAndOrdered() {
        ObjectNode owner = factory.objectNode().put("team", "pets");
        Map<String, JsonNode> values = new LinkedHashMap<>();
        values.put("x-b", factory.numberNode(1));
        values.put("x-a", owner);
        
        Extensions extensions = Extensions.of(values);
        owner.put("team", "changed");
        
        assertEquals(List.of("x-b", "x-a"), List.copyOf(extensions.keys()));
        assertEquals("pets", extensions.get("x-a").get("team").asText());
        assertThrows(UnsupportedOperationException.class, () -> extensions.asMap().remove("x-b"));
    }
    
    @Test
    void testReturnedValuesCannotChangeExtensions() {
        Extensions extensions = Extensions.of(Map.of("x-foo", factory.objectNode().put("a", 1)));
        Extensions same = Extensions.of(Map.of("x-foo", factory.objectNode().put("a", 1)));
        
        ((ObjectNode) extensions.get("x-foo")).put("b", 2);
        ((ObjectNode) extensions.asMap().get("x-foo")).put("c", 3);
        
        assertEquals(1, extensions.get("x-foo").size());
        assertEquals(same, extensions);
        assertEquals(same.hashCode(), extensions.hashCode());
        assertNull(extensions.get("x-missing"));
    }
    
    @Test
    void testEquality() {
        Extensions first = Extensions.of(Map.of("x-foo", factory.textNode("bar")));
        Extensions second = Extensions.of(Map.of("x-foo", factory.textNode("bar")));
        
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, Extensions.empty());
    }
}
