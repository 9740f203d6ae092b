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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Vendor extension fields of one entity: every key starting with {@value #PREFIX}, mapped to
 * an opaque Jackson fragment. Keys are kept with their prefix and in document order so they
 * can be re-emitted verbatim.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class Extensions {
    
    public static final String PREFIX = "x-";
    
    private static final Extensions EMPTY = new Extensions(Map.of());
    
    private final Map<String, JsonNode> values;
    
    private Extensions(Map<String, JsonNode> values) {
        this.values = values;
    }
    
    public static Extensions empty() {
        return EMPTY;
    }
    
    /**
     * @throws IllegalArgumentException if a key does not carry the extension prefix
     */
    public static Extensions of(Map<String, JsonNode> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : values.entrySet()) {
            if (!isExtensionKey(entry.getKey())) {
                throw new IllegalArgumentException("Extension key must start with '" + PREFIX + "': " + entry.getKey());
            }
            copy.put(entry.getKey(), Objects.requireNonNull(entry.getValue(), "Extension value cannot be null").deepCopy());
        }
        return new Extensions(Collections.unmodifiableMap(copy));
    }
    
    public static boolean isExtensionKey(String key) {
        return key != null && key.startsWith(PREFIX);
    }
    
    /**
     * Returns a copy of the value stored under {@code key}, or null when absent.
     */
    public JsonNode get(String key) {
        JsonNode value = values.get(key);
        return value != null ? value.deepCopy() : null;
    }
    
    public Set<String> keys() {
        return values.keySet();
    }
    
    /**
     * Returns an unmodifiable, ordered map of copies of every extension value.
     */
    public Map<String, JsonNode> asMap() {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key, value.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }
    
    public boolean isEmpty() {
        return values.isEmpty();
    }
    
    public int size() {
        return values.size();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Extensions that = (Extensions) o;
        return values.equals(that.values);
    }
    
    @Override
    public int hashCode() {
        return values.hashCode();
    }
    
    @Override
    public String toString() {
        return "Extensions" + values;
    }
}
