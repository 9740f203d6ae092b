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
import dev.mars.arazzo.core.exceptions.ConstraintViolationException;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.MissingFieldException;
import dev.mars.arazzo.core.exceptions.ShapeMismatchException;
import dev.mars.arazzo.core.exceptions.TypeMismatchException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed field extraction from map nodes.
 *
 * <p>Required accessors fail with {@link MissingFieldException} when the key is absent and
 * with {@link TypeMismatchException} (scalars) or {@link ShapeMismatchException} (maps and
 * sequences) when the value has the wrong kind. Optional accessors treat an absent key and an
 * explicit {@code null} the same way and return null or an empty collection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class NodeFields {
    
    private NodeFields() {
    }
    
    /**
     * Returns the node itself after checking it is a map.
     */
    public static DocumentNode requireMap(DocumentNode node) throws ShapeMismatchException {
        if (!node.isMap()) {
            throw new ShapeMismatchException(node.getPath(), NodeKind.MAP, node.getKind());
        }
        return node;
    }
    
    /**
     * Returns true if the map holds {@code key} with a non-null value.
     */
    public static boolean isPresent(DocumentNode map, String key) throws ShapeMismatchException {
        return optional(map, key) != null;
    }
    
    public static String requireString(DocumentNode map, String key) throws DocumentException {
        return stringValue(require(map, key), key);
    }
    
    public static String requireNonEmptyString(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = require(map, key);
        String text = stringValue(value, key);
        if (text.trim().isEmpty()) {
            throw new ConstraintViolationException(value.getPath(), "Field '" + key + "' cannot be empty");
        }
        return text;
    }
    
    public static String optionalString(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = optional(map, key);
        return value != null ? stringValue(value, key) : null;
    }
    
    public static Double optionalNumber(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = optional(map, key);
        if (value == null) {
            return null;
        }
        if (!value.isNumber()) {
            throw new TypeMismatchException(value.getPath(), key, "a number", value.getKind());
        }
        return value.asNumber().doubleValue();
    }
    
    public static Integer optionalInteger(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = optional(map, key);
        if (value == null) {
            return null;
        }
        if (!value.isNumber() || !isInteger(value.asNumber())) {
            throw new TypeMismatchException(value.getPath(), key, "an integer", value.getKind());
        }
        return value.asNumber().intValue();
    }
    
    public static Boolean optionalBoolean(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = optional(map, key);
        if (value == null) {
            return null;
        }
        if (!value.isBoolean()) {
            throw new TypeMismatchException(value.getPath(), key, "a boolean", value.getKind());
        }
        return value.asBoolean();
    }
    
    public static DocumentNode requireMapField(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = map.get(key);
        if (value == null) {
            throw new MissingFieldException(map.getPath(), key);
        }
        return requireMap(value);
    }
    
    public static DocumentNode optionalMapField(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = optional(map, key);
        return value != null ? requireMap(value) : null;
    }
    
    public static List<DocumentNode> requireSequenceField(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = map.get(key);
        if (value == null) {
            throw new MissingFieldException(map.getPath(), key);
        }
        if (!value.isSequence()) {
            throw new ShapeMismatchException(value.getPath(), NodeKind.SEQUENCE, value.getKind());
        }
        return value.elements();
    }
    
    public static List<DocumentNode> optionalSequenceField(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = optional(map, key);
        if (value == null) {
            return List.of();
        }
        if (!value.isSequence()) {
            throw new ShapeMismatchException(value.getPath(), NodeKind.SEQUENCE, value.getKind());
        }
        return value.elements();
    }
    
    public static List<String> optionalStringList(DocumentNode map, String key) throws DocumentException {
        List<String> result = new ArrayList<>();
        for (DocumentNode element : optionalSequenceField(map, key)) {
            result.add(stringValue(element, key));
        }
        return Collections.unmodifiableList(result);
    }
    
    /**
     * Reads a map whose values must all be strings, keeping document order.
     */
    public static Map<String, String> optionalStringMap(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = optionalMapField(map, key);
        if (value == null) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : value.entries().entrySet()) {
            result.put(entry.getKey(), stringValue(entry.getValue(), entry.getKey()));
        }
        return Collections.unmodifiableMap(result);
    }
    
    /**
     * Collects every extension entry of the map that is not one of the consumed keys.
     */
    public static Extensions extensions(DocumentNode map, Set<String> consumedKeys) throws DocumentException {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : map.entries().entrySet()) {
            if (Extensions.isExtensionKey(entry.getKey()) && !consumedKeys.contains(entry.getKey())) {
                values.put(entry.getKey(), entry.getValue().toJsonNode());
            }
        }
        return Extensions.of(values);
    }
    
    /**
     * Returns the keys of the map that are neither known fields nor extensions.
     */
    public static List<String> unknownKeys(DocumentNode map, Set<String> knownKeys) throws DocumentException {
        List<String> unknown = new ArrayList<>();
        for (String key : map.entries().keySet()) {
            if (!knownKeys.contains(key) && !Extensions.isExtensionKey(key)) {
                unknown.add(key);
            }
        }
        return unknown;
    }
    
    private static DocumentNode require(DocumentNode map, String key) throws DocumentException {
        DocumentNode value = map.get(key);
        if (value == null) {
            throw new MissingFieldException(map.getPath(), key);
        }
        return value;
    }
    
    private static DocumentNode optional(DocumentNode map, String key) throws ShapeMismatchException {
        DocumentNode value = map.get(key);
        return value == null || value.isNull() ? null : value;
    }
    
    private static String stringValue(DocumentNode value, String key) throws DocumentException {
        if (!value.isString()) {
            throw new TypeMismatchException(value.getPath(), key, "a string", value.getKind());
        }
        return value.asText();
    }
    
    private static boolean isInteger(Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return true;
        }
        if (number instanceof Long || number instanceof BigInteger) {
            return new BigInteger(number.toString()).bitLength() < 32;
        }
        double value = number.doubleValue();
        return value == Math.rint(value) && !Double.isInfinite(value)
                && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
