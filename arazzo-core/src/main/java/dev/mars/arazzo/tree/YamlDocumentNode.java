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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.DuplicateIdentifierException;
import dev.mars.arazzo.core.exceptions.ShapeMismatchException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DocumentNode} over the object graph SnakeYAML's {@code SafeConstructor} produces:
 * {@link Map}, {@link List}, {@link String}, {@link Integer}/{@link Long}/{@link BigInteger},
 * {@link Double}, {@link Boolean} and {@code null}.
 *
 * <p>Non-string map keys are read through {@link String#valueOf(Object)}; two keys that
 * read the same, such as {@code 1} and {@code '1'}, make the map invalid. Timestamps
 * ({@link Date}) read as strings in ISO-8601 instant form.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class YamlDocumentNode extends AbstractDocumentNode {
    
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;
    
    private final Object value;
    
    YamlDocumentNode(Object value, NodePath path) {
        super(path);
        this.value = value;
    }
    
    @Override
    public NodeKind getKind() {
        return kindOf(value);
    }
    
    private static NodeKind kindOf(Object value) {
        if (value == null) {
            return NodeKind.NULL;
        }
        if (value instanceof Map) {
            return NodeKind.MAP;
        }
        if (value instanceof List || value instanceof Collection) {
            return NodeKind.SEQUENCE;
        }
        if (value instanceof Number) {
            return NodeKind.NUMBER;
        }
        if (value instanceof Boolean) {
            return NodeKind.BOOLEAN;
        }
        return NodeKind.STRING;
    }
    
    @Override
    public DocumentNode get(String key) throws ShapeMismatchException {
        requireKind(NodeKind.MAP);
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (key.equals(String.valueOf(entry.getKey()))) {
                return new YamlDocumentNode(entry.getValue(), getPath().child(key));
            }
        }
        return null;
    }
    
    @Override
    public Map<String, DocumentNode> entries() throws DocumentException {
        requireKind(NodeKind.MAP);
        Map<String, DocumentNode> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            String key = String.valueOf(entry.getKey());
            NodePath path = getPath().child(key);
            if (entries.put(key, new YamlDocumentNode(entry.getValue(), path)) != null) {
                throw new DuplicateIdentifierException(path, key);
            }
        }
        return Collections.unmodifiableMap(entries);
    }
    
    @Override
    public List<DocumentNode> elements() throws ShapeMismatchException {
        requireKind(NodeKind.SEQUENCE);
        List<DocumentNode> elements = new ArrayList<>();
        int index = 0;
        for (Object element : (Collection<?>) value) {
            elements.add(new YamlDocumentNode(element, getPath().child(index++)));
        }
        return Collections.unmodifiableList(elements);
    }
    
    @Override
    public String asText() throws ShapeMismatchException {
        requireKind(NodeKind.STRING);
        return textOf(value);
    }
    
    @Override
    public Number asNumber() throws ShapeMismatchException {
        requireKind(NodeKind.NUMBER);
        return (Number) value;
    }
    
    @Override
    public boolean asBoolean() throws ShapeMismatchException {
        requireKind(NodeKind.BOOLEAN);
        return (Boolean) value;
    }
    
    @Override
    public JsonNode toJsonNode() {
        return toJson(value);
    }
    
    private static String textOf(Object value) {
        if (value instanceof Date) {
            return DateTimeFormatter.ISO_INSTANT.format(((Date) value).toInstant());
        }
        if (value instanceof byte[]) {
            return java.util.Base64.getEncoder().encodeToString((byte[]) value);
        }
        return String.valueOf(value);
    }
    
    private static JsonNode toJson(Object value) {
        switch (kindOf(value)) {
            case NULL:
                return FACTORY.nullNode();
            case MAP: {
                ObjectNode object = FACTORY.objectNode();
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    object.set(String.valueOf(entry.getKey()), toJson(entry.getValue()));
                }
                return object;
            }
            case SEQUENCE: {
                ArrayNode array = FACTORY.arrayNode();
                for (Object element : (Collection<?>) value) {
                    array.add(toJson(element));
                }
                return array;
            }
            case NUMBER:
                return numberNode((Number) value);
            case BOOLEAN:
                return FACTORY.booleanNode((Boolean) value);
            default:
                return FACTORY.textNode(textOf(value));
        }
    }
    
    private static JsonNode numberNode(Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return FACTORY.numberNode(number.intValue());
        }
        if (number instanceof Long) {
            return FACTORY.numberNode(number.longValue());
        }
        if (number instanceof BigInteger) {
            return FACTORY.numberNode((BigInteger) number);
        }
        if (number instanceof BigDecimal) {
            return FACTORY.numberNode((BigDecimal) number);
        }
        if (number instanceof Float) {
            return FACTORY.numberNode(number.floatValue());
        }
        return FACTORY.numberNode(number.doubleValue());
    }
}
