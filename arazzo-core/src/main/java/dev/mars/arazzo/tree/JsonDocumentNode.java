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
import dev.mars.arazzo.core.exceptions.ShapeMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DocumentNode} over a Jackson {@link JsonNode} tree.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class JsonDocumentNode extends AbstractDocumentNode {
    
    private final JsonNode node;
    
    JsonDocumentNode(JsonNode node, NodePath path) {
        super(path);
        this.node = Objects.requireNonNull(node, "Node cannot be null");
    }
    
    @Override
    public NodeKind getKind() {
        if (node.isObject()) {
            return NodeKind.MAP;
        }
        if (node.isArray()) {
            return NodeKind.SEQUENCE;
        }
        if (node.isNumber()) {
            return NodeKind.NUMBER;
        }
        if (node.isBoolean()) {
            return NodeKind.BOOLEAN;
        }
        if (node.isNull() || node.isMissingNode()) {
            return NodeKind.NULL;
        }
        // textual, binary and embedded POJO values all read as strings
        return NodeKind.STRING;
    }
    
    @Override
    public DocumentNode get(String key) throws ShapeMismatchException {
        requireKind(NodeKind.MAP);
        JsonNode value = node.get(key);
        return value != null ? new JsonDocumentNode(value, getPath().child(key)) : null;
    }
    
    @Override
    public Map<String, DocumentNode> entries() throws ShapeMismatchException {
        requireKind(NodeKind.MAP);
        Map<String, DocumentNode> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), new JsonDocumentNode(field.getValue(), getPath().child(field.getKey())));
        }
        return Collections.unmodifiableMap(entries);
    }
    
    @Override
    public List<DocumentNode> elements() throws ShapeMismatchException {
        requireKind(NodeKind.SEQUENCE);
        List<DocumentNode> elements = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            elements.add(new JsonDocumentNode(node.get(i), getPath().child(i)));
        }
        return Collections.unmodifiableList(elements);
    }
    
    @Override
    public String asText() throws ShapeMismatchException {
        requireKind(NodeKind.STRING);
        return node.asText();
    }
    
    @Override
    public Number asNumber() throws ShapeMismatchException {
        requireKind(NodeKind.NUMBER);
        return node.numberValue();
    }
    
    @Override
    public boolean asBoolean() throws ShapeMismatchException {
        requireKind(NodeKind.BOOLEAN);
        return node.booleanValue();
    }
    
    @Override
    public JsonNode toJsonNode() {
        return node.deepCopy();
    }
}
