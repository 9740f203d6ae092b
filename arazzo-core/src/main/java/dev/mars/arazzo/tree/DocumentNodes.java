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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry points for wrapping concrete document trees, and the conversion from the Jackson
 * fragment representation back into a SnakeYAML-ready object graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class DocumentNodes {
    
    private DocumentNodes() {
    }
    
    /**
     * Wraps the root of a Jackson tree.
     */
    public static DocumentNode ofJson(JsonNode root) {
        return new JsonDocumentNode(root, NodePath.root());
    }
    
    /**
     * Wraps the root of a SnakeYAML object graph, as returned by {@code Yaml.load}.
     */
    public static DocumentNode ofYaml(Object root) {
        return new YamlDocumentNode(root, NodePath.root());
    }
    
    /**
     * Converts a Jackson tree into the plain object graph SnakeYAML can dump. Map order is
     * preserved; numbers keep their Java type so integers stay integers.
     */
    public static Object toYamlObject(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), toYamlObject(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                list.add(toYamlObject(element));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }
}
