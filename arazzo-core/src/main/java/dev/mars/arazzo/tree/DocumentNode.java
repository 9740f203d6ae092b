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
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.DuplicateIdentifierException;
import dev.mars.arazzo.core.exceptions.ShapeMismatchException;

import java.util.List;
import java.util.Map;

/**
 * Read-only, representation-independent view over a node of a parsed JSON or YAML document.
 *
 * <p>Builders only ever see this interface; they never inspect the concrete tree. Every
 * node knows its {@link NodePath} from the document root so errors can be located
 * without re-walking the tree. Typed access on a node of the wrong kind fails with a
 * {@link ShapeMismatchException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 * @see DocumentNodes
 */
public interface DocumentNode {
    
    NodeKind getKind();
    
    NodePath getPath();
    
    default boolean isMap() {
        return getKind() == NodeKind.MAP;
    }
    
    default boolean isSequence() {
        return getKind() == NodeKind.SEQUENCE;
    }
    
    default boolean isString() {
        return getKind() == NodeKind.STRING;
    }
    
    default boolean isNumber() {
        return getKind() == NodeKind.NUMBER;
    }
    
    default boolean isBoolean() {
        return getKind() == NodeKind.BOOLEAN;
    }
    
    default boolean isNull() {
        return getKind() == NodeKind.NULL;
    }
    
    /**
     * Returns true if this node is a map containing the given key. Never fails.
     */
    boolean has(String key);
    
    /**
     * Returns the entry for the given key, or null when the map has no such key.
     *
     * @throws ShapeMismatchException if this node is not a map
     */
    DocumentNode get(String key) throws ShapeMismatchException;
    
    /**
     * Returns the map entries in document order.
     *
     * @throws ShapeMismatchException if this node is not a map
     * @throws DuplicateIdentifierException if two keys of the map read as the same string
     */
    Map<String, DocumentNode> entries() throws DocumentException;
    
    /**
     * @throws ShapeMismatchException if this node is not a sequence
     */
    List<DocumentNode> elements() throws ShapeMismatchException;
    
    /**
     * @throws ShapeMismatchException if this node is not a string
     */
    String asText() throws ShapeMismatchException;
    
    /**
     * @throws ShapeMismatchException if this node is not a number
     */
    Number asNumber() throws ShapeMismatchException;
    
    /**
     * @throws ShapeMismatchException if this node is not a boolean
     */
    boolean asBoolean() throws ShapeMismatchException;
    
    /**
     * Copies this node and everything below it into a Jackson tree, the representation
     * used for opaque fragments (extension values, structured payloads, schemas).
     */
    JsonNode toJsonNode();
}
