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

import dev.mars.arazzo.core.exceptions.ShapeMismatchException;

import java.util.Objects;

/**
 * Shared path handling and kind checks for the concrete document node adapters.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
abstract class AbstractDocumentNode implements DocumentNode {
    
    private final NodePath path;
    
    protected AbstractDocumentNode(NodePath path) {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
    }
    
    @Override
    public NodePath getPath() {
        return path;
    }
    
    @Override
    public boolean has(String key) {
        if (!isMap()) {
            return false;
        }
        try {
            return get(key) != null;
        } catch (ShapeMismatchException e) {
            throw new IllegalStateException("Map node rejected map access at " + path, e);
        }
    }
    
    protected void requireKind(NodeKind expected) throws ShapeMismatchException {
        if (getKind() != expected) {
            throw new ShapeMismatchException(path, expected, getKind());
        }
    }
    
    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
               "kind=" + getKind() +
               ", path=" + path +
               '}';
    }
}
