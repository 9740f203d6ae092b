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

package dev.mars.arazzo.core.exceptions;

import dev.mars.arazzo.tree.NodePath;

import java.util.Objects;

/**
 * Exception thrown when a document tree cannot be turned into a typed Arazzo model.
 * Carries the {@link ErrorKind} and the path from the document root to the offending node,
 * so callers can pinpoint the field without walking the tree again.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class DocumentException extends ArazzoException {
    
    private final ErrorKind kind;
    private final NodePath path;
    
    public DocumentException(ErrorKind kind, NodePath path, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.path = path != null ? path : NodePath.root();
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    public NodePath getPath() {
        return path;
    }
    
    /**
     * Returns the message without the kind and path prefix.
     */
    public String getDetail() {
        return super.getMessage();
    }
    
    @Override
    public String getMessage() {
        return kind + " at '" + path + "': " + super.getMessage();
    }
}
