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

/**
 * Thrown when two entities in a scope that requires unique names share one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class DuplicateIdentifierException extends DocumentException {
    
    private final String name;
    
    public DuplicateIdentifierException(NodePath path, String name) {
        super(ErrorKind.DUPLICATE_IDENTIFIER, path, "Duplicate identifier '" + name + "'");
        this.name = name;
    }
    
    public String getName() {
        return name;
    }
}
