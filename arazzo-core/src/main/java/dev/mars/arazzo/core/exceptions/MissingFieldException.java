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
 * Thrown when a required field is absent from a map node. The path is the path the field
 * would have had, i.e. the owning map's path extended with the key.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class MissingFieldException extends DocumentException {
    
    private final String key;
    
    public MissingFieldException(NodePath parentPath, String key) {
        this(parentPath, key, "Required field '" + key + "' is missing");
    }
    
    public MissingFieldException(NodePath parentPath, String key, String message) {
        super(ErrorKind.MISSING_FIELD, parentPath.child(key), message);
        this.key = key;
    }
    
    public String getKey() {
        return key;
    }
}
