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
 * Thrown when a value has the right type but breaks a rule of the format: an empty
 * required string, an unknown enumeration value, a name pattern, or a field that is
 * only allowed (or only required) together with another.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ConstraintViolationException extends DocumentException {
    
    public ConstraintViolationException(NodePath path, String message) {
        super(ErrorKind.CONSTRAINT_VIOLATION, path, message);
    }
}
