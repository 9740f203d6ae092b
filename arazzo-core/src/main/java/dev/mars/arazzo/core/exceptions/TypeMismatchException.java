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

import dev.mars.arazzo.tree.NodeKind;
import dev.mars.arazzo.tree.NodePath;

/**
 * Thrown when a scalar field is present but holds a value of the wrong type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class TypeMismatchException extends DocumentException {
    
    private final String key;
    private final String expected;
    private final NodeKind actual;
    
    public TypeMismatchException(NodePath fieldPath, String key, String expected, NodeKind actual) {
        super(ErrorKind.TYPE_MISMATCH, fieldPath,
                "Field '" + key + "' must be " + expected + " but was " + actual);
        this.key = key;
        this.expected = expected;
        this.actual = actual;
    }
    
    public String getKey() {
        return key;
    }
    
    public String getExpected() {
        return expected;
    }
    
    public NodeKind getActual() {
        return actual;
    }
}
