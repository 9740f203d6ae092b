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
 * Thrown when a reusable-object reference does not name an existing component of the
 * expected kind.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class DanglingReferenceException extends DocumentException {
    
    private final String reference;
    private final String expectedKind;
    
    public DanglingReferenceException(NodePath path, String reference, String expectedKind) {
        super(ErrorKind.DANGLING_REFERENCE, path,
                "Reference '" + reference + "' does not resolve to a " + expectedKind + " in components");
        this.reference = reference;
        this.expectedKind = expectedKind;
    }
    
    public String getReference() {
        return reference;
    }
    
    public String getExpectedKind() {
        return expectedKind;
    }
}
