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

import java.util.List;

/**
 * Thrown when a polymorphic field cannot be resolved to exactly one of its candidate shapes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class InvalidUnionException extends DocumentException {
    
    private final List<String> candidates;
    
    public InvalidUnionException(NodePath path, List<String> candidates, String message) {
        super(ErrorKind.AMBIGUOUS_OR_INVALID_UNION, path, message + " (candidates: " + candidates + ")");
        this.candidates = List.copyOf(candidates);
    }
    
    public List<String> getCandidates() {
        return candidates;
    }
}
