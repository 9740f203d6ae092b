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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a node is accessed as a kind it is not.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ShapeMismatchException extends DocumentException {
    
    private final List<NodeKind> expectedKinds;
    private final NodeKind actualKind;
    
    public ShapeMismatchException(NodePath path, NodeKind expectedKind, NodeKind actualKind) {
        this(path, List.of(expectedKind), actualKind);
    }
    
    public ShapeMismatchException(NodePath path, List<NodeKind> expectedKinds, NodeKind actualKind) {
        super(ErrorKind.SHAPE_MISMATCH, path, "Expected " + describe(expectedKinds) + " but found " + actualKind);
        this.expectedKinds = List.copyOf(expectedKinds);
        this.actualKind = actualKind;
    }
    
    public List<NodeKind> getExpectedKinds() {
        return expectedKinds;
    }
    
    public NodeKind getExpectedKind() {
        return expectedKinds.get(0);
    }
    
    public NodeKind getActualKind() {
        return actualKind;
    }
    
    private static String describe(List<NodeKind> kinds) {
        return kinds.stream().map(NodeKind::name).collect(Collectors.joining(" or "));
    }
}
