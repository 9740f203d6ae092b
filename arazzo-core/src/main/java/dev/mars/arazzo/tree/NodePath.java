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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable location of a node inside a document, as the sequence of map keys and
 * sequence indices leading to it from the root.
 *
 * <p>Rendered as {@code workflows[0].steps[2].stepId}. Keys that contain a dot or a
 * bracket are quoted ({@code outputs['a.b']}). The root renders as {@code $}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class NodePath {
    
    private static final NodePath ROOT = new NodePath(List.of());
    
    private final List<Object> segments;
    
    private NodePath(List<Object> segments) {
        this.segments = segments;
    }
    
    public static NodePath root() {
        return ROOT;
    }
    
    /**
     * Builds a path from raw segments; each segment is either a {@link String} key or an
     * {@link Integer} index.
     */
    public static NodePath of(Object... segments) {
        NodePath path = ROOT;
        for (Object segment : segments) {
            if (segment instanceof Integer) {
                path = path.child((Integer) segment);
            } else {
                path = path.child(String.valueOf(segment));
            }
        }
        return path;
    }
    
    public NodePath child(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return append(key);
    }
    
    public NodePath child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Index cannot be negative: " + index);
        }
        return append(index);
    }
    
    private NodePath append(Object segment) {
        List<Object> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(segment);
        return new NodePath(Collections.unmodifiableList(extended));
    }
    
    public List<Object> getSegments() {
        return segments;
    }
    
    public boolean isRoot() {
        return segments.isEmpty();
    }
    
    public int depth() {
        return segments.size();
    }
    
    /**
     * Returns the last segment, or null for the root.
     */
    public Object getLastSegment() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodePath that = (NodePath) o;
        return segments.equals(that.segments);
    }
    
    @Override
    public int hashCode() {
        return segments.hashCode();
    }
    
    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return "$";
        }
        StringBuilder sb = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else {
                String key = (String) segment;
                if (key.contains(".") || key.contains("[") || key.contains("]")) {
                    sb.append("['").append(key).append("']");
                } else {
                    if (sb.length() > 0) {
                        sb.append('.');
                    }
                    sb.append(key);
                }
            }
        }
        return sb.toString();
    }
}
