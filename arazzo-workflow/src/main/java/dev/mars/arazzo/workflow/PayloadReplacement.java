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

package dev.mars.arazzo.workflow;

import dev.mars.arazzo.tree.Extensions;

import java.util.Objects;

/**
 * Replaces the part of a request payload addressed by {@code target} (a JSON Pointer or an
 * XPath expression) with {@code value}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class PayloadReplacement {
    
    private final String target;
    private final Payload value;
    private final Extensions extensions;
    
    public PayloadReplacement(String target, Payload value, Extensions extensions) {
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getTarget() {
        return target;
    }
    
    public Payload getValue() {
        return value;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PayloadReplacement that = (PayloadReplacement) o;
        return Objects.equals(target, that.target) &&
               Objects.equals(value, that.value) &&
               Objects.equals(extensions, that.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(target, value, extensions);
    }
    
    @Override
    public String toString() {
        return "PayloadReplacement{" +
               "target='" + target + '\'' +
               ", value=" + value +
               '}';
    }
}
