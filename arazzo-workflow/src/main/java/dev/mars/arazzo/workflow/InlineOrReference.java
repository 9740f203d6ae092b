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

import java.util.Objects;

/**
 * Either an entity defined in place or a {@link ReusableObject} naming one in the
 * components. Used for parameter, success action and failure action lists.
 *
 * @param <T> the inline entity type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public final class InlineOrReference<T> {
    
    private final T inline;
    private final ReusableObject reference;
    
    private InlineOrReference(T inline, ReusableObject reference) {
        this.inline = inline;
        this.reference = reference;
    }
    
    public static <T> InlineOrReference<T> inline(T value) {
        return new InlineOrReference<>(Objects.requireNonNull(value, "Inline value cannot be null"), null);
    }
    
    public static <T> InlineOrReference<T> reference(ReusableObject reference) {
        return new InlineOrReference<>(null, Objects.requireNonNull(reference, "Reference cannot be null"));
    }
    
    public boolean isReference() {
        return reference != null;
    }
    
    public boolean isInline() {
        return inline != null;
    }
    
    /**
     * @return the inline entity, or null if this is a reference
     */
    public T getInline() {
        return inline;
    }
    
    /**
     * @return the reference, or null if this is an inline entity
     */
    public ReusableObject getReference() {
        return reference;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InlineOrReference<?> that = (InlineOrReference<?>) o;
        return Objects.equals(inline, that.inline) &&
               Objects.equals(reference, that.reference);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(inline, reference);
    }
    
    @Override
    public String toString() {
        return isReference() ? reference.toString() : String.valueOf(inline);
    }
}
