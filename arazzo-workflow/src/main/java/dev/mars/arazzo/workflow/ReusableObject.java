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
 * A reference to a named entry of the {@link Components}, such as
 * {@code $components.parameters.page}.
 *
 * <p>The reference is kept as text. Whether it resolves is checked once, after the whole
 * description is built; the model never holds a pointer to the referenced component.
 * Parameter references may override the component's value.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ReusableObject {
    
    private final String reference;
    private final ReusableKind targetKind;
    private final Payload value;
    
    public ReusableObject(String reference, ReusableKind targetKind, Payload value) {
        this.reference = Objects.requireNonNull(reference, "Reference cannot be null");
        this.targetKind = Objects.requireNonNull(targetKind, "Target kind cannot be null");
        if (value != null && targetKind != ReusableKind.PARAMETER) {
            throw new IllegalArgumentException("Only parameter references can override a value");
        }
        this.value = value;
    }
    
    public ReusableObject(String reference, ReusableKind targetKind) {
        this(reference, targetKind, null);
    }
    
    public String getReference() {
        return reference;
    }
    
    public ReusableKind getTargetKind() {
        return targetKind;
    }
    
    /**
     * @return the overriding value, or null to use the component's own
     */
    public Payload getValue() {
        return value;
    }
    
    /**
     * Returns the component name this reference points at, or null if the reference is not
     * of the form {@code $components.<section>.<name>} for the target kind's section.
     */
    public String getComponentName() {
        String prefix = targetKind.getReferencePrefix();
        if (!reference.startsWith(prefix) || reference.length() == prefix.length()) {
            return null;
        }
        return reference.substring(prefix.length());
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReusableObject that = (ReusableObject) o;
        return Objects.equals(reference, that.reference) &&
               targetKind == that.targetKind &&
               Objects.equals(value, that.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(reference, targetKind, value);
    }
    
    @Override
    public String toString() {
        return "ReusableObject{" +
               "reference='" + reference + '\'' +
               ", targetKind=" + targetKind +
               (value != null ? ", value=" + value : "") +
               '}';
    }
}
