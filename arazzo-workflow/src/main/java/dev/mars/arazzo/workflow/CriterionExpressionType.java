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
 * Long form of a criterion type that pins the version of the expression language, for
 * example JSONPath {@code draft-goessner-dispatch-jsonpath-00}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class CriterionExpressionType {
    
    private final CriterionType type;
    private final String version;
    private final Extensions extensions;
    
    public CriterionExpressionType(CriterionType type, String version, Extensions extensions) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        if (type != CriterionType.JSONPATH && type != CriterionType.XPATH) {
            throw new IllegalArgumentException("Expression type must be jsonpath or xpath, was " + type);
        }
        this.version = Objects.requireNonNull(version, "Version cannot be null");
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public CriterionType getType() {
        return type;
    }
    
    public String getVersion() {
        return version;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CriterionExpressionType that = (CriterionExpressionType) o;
        return type == that.type &&
               Objects.equals(version, that.version) &&
               Objects.equals(extensions, that.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, version, extensions);
    }
    
    @Override
    public String toString() {
        return "CriterionExpressionType{" +
               "type=" + type +
               ", version='" + version + '\'' +
               '}';
    }
}
