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
 * A condition checked against the outcome of a step, used in success criteria and to
 * decide whether an action applies.
 *
 * <p>The type is given either as a plain name or as a {@link CriterionExpressionType};
 * at most one of the two is set. When neither is set the condition is a simple one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class Criterion {
    
    private final String condition;
    private final String context;
    private final CriterionType type;
    private final CriterionExpressionType expressionType;
    private final Extensions extensions;
    
    public Criterion(String condition, String context, CriterionType type,
                     CriterionExpressionType expressionType, Extensions extensions) {
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null");
        if (type != null && expressionType != null) {
            throw new IllegalArgumentException("A criterion type is either a name or an expression type, not both");
        }
        this.context = context;
        this.type = type;
        this.expressionType = expressionType;
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getCondition() {
        return condition;
    }
    
    public String getContext() {
        return context;
    }
    
    /**
     * @return the type as written by name, or null
     */
    public CriterionType getType() {
        return type;
    }
    
    /**
     * @return the long-form type, or null
     */
    public CriterionExpressionType getExpressionType() {
        return expressionType;
    }
    
    public CriterionType getEffectiveType() {
        if (expressionType != null) {
            return expressionType.getType();
        }
        return type != null ? type : CriterionType.SIMPLE;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Criterion criterion = (Criterion) o;
        return Objects.equals(condition, criterion.condition) &&
               Objects.equals(context, criterion.context) &&
               type == criterion.type &&
               Objects.equals(expressionType, criterion.expressionType) &&
               Objects.equals(extensions, criterion.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(condition, context, type, expressionType, extensions);
    }
    
    @Override
    public String toString() {
        return "Criterion{" +
               "condition='" + condition + '\'' +
               ", context='" + context + '\'' +
               ", type=" + getEffectiveType() +
               '}';
    }
}
