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
 * Where a goto or retry action transfers control: another workflow or a step of the
 * current workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public final class ActionTarget {
    
    public enum Kind {
        WORKFLOW("workflowId"),
        STEP("stepId");
        
        private final String fieldName;
        
        Kind(String fieldName) {
            this.fieldName = fieldName;
        }
        
        /**
         * Document key holding the target id.
         */
        public String getFieldName() {
            return fieldName;
        }
    }
    
    private final Kind kind;
    private final String id;
    
    private ActionTarget(Kind kind, String id) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.id = Objects.requireNonNull(id, "Target id cannot be null");
    }
    
    public static ActionTarget workflow(String workflowId) {
        return new ActionTarget(Kind.WORKFLOW, workflowId);
    }
    
    public static ActionTarget step(String stepId) {
        return new ActionTarget(Kind.STEP, stepId);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public String getId() {
        return id;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionTarget that = (ActionTarget) o;
        return kind == that.kind && Objects.equals(id, that.id);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }
    
    @Override
    public String toString() {
        return kind.getFieldName() + "=" + id;
    }
}
