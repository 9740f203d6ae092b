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
 * What a step invokes: an operation by id, an operation by JSON Pointer into a source
 * description, or another workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public final class OperationReference {
    
    public enum Kind {
        OPERATION_ID("operationId"),
        OPERATION_PATH("operationPath"),
        WORKFLOW_ID("workflowId");
        
        private final String fieldName;
        
        Kind(String fieldName) {
            this.fieldName = fieldName;
        }
        
        public String getFieldName() {
            return fieldName;
        }
        
        /**
         * True for the kinds that call an API operation rather than a workflow.
         */
        public boolean isOperation() {
            return this != WORKFLOW_ID;
        }
    }
    
    private final Kind kind;
    private final String value;
    
    public OperationReference(Kind kind, String value) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }
    
    public static OperationReference operationId(String operationId) {
        return new OperationReference(Kind.OPERATION_ID, operationId);
    }
    
    public static OperationReference operationPath(String operationPath) {
        return new OperationReference(Kind.OPERATION_PATH, operationPath);
    }
    
    public static OperationReference workflowId(String workflowId) {
        return new OperationReference(Kind.WORKFLOW_ID, workflowId);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public String getValue() {
        return value;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationReference that = (OperationReference) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }
    
    @Override
    public String toString() {
        return kind.getFieldName() + "=" + value;
    }
}
