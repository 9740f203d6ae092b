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

import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a document without keeping the model: the error that stopped the
 * build, if any, plus every warning raised along the way.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ValidationResult {
    
    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;
    
    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }
    
    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }
    
    public void addError(DocumentException exception) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, exception.getKind(),
                exception.getPath().toString(), exception.getDetail()));
    }
    
    public void addError(ErrorKind kind, String fieldPath, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, kind, fieldPath, message));
    }
    
    public void addWarning(String fieldPath, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, null, fieldPath, message));
    }
    
    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }
    
    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }
    
    public boolean isValid() {
        return errors.isEmpty();
    }
    
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
    
    public int getErrorCount() {
        return errors.size();
    }
    
    public int getWarningCount() {
        return warnings.size();
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }
    
    /**
     * A single error or warning, located by the path of the offending node.
     */
    public static class ValidationIssue {
        
        public enum Severity {
            ERROR, WARNING
        }
        
        private final Severity severity;
        private final ErrorKind kind;
        private final String fieldPath;
        private final String message;
        
        public ValidationIssue(Severity severity, ErrorKind kind, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.kind = kind;
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }
        
        public Severity getSeverity() {
            return severity;
        }
        
        /**
         * @return the error kind, or null for warnings
         */
        public ErrorKind getKind() {
            return kind;
        }
        
        public String getFieldPath() {
            return fieldPath;
        }
        
        public String getMessage() {
            return message;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   kind == that.kind &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   Objects.equals(message, that.message);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(severity, kind, fieldPath, message);
        }
        
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity.name());
            
            if (kind != null) {
                sb.append(" ").append(kind);
            }
            
            if (fieldPath != null) {
                sb.append(" [").append(fieldPath).append("]");
            }
            
            sb.append(": ").append(message);
            
            return sb.toString();
        }
    }
}
