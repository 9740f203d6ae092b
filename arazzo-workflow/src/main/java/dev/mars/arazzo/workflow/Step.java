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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single call within a workflow, either to an API operation or to another workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class Step {
    
    private final String stepId;
    private final String description;
    private final OperationReference operation;
    private final List<InlineOrReference<Parameter>> parameters;
    private final RequestBody requestBody;
    private final List<Criterion> successCriteria;
    private final List<InlineOrReference<SuccessAction>> onSuccess;
    private final List<InlineOrReference<FailureAction>> onFailure;
    private final Map<String, String> outputs;
    private final Extensions extensions;
    
    public Step(String stepId, String description, OperationReference operation,
                List<InlineOrReference<Parameter>> parameters, RequestBody requestBody,
                List<Criterion> successCriteria, List<InlineOrReference<SuccessAction>> onSuccess,
                List<InlineOrReference<FailureAction>> onFailure, Map<String, String> outputs,
                Extensions extensions) {
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.description = description;
        this.operation = Objects.requireNonNull(operation, "Operation reference cannot be null");
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.requestBody = requestBody;
        this.successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
        this.onSuccess = onSuccess != null ? List.copyOf(onSuccess) : List.of();
        this.onFailure = onFailure != null ? List.copyOf(onFailure) : List.of();
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getStepId() {
        return stepId;
    }
    
    public String getDescription() {
        return description;
    }
    
    public OperationReference getOperation() {
        return operation;
    }
    
    public List<InlineOrReference<Parameter>> getParameters() {
        return parameters;
    }
    
    public RequestBody getRequestBody() {
        return requestBody;
    }
    
    public List<Criterion> getSuccessCriteria() {
        return successCriteria;
    }
    
    public List<InlineOrReference<SuccessAction>> getOnSuccess() {
        return onSuccess;
    }
    
    public List<InlineOrReference<FailureAction>> getOnFailure() {
        return onFailure;
    }
    
    /**
     * Output name to runtime expression, in document order.
     */
    public Map<String, String> getOutputs() {
        return outputs;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Step step = (Step) o;
        return Objects.equals(stepId, step.stepId) &&
               Objects.equals(description, step.description) &&
               Objects.equals(operation, step.operation) &&
               Objects.equals(parameters, step.parameters) &&
               Objects.equals(requestBody, step.requestBody) &&
               Objects.equals(successCriteria, step.successCriteria) &&
               Objects.equals(onSuccess, step.onSuccess) &&
               Objects.equals(onFailure, step.onFailure) &&
               Objects.equals(outputs, step.outputs) &&
               Objects.equals(extensions, step.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(stepId, description, operation, parameters, requestBody, successCriteria,
                onSuccess, onFailure, outputs, extensions);
    }
    
    @Override
    public String toString() {
        return "Step{" +
               "stepId='" + stepId + '\'' +
               ", operation=" + operation +
               ", parameters=" + parameters.size() +
               ", outputs=" + outputs.keySet() +
               '}';
    }
}
