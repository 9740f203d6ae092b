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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.arazzo.tree.Extensions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered sequence of steps with its inputs, the actions shared by all of its steps and
 * the outputs it exposes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class Workflow {
    
    private final String workflowId;
    private final String summary;
    private final String description;
    private final JsonNode inputs;
    private final List<String> dependsOn;
    private final List<InlineOrReference<Parameter>> parameters;
    private final List<Step> steps;
    private final List<InlineOrReference<SuccessAction>> successActions;
    private final List<InlineOrReference<FailureAction>> failureActions;
    private final Map<String, String> outputs;
    private final Extensions extensions;
    
    public Workflow(String workflowId, String summary, String description, JsonNode inputs,
                    List<String> dependsOn, List<InlineOrReference<Parameter>> parameters, List<Step> steps,
                    List<InlineOrReference<SuccessAction>> successActions,
                    List<InlineOrReference<FailureAction>> failureActions, Map<String, String> outputs,
                    Extensions extensions) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.summary = summary;
        this.description = description;
        this.inputs = inputs != null ? inputs.deepCopy() : null;
        this.dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.steps = List.copyOf(Objects.requireNonNull(steps, "Steps cannot be null"));
        if (this.steps.isEmpty()) {
            throw new IllegalArgumentException("Workflow '" + workflowId + "' must have at least one step");
        }
        this.successActions = successActions != null ? List.copyOf(successActions) : List.of();
        this.failureActions = failureActions != null ? List.copyOf(failureActions) : List.of();
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getWorkflowId() {
        return workflowId;
    }
    
    public String getSummary() {
        return summary;
    }
    
    public String getDescription() {
        return description;
    }
    
    /**
     * @return a copy of the JSON Schema describing the inputs, or null
     */
    public JsonNode getInputs() {
        return inputs != null ? inputs.deepCopy() : null;
    }
    
    /**
     * Workflow ids that must complete before this one starts.
     */
    public List<String> getDependsOn() {
        return dependsOn;
    }
    
    public List<InlineOrReference<Parameter>> getParameters() {
        return parameters;
    }
    
    public List<Step> getSteps() {
        return steps;
    }
    
    public List<InlineOrReference<SuccessAction>> getSuccessActions() {
        return successActions;
    }
    
    public List<InlineOrReference<FailureAction>> getFailureActions() {
        return failureActions;
    }
    
    public Map<String, String> getOutputs() {
        return outputs;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    public Step getStep(String stepId) {
        return steps.stream()
                .filter(step -> step.getStepId().equals(stepId))
                .findFirst()
                .orElse(null);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow workflow = (Workflow) o;
        return Objects.equals(workflowId, workflow.workflowId) &&
               Objects.equals(summary, workflow.summary) &&
               Objects.equals(description, workflow.description) &&
               Objects.equals(inputs, workflow.inputs) &&
               Objects.equals(dependsOn, workflow.dependsOn) &&
               Objects.equals(parameters, workflow.parameters) &&
               Objects.equals(steps, workflow.steps) &&
               Objects.equals(successActions, workflow.successActions) &&
               Objects.equals(failureActions, workflow.failureActions) &&
               Objects.equals(outputs, workflow.outputs) &&
               Objects.equals(extensions, workflow.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(workflowId, summary, description, inputs, dependsOn, parameters, steps,
                successActions, failureActions, outputs, extensions);
    }
    
    @Override
    public String toString() {
        return "Workflow{" +
               "workflowId='" + workflowId + '\'' +
               ", steps=" + steps.size() +
               ", dependsOn=" + dependsOn +
               '}';
    }
}
