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
import java.util.Map;
import java.util.Objects;

/**
 * Named, reusable objects that steps and workflows point at with
 * {@code $components.<section>.<name>}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class Components {
    
    private final Map<String, JsonNode> inputs;
    private final Map<String, Parameter> parameters;
    private final Map<String, SuccessAction> successActions;
    private final Map<String, FailureAction> failureActions;
    private final Extensions extensions;
    
    public Components(Map<String, JsonNode> inputs, Map<String, Parameter> parameters,
                      Map<String, SuccessAction> successActions, Map<String, FailureAction> failureActions,
                      Extensions extensions) {
        Map<String, JsonNode> inputCopies = new LinkedHashMap<>();
        if (inputs != null) {
            inputs.forEach((name, schema) -> inputCopies.put(name, schema.deepCopy()));
        }
        this.inputs = Collections.unmodifiableMap(inputCopies);
        this.parameters = ordered(parameters);
        this.successActions = ordered(successActions);
        this.failureActions = ordered(failureActions);
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    /**
     * Input JSON Schemas by name, as an unmodifiable map of copies.
     */
    public Map<String, JsonNode> getInputs() {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        inputs.forEach((name, schema) -> copy.put(name, schema.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }
    
    public Map<String, Parameter> getParameters() {
        return parameters;
    }
    
    public Map<String, SuccessAction> getSuccessActions() {
        return successActions;
    }
    
    public Map<String, FailureAction> getFailureActions() {
        return failureActions;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    /**
     * Returns true if a component of the given kind exists under the given name.
     */
    public boolean contains(ReusableKind kind, String name) {
        switch (kind) {
            case PARAMETER:
                return parameters.containsKey(name);
            case SUCCESS_ACTION:
                return successActions.containsKey(name);
            case FAILURE_ACTION:
                return failureActions.containsKey(name);
            default:
                return false;
        }
    }
    
    public boolean isEmpty() {
        return inputs.isEmpty() && parameters.isEmpty() && successActions.isEmpty()
                && failureActions.isEmpty() && extensions.isEmpty();
    }
    
    private static <T> Map<String, T> ordered(Map<String, T> values) {
        return values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Components that = (Components) o;
        return inputs.equals(that.inputs) &&
               parameters.equals(that.parameters) &&
               successActions.equals(that.successActions) &&
               failureActions.equals(that.failureActions) &&
               extensions.equals(that.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(inputs, parameters, successActions, failureActions, extensions);
    }
    
    @Override
    public String toString() {
        return "Components{" +
               "inputs=" + inputs.keySet() +
               ", parameters=" + parameters.keySet() +
               ", successActions=" + successActions.keySet() +
               ", failureActions=" + failureActions.keySet() +
               '}';
    }
}
