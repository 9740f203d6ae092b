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

package dev.mars.arazzo.workflow.parse;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.NodeFields;
import dev.mars.arazzo.workflow.Components;
import dev.mars.arazzo.workflow.FailureAction;
import dev.mars.arazzo.workflow.Parameter;
import dev.mars.arazzo.workflow.SuccessAction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@code components} section. Component names are checked against the allowed
 * name pattern; duplicate names never reach this point because both tree readers reject
 * duplicate keys.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ComponentsBuilder {
    
    private static final Set<String> COMPONENTS_FIELDS = Set.of(
            "inputs", "parameters", "successActions", "failureActions");
    
    private final WorkflowBuilder workflowBuilder;
    private final ActionBuilder actionBuilder;
    
    public ComponentsBuilder(WorkflowBuilder workflowBuilder, ActionBuilder actionBuilder) {
        this.workflowBuilder = workflowBuilder;
        this.actionBuilder = actionBuilder;
    }
    
    public Components buildComponents(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : section(node, "inputs").entrySet()) {
            WorkflowBuilder.checkName(entry.getValue().getPath(), entry.getKey());
            inputs.put(entry.getKey(), NodeFields.requireMap(entry.getValue()).toJsonNode());
        }
        
        Map<String, Parameter> parameters = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : section(node, "parameters").entrySet()) {
            WorkflowBuilder.checkName(entry.getValue().getPath(), entry.getKey());
            parameters.put(entry.getKey(),
                    workflowBuilder.buildParameter(entry.getValue(), WorkflowBuilder.LocationRule.OPTIONAL, context));
        }
        
        Map<String, SuccessAction> successActions = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : section(node, "successActions").entrySet()) {
            WorkflowBuilder.checkName(entry.getValue().getPath(), entry.getKey());
            successActions.put(entry.getKey(), actionBuilder.buildSuccessAction(entry.getValue(), context));
        }
        
        Map<String, FailureAction> failureActions = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : section(node, "failureActions").entrySet()) {
            WorkflowBuilder.checkName(entry.getValue().getPath(), entry.getKey());
            failureActions.put(entry.getKey(), actionBuilder.buildFailureAction(entry.getValue(), context));
        }
        
        context.warnUnknownKeys(node, COMPONENTS_FIELDS);
        return new Components(inputs, parameters, successActions, failureActions,
                NodeFields.extensions(node, Set.of()));
    }
    
    private static Map<String, DocumentNode> section(DocumentNode components, String key) throws DocumentException {
        DocumentNode section = NodeFields.optionalMapField(components, key);
        return section != null ? section.entries() : Map.of();
    }
}
