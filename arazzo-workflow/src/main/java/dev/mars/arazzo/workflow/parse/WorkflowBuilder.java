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
import dev.mars.arazzo.core.exceptions.ConstraintViolationException;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.DuplicateIdentifierException;
import dev.mars.arazzo.core.exceptions.MissingFieldException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.NodeFields;
import dev.mars.arazzo.tree.NodePath;
import dev.mars.arazzo.workflow.Criterion;
import dev.mars.arazzo.workflow.FailureAction;
import dev.mars.arazzo.workflow.InlineOrReference;
import dev.mars.arazzo.workflow.OperationReference;
import dev.mars.arazzo.workflow.Parameter;
import dev.mars.arazzo.workflow.ParameterLocation;
import dev.mars.arazzo.workflow.Payload;
import dev.mars.arazzo.workflow.PayloadReplacement;
import dev.mars.arazzo.workflow.RequestBody;
import dev.mars.arazzo.workflow.ReusableKind;
import dev.mars.arazzo.workflow.Step;
import dev.mars.arazzo.workflow.SuccessAction;
import dev.mars.arazzo.workflow.Workflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds workflows, their steps, and the parameters and request bodies steps carry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class WorkflowBuilder {
    
    static final Pattern COMPONENT_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9.\\-_]+$");
    
    private static final Set<String> WORKFLOW_FIELDS = Set.of(
            "workflowId", "summary", "description", "inputs", "dependsOn", "parameters", "steps",
            "successActions", "failureActions", "outputs");
    private static final Set<String> STEP_FIELDS = Set.of(
            "stepId", "description", "operationId", "operationPath", "workflowId", "parameters",
            "requestBody", "successCriteria", "onSuccess", "onFailure", "outputs");
    private static final Set<String> PARAMETER_FIELDS = Set.of("name", "in", "value");
    private static final Set<String> REQUEST_BODY_FIELDS = Set.of("contentType", "payload", "replacements");
    private static final Set<String> REPLACEMENT_FIELDS = Set.of("target", "value");
    
    /**
     * Whether a parameter must, may or must not say where it goes.
     */
    public enum LocationRule {
        REQUIRED,
        OPTIONAL,
        FORBIDDEN
    }
    
    private final UnionResolver unionResolver;
    private final ActionBuilder actionBuilder;
    
    public WorkflowBuilder(UnionResolver unionResolver, ActionBuilder actionBuilder) {
        this.unionResolver = unionResolver;
        this.actionBuilder = actionBuilder;
    }
    
    public Workflow buildWorkflow(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String workflowId = NodeFields.requireNonEmptyString(node, "workflowId");
        String summary = NodeFields.optionalString(node, "summary");
        String description = NodeFields.optionalString(node, "description");
        DocumentNode inputsNode = NodeFields.optionalMapField(node, "inputs");
        JsonNode inputs = inputsNode != null ? inputsNode.toJsonNode() : null;
        List<String> dependsOn = NodeFields.optionalStringList(node, "dependsOn");
        List<InlineOrReference<Parameter>> parameters = buildParameters(node, LocationRule.OPTIONAL, context);
        
        List<DocumentNode> stepNodes = NodeFields.requireSequenceField(node, "steps");
        if (stepNodes.isEmpty()) {
            throw new ConstraintViolationException(node.getPath().child("steps"),
                    "Workflow '" + workflowId + "' must have at least one step");
        }
        List<Step> steps = new ArrayList<>();
        Set<String> stepIds = new HashSet<>();
        for (DocumentNode stepNode : stepNodes) {
            Step step = buildStep(stepNode, context);
            if (!stepIds.add(step.getStepId())) {
                throw new DuplicateIdentifierException(stepNode.getPath().child("stepId"), step.getStepId());
            }
            steps.add(step);
        }
        
        List<InlineOrReference<SuccessAction>> successActions = buildSuccessActions(node, "successActions", context);
        List<InlineOrReference<FailureAction>> failureActions = buildFailureActions(node, "failureActions", context);
        Map<String, String> outputs = buildOutputs(node);
        
        context.warnUnknownKeys(node, WORKFLOW_FIELDS);
        return new Workflow(workflowId, summary, description, inputs, dependsOn, parameters, steps,
                successActions, failureActions, outputs, NodeFields.extensions(node, Set.of()));
    }
    
    public Step buildStep(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String stepId = NodeFields.requireNonEmptyString(node, "stepId");
        String description = NodeFields.optionalString(node, "description");
        OperationReference operation = unionResolver.resolveOperationReference(node);
        
        LocationRule locationRule = operation.getKind().isOperation() ? LocationRule.REQUIRED : LocationRule.FORBIDDEN;
        List<InlineOrReference<Parameter>> parameters = buildParameters(node, locationRule, context);
        
        DocumentNode requestBodyNode = NodeFields.optionalMapField(node, "requestBody");
        RequestBody requestBody = requestBodyNode != null ? buildRequestBody(requestBodyNode, context) : null;
        
        List<Criterion> successCriteria = actionBuilder.buildCriteria(node, "successCriteria", context);
        List<InlineOrReference<SuccessAction>> onSuccess = buildSuccessActions(node, "onSuccess", context);
        List<InlineOrReference<FailureAction>> onFailure = buildFailureActions(node, "onFailure", context);
        Map<String, String> outputs = buildOutputs(node);
        
        context.warnUnknownKeys(node, STEP_FIELDS);
        return new Step(stepId, description, operation, parameters, requestBody, successCriteria,
                onSuccess, onFailure, outputs, NodeFields.extensions(node, Set.of()));
    }
    
    /**
     * Builds a parameter declared inline. Reusable parameters in components use
     * {@link LocationRule#OPTIONAL}.
     */
    public Parameter buildParameter(DocumentNode node, LocationRule locationRule, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String name = NodeFields.requireNonEmptyString(node, "name");
        String inValue = NodeFields.optionalString(node, "in");
        ParameterLocation in = null;
        if (inValue != null) {
            if (locationRule == LocationRule.FORBIDDEN) {
                throw new ConstraintViolationException(node.getPath().child("in"),
                        "Parameter '" + name + "' is passed to a workflow and cannot set 'in'");
            }
            in = ParameterLocation.fromValue(inValue);
            if (in == null) {
                throw new ConstraintViolationException(node.getPath().child("in"),
                        "Unknown parameter location '" + inValue + "', expected one of "
                                + Arrays.stream(ParameterLocation.values()).map(ParameterLocation::getValue).collect(Collectors.toList()));
            }
        } else if (locationRule == LocationRule.REQUIRED) {
            throw new MissingFieldException(node.getPath(), "in",
                    "Parameter '" + name + "' of an operation step must set 'in'");
        }
        
        DocumentNode valueNode = node.get("value");
        if (valueNode == null) {
            throw new MissingFieldException(node.getPath(), "value");
        }
        Payload value = unionResolver.resolvePayload(valueNode);
        
        context.warnUnknownKeys(node, PARAMETER_FIELDS);
        return new Parameter(name, in, value, NodeFields.extensions(node, Set.of()));
    }
    
    public RequestBody buildRequestBody(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String contentType = NodeFields.optionalString(node, "contentType");
        if (contentType != null && contentType.trim().isEmpty()) {
            throw new ConstraintViolationException(node.getPath().child("contentType"), "Field 'contentType' cannot be empty");
        }
        DocumentNode payloadNode = node.get("payload");
        Payload payload = null;
        if (payloadNode != null && !payloadNode.isNull()) {
            payload = unionResolver.resolvePayload(payloadNode);
            if (contentType == null) {
                throw new MissingFieldException(node.getPath(), "contentType",
                        "A request body with a payload must set 'contentType'");
            }
        }
        
        List<PayloadReplacement> replacements = new ArrayList<>();
        for (DocumentNode replacementNode : NodeFields.optionalSequenceField(node, "replacements")) {
            replacements.add(buildPayloadReplacement(replacementNode, context));
        }
        
        context.warnUnknownKeys(node, REQUEST_BODY_FIELDS);
        return new RequestBody(contentType, payload, replacements, NodeFields.extensions(node, Set.of()));
    }
    
    public PayloadReplacement buildPayloadReplacement(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String target = NodeFields.requireNonEmptyString(node, "target");
        DocumentNode valueNode = node.get("value");
        if (valueNode == null) {
            throw new MissingFieldException(node.getPath(), "value");
        }
        Payload value = unionResolver.resolvePayload(valueNode);
        
        context.warnUnknownKeys(node, REPLACEMENT_FIELDS);
        return new PayloadReplacement(target, value, NodeFields.extensions(node, Set.of()));
    }
    
    private List<InlineOrReference<Parameter>> buildParameters(DocumentNode parent, LocationRule locationRule,
                                                               BuildContext context) throws DocumentException {
        List<InlineOrReference<Parameter>> parameters = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (DocumentNode element : NodeFields.optionalSequenceField(parent, "parameters")) {
            InlineOrReference<Parameter> parameter = unionResolver.resolveInlineOrReference(element,
                    ReusableKind.PARAMETER, n -> buildParameter(n, locationRule, context), context);
            if (parameter.isInline()) {
                Parameter inline = parameter.getInline();
                String key = inline.getName() + "|" + (inline.getIn() != null ? inline.getIn().getValue() : "");
                if (!seen.add(key)) {
                    String label = inline.getIn() != null ? inline.getName() + " in " + inline.getIn().getValue() : inline.getName();
                    throw new DuplicateIdentifierException(element.getPath().child("name"), label);
                }
            }
            parameters.add(parameter);
        }
        return parameters;
    }
    
    private List<InlineOrReference<SuccessAction>> buildSuccessActions(DocumentNode parent, String key,
                                                                       BuildContext context) throws DocumentException {
        List<InlineOrReference<SuccessAction>> actions = new ArrayList<>();
        for (DocumentNode element : NodeFields.optionalSequenceField(parent, key)) {
            actions.add(unionResolver.resolveInlineOrReference(element, ReusableKind.SUCCESS_ACTION,
                    n -> actionBuilder.buildSuccessAction(n, context), context));
        }
        return actions;
    }
    
    private List<InlineOrReference<FailureAction>> buildFailureActions(DocumentNode parent, String key,
                                                                       BuildContext context) throws DocumentException {
        List<InlineOrReference<FailureAction>> actions = new ArrayList<>();
        for (DocumentNode element : NodeFields.optionalSequenceField(parent, key)) {
            actions.add(unionResolver.resolveInlineOrReference(element, ReusableKind.FAILURE_ACTION,
                    n -> actionBuilder.buildFailureAction(n, context), context));
        }
        return actions;
    }
    
    private Map<String, String> buildOutputs(DocumentNode parent) throws DocumentException {
        Map<String, String> outputs = NodeFields.optionalStringMap(parent, "outputs");
        for (String name : outputs.keySet()) {
            checkName(parent.getPath().child("outputs").child(name), name);
        }
        return outputs;
    }
    
    static void checkName(NodePath path, String name) throws ConstraintViolationException {
        if (!COMPONENT_NAME_PATTERN.matcher(name).matches()) {
            throw new ConstraintViolationException(path,
                    "Name '" + name + "' must match " + COMPONENT_NAME_PATTERN.pattern());
        }
    }
}
