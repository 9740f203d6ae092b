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

import dev.mars.arazzo.core.exceptions.ConstraintViolationException;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.MissingFieldException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.Extensions;
import dev.mars.arazzo.tree.NodeFields;
import dev.mars.arazzo.tree.NodePath;
import dev.mars.arazzo.workflow.ActionTarget;
import dev.mars.arazzo.workflow.ActionType;
import dev.mars.arazzo.workflow.Criterion;
import dev.mars.arazzo.workflow.CriterionExpressionType;
import dev.mars.arazzo.workflow.CriterionType;
import dev.mars.arazzo.workflow.FailureAction;
import dev.mars.arazzo.workflow.SuccessAction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds success actions, failure actions and the criteria they share with steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ActionBuilder {
    
    private static final Set<String> SUCCESS_ACTION_FIELDS = Set.of(
            "name", "type", "workflowId", "stepId", "criteria");
    private static final Set<String> FAILURE_ACTION_FIELDS = Set.of(
            "name", "type", "workflowId", "stepId", "retryAfter", "retryLimit", "criteria");
    private static final Set<String> CRITERION_FIELDS = Set.of("condition", "context", "type");
    private static final Set<String> EXPRESSION_TYPE_FIELDS = Set.of("type", "version");
    
    private final UnionResolver unionResolver;
    
    public ActionBuilder(UnionResolver unionResolver) {
        this.unionResolver = unionResolver;
    }
    
    public SuccessAction buildSuccessAction(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String name = NodeFields.requireNonEmptyString(node, "name");
        ActionType type = actionType(node);
        if (type == ActionType.RETRY) {
            throw new ConstraintViolationException(node.getPath().child("type"),
                    "Success actions must be of type end or goto, was retry");
        }
        ActionTarget target = resolveTarget(node, type);
        List<Criterion> criteria = buildCriteria(node, "criteria", context);
        
        context.warnUnknownKeys(node, SUCCESS_ACTION_FIELDS);
        return new SuccessAction(name, type, target, criteria, NodeFields.extensions(node, Set.of()));
    }
    
    public FailureAction buildFailureAction(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String name = NodeFields.requireNonEmptyString(node, "name");
        ActionType type = actionType(node);
        ActionTarget target = resolveTarget(node, type);
        Double retryAfter = NodeFields.optionalNumber(node, "retryAfter");
        Integer retryLimit = NodeFields.optionalInteger(node, "retryLimit");
        
        if (type == ActionType.RETRY) {
            if (retryAfter == null) {
                throw new MissingFieldException(node.getPath(), "retryAfter", "A retry action needs 'retryAfter'");
            }
            if (retryLimit == null) {
                throw new MissingFieldException(node.getPath(), "retryLimit", "A retry action needs 'retryLimit'");
            }
            if (retryAfter < 0) {
                throw new ConstraintViolationException(node.getPath().child("retryAfter"),
                        "retryAfter cannot be negative: " + retryAfter);
            }
            if (retryLimit < 0) {
                throw new ConstraintViolationException(node.getPath().child("retryLimit"),
                        "retryLimit cannot be negative: " + retryLimit);
            }
        } else if (retryAfter != null || retryLimit != null) {
            String field = retryAfter != null ? "retryAfter" : "retryLimit";
            throw new ConstraintViolationException(node.getPath().child(field),
                    "Only retry actions may set '" + field + "'");
        }
        List<Criterion> criteria = buildCriteria(node, "criteria", context);
        
        context.warnUnknownKeys(node, FAILURE_ACTION_FIELDS);
        return new FailureAction(name, type, target, retryAfter, retryLimit, criteria,
                NodeFields.extensions(node, Set.of()));
    }
    
    /**
     * Builds every criterion listed under the given key, in document order.
     */
    public List<Criterion> buildCriteria(DocumentNode parent, String key, BuildContext context) throws DocumentException {
        List<Criterion> criteria = new ArrayList<>();
        for (DocumentNode element : NodeFields.optionalSequenceField(parent, key)) {
            criteria.add(buildCriterion(element, context));
        }
        return criteria;
    }
    
    public Criterion buildCriterion(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String condition = NodeFields.requireNonEmptyString(node, "condition");
        String criterionContext = NodeFields.optionalString(node, "context");
        Extensions extensions = NodeFields.extensions(node, Set.of());
        
        DocumentNode typeNode = node.get("type");
        Criterion criterion;
        if (typeNode == null || typeNode.isNull()) {
            criterion = new Criterion(condition, criterionContext, null, null, extensions);
        } else {
            List<UnionResolver.Candidate<Criterion>> candidates = List.of(
                    UnionResolver.candidate("type name", DocumentNode::isString,
                            n -> new Criterion(condition, criterionContext, criterionType(n.asText(), n.getPath()), null, extensions)),
                    UnionResolver.candidate("expression type", DocumentNode::isMap,
                            n -> new Criterion(condition, criterionContext, null, buildExpressionType(n, context), extensions)));
            criterion = unionResolver.firstMatch(typeNode, "criterion type", candidates);
        }
        
        if (criterion.getEffectiveType().isContextRequired() && criterionContext == null) {
            throw new MissingFieldException(node.getPath(), "context",
                    "A " + criterion.getEffectiveType().getValue() + " criterion needs a 'context'");
        }
        context.warnUnknownKeys(node, CRITERION_FIELDS);
        return criterion;
    }
    
    private CriterionExpressionType buildExpressionType(DocumentNode node, BuildContext context) throws DocumentException {
        CriterionType type = criterionType(NodeFields.requireNonEmptyString(node, "type"), node.getPath().child("type"));
        if (!type.isContextRequired()) {
            throw new ConstraintViolationException(node.getPath().child("type"),
                    "An expression type must be jsonpath or xpath, was " + type.getValue());
        }
        String version = NodeFields.requireNonEmptyString(node, "version");
        context.warnUnknownKeys(node, EXPRESSION_TYPE_FIELDS);
        return new CriterionExpressionType(type, version, NodeFields.extensions(node, Set.of()));
    }
    
    private CriterionType criterionType(String value, NodePath path) throws DocumentException {
        CriterionType type = CriterionType.fromValue(value);
        if (type == null) {
            throw new ConstraintViolationException(path,
                    "Unknown criterion type '" + value + "', expected one of " + criterionTypeNames());
        }
        return type;
    }
    
    private ActionType actionType(DocumentNode node) throws DocumentException {
        String value = NodeFields.requireString(node, "type");
        ActionType type = ActionType.fromValue(value);
        if (type == null) {
            throw new ConstraintViolationException(node.getPath().child("type"),
                    "Unknown action type '" + value + "', expected one of "
                            + Arrays.stream(ActionType.values()).map(ActionType::getValue).collect(Collectors.toList()));
        }
        return type;
    }
    
    private ActionTarget resolveTarget(DocumentNode node, ActionType type) throws DocumentException {
        ActionTarget target = unionResolver.resolveActionTarget(node, type == ActionType.GOTO);
        if (type == ActionType.END && target != null) {
            throw new ConstraintViolationException(node.getPath().child(target.getKind().getFieldName()),
                    "An end action cannot name a target");
        }
        return target;
    }
    
    private static List<String> criterionTypeNames() {
        return Arrays.stream(CriterionType.values()).map(CriterionType::getValue).collect(Collectors.toList());
    }
}
