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

import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.InvalidUnionException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.Extensions;
import dev.mars.arazzo.tree.NodeFields;
import dev.mars.arazzo.workflow.ActionTarget;
import dev.mars.arazzo.workflow.InlineOrReference;
import dev.mars.arazzo.workflow.OperationReference;
import dev.mars.arazzo.workflow.Payload;
import dev.mars.arazzo.workflow.ReusableKind;
import dev.mars.arazzo.workflow.ReusableObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Decides which shape a polymorphic field has.
 *
 * <p>Candidates are tried in the order given. {@link #firstMatch} takes the first candidate
 * whose predicate accepts the node, so earlier candidates win; {@link #exactlyOne} requires
 * that a single candidate accepts it. Either way, a node no candidate accepts raises an
 * {@link InvalidUnionException} listing every candidate tried.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class UnionResolver {
    
    static final String REFERENCE = "reference";
    static final String VALUE = "value";
    
    @FunctionalInterface
    public interface NodePredicate {
        boolean test(DocumentNode node) throws DocumentException;
    }
    
    @FunctionalInterface
    public interface NodeBuilder<T> {
        T build(DocumentNode node) throws DocumentException;
    }
    
    /**
     * One possible shape of a union: a name used in error messages, a test and a builder.
     */
    public static final class Candidate<T> {
        
        private final String name;
        private final NodePredicate predicate;
        private final NodeBuilder<? extends T> builder;
        
        public Candidate(String name, NodePredicate predicate, NodeBuilder<? extends T> builder) {
            this.name = Objects.requireNonNull(name, "Name cannot be null");
            this.predicate = Objects.requireNonNull(predicate, "Predicate cannot be null");
            this.builder = Objects.requireNonNull(builder, "Builder cannot be null");
        }
        
        public String getName() {
            return name;
        }
    }
    
    public static <T> Candidate<T> candidate(String name, NodePredicate predicate, NodeBuilder<? extends T> builder) {
        return new Candidate<>(name, predicate, builder);
    }
    
    public <T> T firstMatch(DocumentNode node, String union, List<Candidate<T>> candidates) throws DocumentException {
        for (Candidate<T> candidate : candidates) {
            if (candidate.predicate.test(node)) {
                return candidate.builder.build(node);
            }
        }
        throw new InvalidUnionException(node.getPath(), names(candidates),
                "No " + union + " variant matches a " + node.getKind() + " node");
    }
    
    public <T> T exactlyOne(DocumentNode node, String union, List<Candidate<T>> candidates) throws DocumentException {
        List<Candidate<T>> matched = new ArrayList<>();
        for (Candidate<T> candidate : candidates) {
            if (candidate.predicate.test(node)) {
                matched.add(candidate);
            }
        }
        if (matched.isEmpty()) {
            throw new InvalidUnionException(node.getPath(), names(candidates),
                    "Expected exactly one " + union + ", found none");
        }
        if (matched.size() > 1) {
            throw new InvalidUnionException(node.getPath(), names(candidates),
                    "Expected exactly one " + union + ", found " + names(matched));
        }
        return matched.get(0).builder.build(node);
    }
    
    /**
     * Containers are structured payloads, non-string scalars are literal values, and strings
     * are runtime expressions when they start with {@value Payload#EXPRESSION_PREFIX}.
     */
    public Payload resolvePayload(DocumentNode node) throws DocumentException {
        List<Candidate<Payload>> candidates = List.of(
                candidate("structured", n -> n.isMap() || n.isSequence(), n -> Payload.structured(n.toJsonNode())),
                candidate("scalar", n -> !n.isString(), n -> Payload.scalar(n.toJsonNode())),
                candidate("expression", n -> Payload.isExpression(n.asText()), n -> Payload.expression(n.asText())),
                candidate("string", DocumentNode::isString, n -> Payload.scalar(TextNode.valueOf(n.asText()))));
        return firstMatch(node, "payload", candidates);
    }
    
    /**
     * Resolves the operation a step calls. The step map must hold exactly one of
     * {@code operationId}, {@code operationPath} and {@code workflowId}.
     */
    public OperationReference resolveOperationReference(DocumentNode step) throws DocumentException {
        List<Candidate<OperationReference>> candidates = new ArrayList<>();
        for (OperationReference.Kind kind : OperationReference.Kind.values()) {
            String field = kind.getFieldName();
            candidates.add(candidate(field, n -> NodeFields.isPresent(n, field),
                    n -> new OperationReference(kind, NodeFields.requireNonEmptyString(n, field))));
        }
        return exactlyOne(step, "operation reference", candidates);
    }
    
    /**
     * Resolves the target of an action map, or returns null when it names none and none is
     * required.
     */
    public ActionTarget resolveActionTarget(DocumentNode action, boolean required) throws DocumentException {
        boolean hasTarget = false;
        for (ActionTarget.Kind kind : ActionTarget.Kind.values()) {
            hasTarget |= NodeFields.isPresent(action, kind.getFieldName());
        }
        if (!hasTarget && !required) {
            return null;
        }
        String workflowId = ActionTarget.Kind.WORKFLOW.getFieldName();
        String stepId = ActionTarget.Kind.STEP.getFieldName();
        List<Candidate<ActionTarget>> candidates = List.of(
                candidate(workflowId, n -> NodeFields.isPresent(n, workflowId),
                        n -> ActionTarget.workflow(NodeFields.requireNonEmptyString(n, workflowId))),
                candidate(stepId, n -> NodeFields.isPresent(n, stepId),
                        n -> ActionTarget.step(NodeFields.requireNonEmptyString(n, stepId))));
        return exactlyOne(action, "action target", candidates);
    }
    
    /**
     * Resolves an entry of a parameter or action list. A map with a {@code reference} key is
     * a reusable object and is recorded in the context for later resolution; any other map
     * is built inline. A reference map may carry extensions, and a parameter reference may
     * override the value, but no other field.
     */
    public <T> InlineOrReference<T> resolveInlineOrReference(DocumentNode node, ReusableKind kind,
                                                            NodeBuilder<T> inlineBuilder,
                                                            BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String inlineName = "inline " + kind.getLabel();
        List<Candidate<InlineOrReference<T>>> candidates = List.of(
                candidate("reusable object", n -> n.has(REFERENCE), n -> {
                    List<String> inlineFields = inlineFieldsBesideReference(n, kind);
                    if (!inlineFields.isEmpty()) {
                        throw new InvalidUnionException(n.getPath(), List.of("reusable object", inlineName),
                                "A reference cannot be combined with the fields " + inlineFields);
                    }
                    ReusableObject reference = buildReusableObject(n, kind);
                    context.recordReference(n.getPath(), reference);
                    return InlineOrReference.<T>reference(reference);
                }),
                candidate(inlineName, DocumentNode::isMap, n -> InlineOrReference.<T>inline(inlineBuilder.build(n))));
        return firstMatch(node, kind.getLabel(), candidates);
    }
    
    private ReusableObject buildReusableObject(DocumentNode node, ReusableKind kind) throws DocumentException {
        String reference = NodeFields.requireNonEmptyString(node, REFERENCE);
        DocumentNode value = node.get(VALUE);
        Payload override = value != null ? resolvePayload(value) : null;
        return new ReusableObject(reference, kind, override);
    }
    
    private List<String> inlineFieldsBesideReference(DocumentNode node, ReusableKind kind) throws DocumentException {
        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, DocumentNode> entry : node.entries().entrySet()) {
            String key = entry.getKey();
            boolean allowed = key.equals(REFERENCE)
                    || Extensions.isExtensionKey(key)
                    || (key.equals(VALUE) && kind == ReusableKind.PARAMETER);
            if (!allowed) {
                fields.add(key);
            }
        }
        return fields;
    }
    
    private static List<String> names(List<? extends Candidate<?>> candidates) {
        return candidates.stream().map(Candidate::getName).collect(Collectors.toList());
    }
}
