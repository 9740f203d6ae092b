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

package dev.mars.arazzo.workflow.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.arazzo.config.ArazzoConfiguration;
import dev.mars.arazzo.core.exceptions.ArazzoException;
import dev.mars.arazzo.tree.DocumentNodes;
import dev.mars.arazzo.tree.Extensions;
import dev.mars.arazzo.workflow.Action;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.Components;
import dev.mars.arazzo.workflow.Criterion;
import dev.mars.arazzo.workflow.CriterionExpressionType;
import dev.mars.arazzo.workflow.FailureAction;
import dev.mars.arazzo.workflow.Info;
import dev.mars.arazzo.workflow.InlineOrReference;
import dev.mars.arazzo.workflow.Parameter;
import dev.mars.arazzo.workflow.Payload;
import dev.mars.arazzo.workflow.PayloadReplacement;
import dev.mars.arazzo.workflow.RequestBody;
import dev.mars.arazzo.workflow.ReusableObject;
import dev.mars.arazzo.workflow.SourceDescription;
import dev.mars.arazzo.workflow.Step;
import dev.mars.arazzo.workflow.Workflow;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Turns the model back into document trees and text.
 *
 * <p>Only populated fields are written: absent optional values and empty lists produce no
 * key, and a union writes only the variant it holds. Keys follow a fixed order per entity
 * with extensions last, so emitting the same model twice gives the same text. Reading the
 * output back with {@code DefaultArazzoParser} yields a model equal to the one emitted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ArazzoEmitter {
    
    private static final Logger logger = Logger.getLogger(ArazzoEmitter.class.getName());
    
    private final ArazzoConfiguration configuration;
    private final JsonNodeFactory factory = JsonNodeFactory.instance;
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    public ArazzoEmitter() {
        this(new ArazzoConfiguration());
    }
    
    public ArazzoEmitter(ArazzoConfiguration configuration) {
        this.configuration = configuration;
    }
    
    public ObjectNode toJsonTree(ArazzoDescription description) {
        return emit(description);
    }
    
    /**
     * Returns the description as the plain map/list/scalar graph SnakeYAML dumps.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> toYamlTree(ArazzoDescription description) {
        return (Map<String, Object>) DocumentNodes.toYamlObject(emit(description));
    }
    
    public String toJson(ArazzoDescription description) throws ArazzoException {
        try {
            ObjectNode tree = emit(description);
            return configuration.isJsonPrettyPrint()
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new ArazzoException("Failed to write JSON for '" + description.getInfo().getTitle() + "'", e);
        }
    }
    
    public String toYaml(ArazzoDescription description) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(configuration.getYamlIndent());
        String yaml = new Yaml(options).dump(toYamlTree(description));
        logger.fine("Wrote " + yaml.length() + " characters of YAML for '" + description.getInfo().getTitle() + "'");
        return yaml;
    }
    
    public ObjectNode emit(ArazzoDescription description) {
        ObjectNode node = factory.objectNode();
        node.put("arazzo", description.getArazzo());
        node.set("info", emit(description.getInfo()));
        node.set("sourceDescriptions", list(description.getSourceDescriptions(), this::emit));
        node.set("workflows", list(description.getWorkflows(), this::emit));
        if (description.getComponents() != null) {
            node.set("components", emit(description.getComponents()));
        }
        return withExtensions(node, description.getExtensions());
    }
    
    public ObjectNode emit(Info info) {
        ObjectNode node = factory.objectNode();
        node.put("title", info.getTitle());
        putIfPresent(node, "summary", info.getSummary());
        putIfPresent(node, "description", info.getDescription());
        node.put("version", info.getVersion());
        return withExtensions(node, info.getExtensions());
    }
    
    public ObjectNode emit(SourceDescription source) {
        ObjectNode node = factory.objectNode();
        node.put("name", source.getName());
        node.put("url", source.getUrl());
        if (source.getType() != null) {
            node.put("type", source.getType().getValue());
        }
        return withExtensions(node, source.getExtensions());
    }
    
    public ObjectNode emit(Workflow workflow) {
        ObjectNode node = factory.objectNode();
        node.put("workflowId", workflow.getWorkflowId());
        putIfPresent(node, "summary", workflow.getSummary());
        putIfPresent(node, "description", workflow.getDescription());
        if (workflow.getInputs() != null) {
            node.set("inputs", workflow.getInputs().deepCopy());
        }
        if (!workflow.getDependsOn().isEmpty()) {
            node.set("dependsOn", list(workflow.getDependsOn(), TextNode::valueOf));
        }
        putListIfPresent(node, "steps", workflow.getSteps(), this::emit);
        putListIfPresent(node, "successActions", workflow.getSuccessActions(), item -> emit(item, this::emit));
        putListIfPresent(node, "failureActions", workflow.getFailureActions(), item -> emit(item, this::emit));
        putStringMapIfPresent(node, "outputs", workflow.getOutputs());
        putListIfPresent(node, "parameters", workflow.getParameters(), item -> emit(item, this::emit));
        return withExtensions(node, workflow.getExtensions());
    }
    
    public ObjectNode emit(Step step) {
        ObjectNode node = factory.objectNode();
        node.put("stepId", step.getStepId());
        putIfPresent(node, "description", step.getDescription());
        node.put(step.getOperation().getKind().getFieldName(), step.getOperation().getValue());
        putListIfPresent(node, "parameters", step.getParameters(), item -> emit(item, this::emit));
        if (step.getRequestBody() != null) {
            node.set("requestBody", emit(step.getRequestBody()));
        }
        putListIfPresent(node, "successCriteria", step.getSuccessCriteria(), this::emit);
        putListIfPresent(node, "onSuccess", step.getOnSuccess(), item -> emit(item, this::emit));
        putListIfPresent(node, "onFailure", step.getOnFailure(), item -> emit(item, this::emit));
        putStringMapIfPresent(node, "outputs", step.getOutputs());
        return withExtensions(node, step.getExtensions());
    }
    
    public ObjectNode emit(Parameter parameter) {
        ObjectNode node = factory.objectNode();
        node.put("name", parameter.getName());
        if (parameter.getIn() != null) {
            node.put("in", parameter.getIn().getValue());
        }
        node.set("value", emit(parameter.getValue()));
        return withExtensions(node, parameter.getExtensions());
    }
    
    public ObjectNode emit(ReusableObject reference) {
        ObjectNode node = factory.objectNode();
        node.put("reference", reference.getReference());
        if (reference.getValue() != null) {
            node.set("value", emit(reference.getValue()));
        }
        return node;
    }
    
    public ObjectNode emit(RequestBody requestBody) {
        ObjectNode node = factory.objectNode();
        putIfPresent(node, "contentType", requestBody.getContentType());
        if (requestBody.getPayload() != null) {
            node.set("payload", emit(requestBody.getPayload()));
        }
        putListIfPresent(node, "replacements", requestBody.getReplacements(), this::emit);
        return withExtensions(node, requestBody.getExtensions());
    }
    
    public ObjectNode emit(PayloadReplacement replacement) {
        ObjectNode node = factory.objectNode();
        node.put("target", replacement.getTarget());
        node.set("value", emit(replacement.getValue()));
        return withExtensions(node, replacement.getExtensions());
    }
    
    public JsonNode emit(Payload payload) {
        if (payload.isExpression()) {
            return TextNode.valueOf(payload.getExpression());
        }
        return payload.getValue().deepCopy();
    }
    
    public ObjectNode emit(Criterion criterion) {
        ObjectNode node = factory.objectNode();
        putIfPresent(node, "context", criterion.getContext());
        node.put("condition", criterion.getCondition());
        if (criterion.getExpressionType() != null) {
            CriterionExpressionType expressionType = criterion.getExpressionType();
            ObjectNode type = factory.objectNode();
            type.put("type", expressionType.getType().getValue());
            type.put("version", expressionType.getVersion());
            node.set("type", withExtensions(type, expressionType.getExtensions()));
        } else if (criterion.getType() != null) {
            node.put("type", criterion.getType().getValue());
        }
        return withExtensions(node, criterion.getExtensions());
    }
    
    public ObjectNode emit(Action action) {
        ObjectNode node = factory.objectNode();
        node.put("name", action.getName());
        node.put("type", action.getType().getValue());
        if (action.getTarget() != null) {
            node.put(action.getTarget().getKind().getFieldName(), action.getTarget().getId());
        }
        if (action instanceof FailureAction) {
            FailureAction failure = (FailureAction) action;
            if (failure.getRetryAfter() != null) {
                node.put("retryAfter", failure.getRetryAfter());
            }
            if (failure.getRetryLimit() != null) {
                node.put("retryLimit", failure.getRetryLimit());
            }
        }
        putListIfPresent(node, "criteria", action.getCriteria(), this::emit);
        return withExtensions(node, action.getExtensions());
    }
    
    public ObjectNode emit(Components components) {
        ObjectNode node = factory.objectNode();
        if (!components.getInputs().isEmpty()) {
            ObjectNode inputs = node.putObject("inputs");
            components.getInputs().forEach((name, schema) -> inputs.set(name, schema));
        }
        putMapIfPresent(node, "parameters", components.getParameters(), this::emit);
        putMapIfPresent(node, "successActions", components.getSuccessActions(), this::emit);
        putMapIfPresent(node, "failureActions", components.getFailureActions(), this::emit);
        return withExtensions(node, components.getExtensions());
    }
    
    private <T> ObjectNode emit(InlineOrReference<T> item, Function<T, ObjectNode> inlineEmitter) {
        return item.isReference() ? emit(item.getReference()) : inlineEmitter.apply(item.getInline());
    }
    
    private <T> ArrayNode list(List<T> items, Function<T, ? extends JsonNode> emitter) {
        ArrayNode array = factory.arrayNode();
        for (T item : items) {
            array.add(emitter.apply(item));
        }
        return array;
    }
    
    private <T> void putListIfPresent(ObjectNode node, String key, List<T> items, Function<T, ? extends JsonNode> emitter) {
        if (!items.isEmpty()) {
            node.set(key, list(items, emitter));
        }
    }
    
    private <T> void putMapIfPresent(ObjectNode node, String key, Map<String, T> items, Function<T, ? extends JsonNode> emitter) {
        if (!items.isEmpty()) {
            ObjectNode map = node.putObject(key);
            items.forEach((name, item) -> map.set(name, emitter.apply(item)));
        }
    }
    
    private void putStringMapIfPresent(ObjectNode node, String key, Map<String, String> values) {
        if (!values.isEmpty()) {
            ObjectNode map = node.putObject(key);
            values.forEach(map::put);
        }
    }
    
    private static void putIfPresent(ObjectNode node, String key, String value) {
        if (value != null) {
            node.put(key, value);
        }
    }
    
    private static ObjectNode withExtensions(ObjectNode node, Extensions extensions) {
        extensions.asMap().forEach((key, value) -> node.set(key, value));
        return node;
    }
}
