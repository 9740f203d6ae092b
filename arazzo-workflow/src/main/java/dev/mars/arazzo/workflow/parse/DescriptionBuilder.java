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

import dev.mars.arazzo.config.ArazzoConfiguration;
import dev.mars.arazzo.core.exceptions.ConstraintViolationException;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.DuplicateIdentifierException;
import dev.mars.arazzo.core.exceptions.UnsupportedVersionException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.NodeFields;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.Components;
import dev.mars.arazzo.workflow.Info;
import dev.mars.arazzo.workflow.SourceDescription;
import dev.mars.arazzo.workflow.SourceDescriptionType;
import dev.mars.arazzo.workflow.Workflow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the document root. The version is checked before anything else is read, so a
 * document in an unsupported version fails with {@link UnsupportedVersionException} rather
 * than with whatever structural difference comes first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class DescriptionBuilder {
    
    private static final Pattern SOURCE_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-]+$");
    
    private static final Set<String> DESCRIPTION_FIELDS = Set.of(
            "arazzo", "info", "sourceDescriptions", "workflows", "components");
    private static final Set<String> INFO_FIELDS = Set.of("title", "summary", "description", "version");
    private static final Set<String> SOURCE_DESCRIPTION_FIELDS = Set.of("name", "url", "type");
    
    private final ArazzoConfiguration configuration;
    private final WorkflowBuilder workflowBuilder;
    private final ComponentsBuilder componentsBuilder;
    
    public DescriptionBuilder(ArazzoConfiguration configuration) {
        this.configuration = configuration;
        UnionResolver unionResolver = new UnionResolver();
        ActionBuilder actionBuilder = new ActionBuilder(unionResolver);
        this.workflowBuilder = new WorkflowBuilder(unionResolver, actionBuilder);
        this.componentsBuilder = new ComponentsBuilder(workflowBuilder, actionBuilder);
    }
    
    public ArazzoDescription buildDescription(DocumentNode root, BuildContext context) throws DocumentException {
        NodeFields.requireMap(root);
        String version = NodeFields.requireString(root, "arazzo");
        if (!configuration.isSupportedVersion(version)) {
            throw new UnsupportedVersionException(root.getPath().child("arazzo"), version,
                    configuration.getSupportedVersions());
        }
        
        Info info = buildInfo(NodeFields.requireMapField(root, "info"), context);
        
        List<DocumentNode> sourceNodes = NodeFields.requireSequenceField(root, "sourceDescriptions");
        if (sourceNodes.isEmpty()) {
            throw new ConstraintViolationException(root.getPath().child("sourceDescriptions"),
                    "At least one source description is required");
        }
        List<SourceDescription> sourceDescriptions = new ArrayList<>();
        Set<String> sourceNames = new HashSet<>();
        for (DocumentNode sourceNode : sourceNodes) {
            SourceDescription source = buildSourceDescription(sourceNode, context);
            if (!sourceNames.add(source.getName())) {
                throw new DuplicateIdentifierException(sourceNode.getPath().child("name"), source.getName());
            }
            sourceDescriptions.add(source);
        }
        
        List<DocumentNode> workflowNodes = NodeFields.requireSequenceField(root, "workflows");
        if (workflowNodes.isEmpty()) {
            throw new ConstraintViolationException(root.getPath().child("workflows"),
                    "At least one workflow is required");
        }
        List<Workflow> workflows = new ArrayList<>();
        Set<String> workflowIds = new HashSet<>();
        for (DocumentNode workflowNode : workflowNodes) {
            Workflow workflow = workflowBuilder.buildWorkflow(workflowNode, context);
            if (!workflowIds.add(workflow.getWorkflowId())) {
                throw new DuplicateIdentifierException(workflowNode.getPath().child("workflowId"),
                        workflow.getWorkflowId());
            }
            workflows.add(workflow);
        }
        
        DocumentNode componentsNode = NodeFields.optionalMapField(root, "components");
        Components components = componentsNode != null ? componentsBuilder.buildComponents(componentsNode, context) : null;
        
        context.warnUnknownKeys(root, DESCRIPTION_FIELDS);
        return new ArazzoDescription(version, info, sourceDescriptions, workflows, components,
                NodeFields.extensions(root, Set.of()));
    }
    
    public Info buildInfo(DocumentNode node, BuildContext context) throws DocumentException {
        String title = NodeFields.requireNonEmptyString(node, "title");
        String summary = NodeFields.optionalString(node, "summary");
        String description = NodeFields.optionalString(node, "description");
        String version = NodeFields.requireNonEmptyString(node, "version");
        
        context.warnUnknownKeys(node, INFO_FIELDS);
        return new Info(title, summary, description, version, NodeFields.extensions(node, Set.of()));
    }
    
    public SourceDescription buildSourceDescription(DocumentNode node, BuildContext context) throws DocumentException {
        NodeFields.requireMap(node);
        String name = NodeFields.requireNonEmptyString(node, "name");
        if (!SOURCE_NAME_PATTERN.matcher(name).matches()) {
            throw new ConstraintViolationException(node.getPath().child("name"),
                    "Source description name '" + name + "' must match " + SOURCE_NAME_PATTERN.pattern());
        }
        String url = NodeFields.requireNonEmptyString(node, "url");
        String typeValue = NodeFields.optionalString(node, "type");
        SourceDescriptionType type = null;
        if (typeValue != null) {
            type = SourceDescriptionType.fromValue(typeValue);
            if (type == null) {
                throw new ConstraintViolationException(node.getPath().child("type"),
                        "Unknown source description type '" + typeValue + "', expected openapi or arazzo");
            }
        }
        
        context.warnUnknownKeys(node, SOURCE_DESCRIPTION_FIELDS);
        return new SourceDescription(name, url, type, NodeFields.extensions(node, Set.of()));
    }
}
