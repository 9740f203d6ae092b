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

import java.util.List;
import java.util.Objects;

/**
 * Root of an Arazzo document: the API descriptions it draws on, the workflows it defines
 * and the components those workflows share.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ArazzoDescription {
    
    private final String arazzo;
    private final Info info;
    private final List<SourceDescription> sourceDescriptions;
    private final List<Workflow> workflows;
    private final Components components;
    private final Extensions extensions;
    
    public ArazzoDescription(String arazzo, Info info, List<SourceDescription> sourceDescriptions,
                             List<Workflow> workflows, Components components, Extensions extensions) {
        this.arazzo = Objects.requireNonNull(arazzo, "Arazzo version cannot be null");
        this.info = Objects.requireNonNull(info, "Info cannot be null");
        this.sourceDescriptions = List.copyOf(Objects.requireNonNull(sourceDescriptions, "Source descriptions cannot be null"));
        this.workflows = List.copyOf(Objects.requireNonNull(workflows, "Workflows cannot be null"));
        if (this.sourceDescriptions.isEmpty()) {
            throw new IllegalArgumentException("At least one source description is required");
        }
        if (this.workflows.isEmpty()) {
            throw new IllegalArgumentException("At least one workflow is required");
        }
        this.components = components;
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getArazzo() {
        return arazzo;
    }
    
    public Info getInfo() {
        return info;
    }
    
    public List<SourceDescription> getSourceDescriptions() {
        return sourceDescriptions;
    }
    
    public List<Workflow> getWorkflows() {
        return workflows;
    }
    
    /**
     * @return the components, or null when the document declares none
     */
    public Components getComponents() {
        return components;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    public Workflow getWorkflow(String workflowId) {
        return workflows.stream()
                .filter(workflow -> workflow.getWorkflowId().equals(workflowId))
                .findFirst()
                .orElse(null);
    }
    
    public SourceDescription getSourceDescription(String name) {
        return sourceDescriptions.stream()
                .filter(source -> source.getName().equals(name))
                .findFirst()
                .orElse(null);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArazzoDescription that = (ArazzoDescription) o;
        return Objects.equals(arazzo, that.arazzo) &&
               Objects.equals(info, that.info) &&
               Objects.equals(sourceDescriptions, that.sourceDescriptions) &&
               Objects.equals(workflows, that.workflows) &&
               Objects.equals(components, that.components) &&
               Objects.equals(extensions, that.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(arazzo, info, sourceDescriptions, workflows, components, extensions);
    }
    
    @Override
    public String toString() {
        return "ArazzoDescription{" +
               "arazzo='" + arazzo + '\'' +
               ", title='" + info.getTitle() + '\'' +
               ", workflows=" + workflows.size() +
               '}';
    }
}
