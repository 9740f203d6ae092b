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

import java.util.Objects;

/**
 * Metadata about an Arazzo description.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class Info {
    
    private final String title;
    private final String summary;
    private final String description;
    private final String version;
    private final Extensions extensions;
    
    public Info(String title, String summary, String description, String version, Extensions extensions) {
        this.title = Objects.requireNonNull(title, "Title cannot be null");
        this.summary = summary;
        this.description = description;
        this.version = Objects.requireNonNull(version, "Version cannot be null");
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getTitle() {
        return title;
    }
    
    public String getSummary() {
        return summary;
    }
    
    public String getDescription() {
        return description;
    }
    
    /**
     * Version of the described workflows, not the Arazzo version of the document.
     */
    public String getVersion() {
        return version;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Info info = (Info) o;
        return Objects.equals(title, info.title) &&
               Objects.equals(summary, info.summary) &&
               Objects.equals(description, info.description) &&
               Objects.equals(version, info.version) &&
               Objects.equals(extensions, info.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(title, summary, description, version, extensions);
    }
    
    @Override
    public String toString() {
        return "Info{" +
               "title='" + title + '\'' +
               ", version='" + version + '\'' +
               '}';
    }
}
