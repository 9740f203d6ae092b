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
 * A named OpenAPI or Arazzo document whose operations or workflows the steps refer to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class SourceDescription {
    
    private final String name;
    private final String url;
    private final SourceDescriptionType type;
    private final Extensions extensions;
    
    public SourceDescription(String name, String url, SourceDescriptionType type, Extensions extensions) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.url = Objects.requireNonNull(url, "URL cannot be null");
        this.type = type;
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getName() {
        return name;
    }
    
    public String getUrl() {
        return url;
    }
    
    /**
     * @return the declared type, or null when the document leaves it out
     */
    public SourceDescriptionType getType() {
        return type;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceDescription that = (SourceDescription) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(url, that.url) &&
               type == that.type &&
               Objects.equals(extensions, that.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, url, type, extensions);
    }
    
    @Override
    public String toString() {
        return "SourceDescription{" +
               "name='" + name + '\'' +
               ", url='" + url + '\'' +
               ", type=" + type +
               '}';
    }
}
