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
 * The payload a step sends with its call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class RequestBody {
    
    private final String contentType;
    private final Payload payload;
    private final List<PayloadReplacement> replacements;
    private final Extensions extensions;
    
    public RequestBody(String contentType, Payload payload, List<PayloadReplacement> replacements,
                       Extensions extensions) {
        this.contentType = contentType;
        this.payload = payload;
        this.replacements = replacements != null ? List.copyOf(replacements) : List.of();
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getContentType() {
        return contentType;
    }
    
    public Payload getPayload() {
        return payload;
    }
    
    public List<PayloadReplacement> getReplacements() {
        return replacements;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestBody that = (RequestBody) o;
        return Objects.equals(contentType, that.contentType) &&
               Objects.equals(payload, that.payload) &&
               Objects.equals(replacements, that.replacements) &&
               Objects.equals(extensions, that.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(contentType, payload, replacements, extensions);
    }
    
    @Override
    public String toString() {
        return "RequestBody{" +
               "contentType='" + contentType + '\'' +
               ", payload=" + payload +
               ", replacements=" + replacements +
               '}';
    }
}
