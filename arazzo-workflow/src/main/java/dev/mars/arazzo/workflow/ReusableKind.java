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

/**
 * The component sections a {@link ReusableObject} may point into.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public enum ReusableKind {
    PARAMETER("parameters", "parameter"),
    SUCCESS_ACTION("successActions", "success action"),
    FAILURE_ACTION("failureActions", "failure action");
    
    private final String section;
    private final String label;
    
    ReusableKind(String section, String label) {
        this.section = section;
        this.label = label;
    }
    
    /**
     * Name of the section under {@code components}.
     */
    public String getSection() {
        return section;
    }
    
    public String getLabel() {
        return label;
    }
    
    /**
     * Returns the reference prefix for this kind, e.g. {@code $components.parameters.}
     */
    public String getReferencePrefix() {
        return "$components." + section + ".";
    }
    
    public static ReusableKind fromSection(String section) {
        for (ReusableKind kind : values()) {
            if (kind.section.equals(section)) {
                return kind;
            }
        }
        return null;
    }
}
