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
 * How a {@link Criterion} condition is evaluated.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public enum CriterionType {
    SIMPLE("simple", false),
    REGEX("regex", false),
    JSONPATH("jsonpath", true),
    XPATH("xpath", true);
    
    private final String value;
    private final boolean contextRequired;
    
    CriterionType(String value, boolean contextRequired) {
        this.value = value;
        this.contextRequired = contextRequired;
    }
    
    public String getValue() {
        return value;
    }
    
    /**
     * Whether a criterion of this type must name the context it is applied to.
     */
    public boolean isContextRequired() {
        return contextRequired;
    }
    
    public static CriterionType fromValue(String value) {
        for (CriterionType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
