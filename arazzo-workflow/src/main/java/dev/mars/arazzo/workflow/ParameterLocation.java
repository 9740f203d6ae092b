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
 * Where a parameter is placed in the call: the {@code in} field.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public enum ParameterLocation {
    PATH("path"),
    QUERY("query"),
    HEADER("header"),
    COOKIE("cookie");
    
    private final String value;
    
    ParameterLocation(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public static ParameterLocation fromValue(String value) {
        for (ParameterLocation location : values()) {
            if (location.value.equals(value)) {
                return location;
            }
        }
        return null;
    }
}
