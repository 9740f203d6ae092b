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
 * A named value passed to an operation or to a called workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class Parameter {
    
    private final String name;
    private final ParameterLocation in;
    private final Payload value;
    private final Extensions extensions;
    
    public Parameter(String name, ParameterLocation in, Payload value, Extensions extensions) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.in = in;
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getName() {
        return name;
    }
    
    /**
     * @return the location, or null for parameters passed to a workflow
     */
    public ParameterLocation getIn() {
        return in;
    }
    
    public Payload getValue() {
        return value;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Parameter parameter = (Parameter) o;
        return Objects.equals(name, parameter.name) &&
               in == parameter.in &&
               Objects.equals(value, parameter.value) &&
               Objects.equals(extensions, parameter.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, in, value, extensions);
    }
    
    @Override
    public String toString() {
        return "Parameter{" +
               "name='" + name + '\'' +
               ", in=" + in +
               ", value=" + value +
               '}';
    }
}
