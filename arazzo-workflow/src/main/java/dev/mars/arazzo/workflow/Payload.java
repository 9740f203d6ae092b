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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A value given in a description: a request body payload, a parameter value or a payload
 * replacement value. Exactly one of three shapes is populated:
 * <ul>
 *   <li>{@link Kind#SCALAR}: a literal string, number, boolean or null</li>
 *   <li>{@link Kind#STRUCTURED}: a map or sequence fragment kept as a Jackson tree</li>
 *   <li>{@link Kind#EXPRESSION}: a runtime expression, stored as text and never evaluated</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public final class Payload {
    
    /**
     * Every runtime expression starts with this character.
     */
    public static final String EXPRESSION_PREFIX = "$";
    
    public enum Kind {
        SCALAR,
        STRUCTURED,
        EXPRESSION
    }
    
    private final Kind kind;
    private final JsonNode value;
    private final String expression;
    
    private Payload(Kind kind, JsonNode value, String expression) {
        this.kind = kind;
        this.value = value;
        this.expression = expression;
    }
    
    /**
     * @throws IllegalArgumentException if the node is a container
     */
    public static Payload scalar(JsonNode value) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (value.isContainerNode()) {
            throw new IllegalArgumentException("Scalar payload cannot be a " + value.getNodeType());
        }
        return new Payload(Kind.SCALAR, value.deepCopy(), null);
    }
    
    /**
     * @throws IllegalArgumentException if the node is not a map or a sequence
     */
    public static Payload structured(JsonNode value) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (!value.isContainerNode()) {
            throw new IllegalArgumentException("Structured payload must be an object or array, was " + value.getNodeType());
        }
        return new Payload(Kind.STRUCTURED, value.deepCopy(), null);
    }
    
    /**
     * @throws IllegalArgumentException if the text does not start with {@value #EXPRESSION_PREFIX}
     */
    public static Payload expression(String expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        if (!isExpression(expression)) {
            throw new IllegalArgumentException("Runtime expression must start with '" + EXPRESSION_PREFIX + "': " + expression);
        }
        return new Payload(Kind.EXPRESSION, null, expression);
    }
    
    public static boolean isExpression(String text) {
        return text != null && text.startsWith(EXPRESSION_PREFIX);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public boolean isScalar() {
        return kind == Kind.SCALAR;
    }
    
    public boolean isStructured() {
        return kind == Kind.STRUCTURED;
    }
    
    public boolean isExpression() {
        return kind == Kind.EXPRESSION;
    }
    
    /**
     * @return the literal value for scalar and structured payloads, null for expressions
     */
    public JsonNode getValue() {
        return value != null ? value.deepCopy() : null;
    }
    
    /**
     * @return the expression text, or null unless this is an expression payload
     */
    public String getExpression() {
        return expression;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return kind == payload.kind &&
               Objects.equals(value, payload.value) &&
               Objects.equals(expression, payload.expression);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, value, expression);
    }
    
    @Override
    public String toString() {
        return "Payload{" +
               "kind=" + kind +
               ", " + (kind == Kind.EXPRESSION ? "expression='" + expression + '\'' : "value=" + value) +
               '}';
    }
}
