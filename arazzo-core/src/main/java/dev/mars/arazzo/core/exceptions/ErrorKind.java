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

package dev.mars.arazzo.core.exceptions;

/**
 * Classification of the structural and semantic failures raised while building an
 * Arazzo description from a document tree. Every kind is fatal to the enclosing build.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public enum ErrorKind {
    /** A node is not the kind a field requires (e.g. a sequence where a map is expected). */
    SHAPE_MISMATCH,
    /** A required field is absent. */
    MISSING_FIELD,
    /** A scalar field has the wrong type. */
    TYPE_MISMATCH,
    /** A polymorphic field matched none, or more than one, of its candidate shapes. */
    AMBIGUOUS_OR_INVALID_UNION,
    /** A uniqueness rule is violated. */
    DUPLICATE_IDENTIFIER,
    /** A reusable-object reference does not resolve inside the components. */
    DANGLING_REFERENCE,
    /** The document declares an Arazzo version this engine does not handle. */
    UNSUPPORTED_VERSION,
    /** A value is well-typed but breaks a cross-field or format rule. */
    CONSTRAINT_VIOLATION
}
