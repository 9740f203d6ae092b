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

package dev.mars.arazzo.workflow.parse;

import dev.mars.arazzo.core.exceptions.ArazzoException;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.ValidationResult;

import java.nio.file.Path;

public interface ArazzoParser {
    
    /**
     * Builds the model from an already parsed document tree. The tree may come from either
     * reader; the result does not depend on which.
     *
     * @param root the document root
     * @return the validated model
     * @throws DocumentException for the first problem found
     */
    ArazzoDescription parse(DocumentNode root) throws DocumentException;
    
    ArazzoDescription parseYaml(String yamlContent) throws ArazzoException;
    
    ArazzoDescription parseJson(String jsonContent) throws ArazzoException;
    
    /**
     * Reads a file as JSON when its name ends in {@code .json}, and as YAML otherwise.
     */
    ArazzoDescription parse(Path file) throws ArazzoException;
    
    /**
     * Runs the same checks as {@link #parse(DocumentNode)} but reports the outcome instead of
     * throwing. Ignored fields are reported as warnings.
     */
    ValidationResult validate(DocumentNode root);
    
    /**
     * Validates YAML text, reporting syntax errors as well as document errors.
     */
    ValidationResult validateYaml(String yamlContent);
}
