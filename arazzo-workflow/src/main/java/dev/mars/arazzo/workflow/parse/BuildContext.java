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

import dev.mars.arazzo.config.ArazzoConfiguration;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.NodeFields;
import dev.mars.arazzo.tree.NodePath;
import dev.mars.arazzo.workflow.ReusableObject;
import dev.mars.arazzo.workflow.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State for a single parse: the references waiting to be checked once the components are
 * known, and the warnings collected for ignored fields. Not shared between parses.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class BuildContext {
    
    private static final Logger logger = Logger.getLogger(BuildContext.class.getName());
    
    private final ArazzoConfiguration configuration;
    private final List<PendingReference> references = new ArrayList<>();
    private final ValidationResult warnings = new ValidationResult();
    
    public BuildContext(ArazzoConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
    }
    
    public ArazzoConfiguration getConfiguration() {
        return configuration;
    }
    
    public void recordReference(NodePath path, ReusableObject reference) {
        references.add(new PendingReference(path, reference));
    }
    
    public List<PendingReference> getReferences() {
        return List.copyOf(references);
    }
    
    /**
     * Records a warning for every key of the map that is neither a known field nor an
     * extension. Such keys are dropped from the model.
     */
    public void warnUnknownKeys(DocumentNode map, Set<String> knownKeys) throws DocumentException {
        for (String key : NodeFields.unknownKeys(map, knownKeys)) {
            NodePath path = map.getPath().child(key);
            String message = "Ignoring unknown field '" + key + "'";
            warnings.addWarning(path.toString(), message);
            logger.log(configuration.isWarnOnUnknownFields() ? Level.WARNING : Level.FINE,
                    message + " at " + path);
        }
    }
    
    public List<ValidationResult.ValidationIssue> getWarnings() {
        return warnings.getWarnings();
    }
    
    /**
     * A reusable object seen during the build, with the path of the map it was read from.
     */
    public static final class PendingReference {
        
        private final NodePath path;
        private final ReusableObject reference;
        
        PendingReference(NodePath path, ReusableObject reference) {
            this.path = path;
            this.reference = reference;
        }
        
        public NodePath getPath() {
            return path;
        }
        
        public ReusableObject getReference() {
            return reference;
        }
    }
}
