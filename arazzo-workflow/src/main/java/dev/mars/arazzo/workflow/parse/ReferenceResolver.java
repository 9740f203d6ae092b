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

import dev.mars.arazzo.core.exceptions.DanglingReferenceException;
import dev.mars.arazzo.tree.NodePath;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.Components;
import dev.mars.arazzo.workflow.FailureAction;
import dev.mars.arazzo.workflow.InlineOrReference;
import dev.mars.arazzo.workflow.Parameter;
import dev.mars.arazzo.workflow.ReusableKind;
import dev.mars.arazzo.workflow.ReusableObject;
import dev.mars.arazzo.workflow.SuccessAction;

import java.util.logging.Logger;

/**
 * Checks that every reusable object points at a component of the kind expected where it
 * appears, and looks up the components behind references.
 *
 * <p>Checking runs after the whole document is built because a reference may appear
 * before the {@code components} section that defines its target.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ReferenceResolver {
    
    private static final Logger logger = Logger.getLogger(ReferenceResolver.class.getName());
    
    /**
     * @throws DanglingReferenceException for the first reference, in document order, whose
     *         target does not exist
     */
    public void verify(ArazzoDescription description, BuildContext context) throws DanglingReferenceException {
        Components components = description.getComponents();
        for (BuildContext.PendingReference pending : context.getReferences()) {
            check(pending.getPath(), pending.getReference(), components);
        }
        logger.fine("Verified " + context.getReferences().size() + " component references");
    }
    
    public Parameter resolveParameter(InlineOrReference<Parameter> parameter, Components components)
            throws DanglingReferenceException {
        if (parameter.isInline()) {
            return parameter.getInline();
        }
        ReusableObject reference = parameter.getReference();
        String name = componentName(reference, components);
        Parameter target = components.getParameters().get(name);
        if (reference.getValue() == null) {
            return target;
        }
        return new Parameter(target.getName(), target.getIn(), reference.getValue(), target.getExtensions());
    }
    
    public SuccessAction resolveSuccessAction(InlineOrReference<SuccessAction> action, Components components)
            throws DanglingReferenceException {
        if (action.isInline()) {
            return action.getInline();
        }
        String name = componentName(action.getReference(), components);
        return components.getSuccessActions().get(name);
    }
    
    public FailureAction resolveFailureAction(InlineOrReference<FailureAction> action, Components components)
            throws DanglingReferenceException {
        if (action.isInline()) {
            return action.getInline();
        }
        String name = componentName(action.getReference(), components);
        return components.getFailureActions().get(name);
    }
    
    private String componentName(ReusableObject reference, Components components) throws DanglingReferenceException {
        return check(NodePath.root(), reference, components);
    }
    
    private String check(NodePath path, ReusableObject reference, Components components) throws DanglingReferenceException {
        ReusableKind kind = reference.getTargetKind();
        String name = reference.getComponentName();
        if (name == null || components == null || !components.contains(kind, name)) {
            throw new DanglingReferenceException(path, reference.getReference(), kind.getLabel());
        }
        return name;
    }
}
