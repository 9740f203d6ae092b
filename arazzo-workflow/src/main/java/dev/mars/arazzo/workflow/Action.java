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
 * Common shape of success and failure actions.
 *
 * <p>Construction checks the rules that do not depend on where the action sits in the
 * document: a goto needs a target and an end has none. Whether a retry may carry a
 * target is left to {@link FailureAction}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public abstract class Action {
    
    private final String name;
    private final ActionType type;
    private final ActionTarget target;
    private final List<Criterion> criteria;
    private final Extensions extensions;
    
    protected Action(String name, ActionType type, ActionTarget target, List<Criterion> criteria,
                     Extensions extensions) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        if (type == ActionType.GOTO && target == null) {
            throw new IllegalArgumentException("A goto action needs a workflowId or stepId");
        }
        if (type == ActionType.END && target != null) {
            throw new IllegalArgumentException("An end action cannot have a target");
        }
        this.target = target;
        this.criteria = criteria != null ? List.copyOf(criteria) : List.of();
        this.extensions = extensions != null ? extensions : Extensions.empty();
    }
    
    public String getName() {
        return name;
    }
    
    public ActionType getType() {
        return type;
    }
    
    /**
     * @return the target, or null when the action does not transfer control elsewhere
     */
    public ActionTarget getTarget() {
        return target;
    }
    
    public List<Criterion> getCriteria() {
        return criteria;
    }
    
    public Extensions getExtensions() {
        return extensions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Action action = (Action) o;
        return Objects.equals(name, action.name) &&
               type == action.type &&
               Objects.equals(target, action.target) &&
               Objects.equals(criteria, action.criteria) &&
               Objects.equals(extensions, action.extensions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, type, target, criteria, extensions);
    }
}
