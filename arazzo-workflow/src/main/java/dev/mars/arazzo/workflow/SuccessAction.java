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

/**
 * Action taken when a step succeeds.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class SuccessAction extends Action {
    
    public SuccessAction(String name, ActionType type, ActionTarget target, List<Criterion> criteria,
                         Extensions extensions) {
        super(name, type, target, criteria, extensions);
        if (type == ActionType.RETRY) {
            throw new IllegalArgumentException("Success actions cannot retry");
        }
    }
    
    @Override
    public String toString() {
        return "SuccessAction{" +
               "name='" + getName() + '\'' +
               ", type=" + getType() +
               (getTarget() != null ? ", target=" + getTarget() : "") +
               '}';
    }
}
