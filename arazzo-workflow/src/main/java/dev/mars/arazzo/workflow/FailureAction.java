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
 * Action taken when a step fails. A retry carries how long to wait, in seconds, and how
 * many times to try again; other types carry neither.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class FailureAction extends Action {
    
    private final Double retryAfter;
    private final Integer retryLimit;
    
    public FailureAction(String name, ActionType type, ActionTarget target, Double retryAfter,
                         Integer retryLimit, List<Criterion> criteria, Extensions extensions) {
        super(name, type, target, criteria, extensions);
        if (type == ActionType.RETRY) {
            if (retryAfter == null || retryLimit == null) {
                throw new IllegalArgumentException("A retry action needs retryAfter and retryLimit");
            }
            if (retryAfter < 0 || retryLimit < 0) {
                throw new IllegalArgumentException("retryAfter and retryLimit cannot be negative");
            }
        } else if (retryAfter != null || retryLimit != null) {
            throw new IllegalArgumentException("Only retry actions carry retryAfter and retryLimit");
        }
        this.retryAfter = retryAfter;
        this.retryLimit = retryLimit;
    }
    
    public Double getRetryAfter() {
        return retryAfter;
    }
    
    public Integer getRetryLimit() {
        return retryLimit;
    }
    
    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        FailureAction that = (FailureAction) o;
        return Objects.equals(retryAfter, that.retryAfter) &&
               Objects.equals(retryLimit, that.retryLimit);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), retryAfter, retryLimit);
    }
    
    @Override
    public String toString() {
        return "FailureAction{" +
               "name='" + getName() + '\'' +
               ", type=" + getType() +
               (getTarget() != null ? ", target=" + getTarget() : "") +
               (retryAfter != null ? ", retryAfter=" + retryAfter + ", retryLimit=" + retryLimit : "") +
               '}';
    }
}
