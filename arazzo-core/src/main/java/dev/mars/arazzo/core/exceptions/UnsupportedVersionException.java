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

import dev.mars.arazzo.tree.NodePath;

import java.util.List;

/**
 * Thrown before any other parsing when the document root declares an Arazzo
 * version outside the supported version lines.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class UnsupportedVersionException extends DocumentException {
    
    private final String found;
    private final List<String> supported;
    
    public UnsupportedVersionException(NodePath path, String found, List<String> supported) {
        super(ErrorKind.UNSUPPORTED_VERSION, path,
                "Unsupported Arazzo version '" + found + "', supported: " + supported);
        this.found = found;
        this.supported = List.copyOf(supported);
    }
    
    public String getFound() {
        return found;
    }
    
    public List<String> getSupported() {
        return supported;
    }
}
