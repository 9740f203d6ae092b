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
 * Exception thrown when raw JSON or YAML text cannot be read into a document tree.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class DocumentReadException extends ArazzoException {
    
    private final String format;
    
    public DocumentReadException(String format, String message, Throwable cause) {
        super(message, cause);
        this.format = format;
    }
    
    public String getFormat() {
        return format;
    }
    
    @Override
    public String getMessage() {
        return String.format("%s document could not be read: %s", format, super.getMessage());
    }
}
