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

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Loads the description documents under {@code src/test/resources/descriptions} and edits
 * their raw YAML object graphs for negative tests.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public final class Fixtures {
    
    public static final String PETSTORE_YAML = "petstore.arazzo.yaml";
    public static final String PETSTORE_JSON = "petstore.arazzo.json";
    public static final String PET_ADOPTION_YAML = "pet-adoption.arazzo.yaml";
    
    private Fixtures() {
    }
    
    public static String read(String name) {
        try (InputStream input = Fixtures.class.getResourceAsStream("/descriptions/" + name)) {
            if (input == null) {
                throw new IllegalArgumentException("No fixture named " + name);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    /**
     * Loads a fixture as a mutable SnakeYAML object graph.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> load(String name) {
        return (Map<String, Object>) new Yaml(new SafeConstructor(new LoaderOptions())).load(read(name));
    }
    
    /**
     * Follows a path of map keys and list indices from the root and returns the node found.
     */
    public static Object at(Map<String, Object> root, Object... path) {
        Object current = root;
        for (Object segment : path) {
            if (segment instanceof Integer) {
                current = ((List<?>) current).get((Integer) segment);
            } else {
                current = ((Map<?, ?>) current).get(segment);
            }
        }
        return current;
    }
    
    /**
     * Returns the map found at the given path.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> mapAt(Map<String, Object> root, Object... path) {
        return (Map<String, Object>) at(root, path);
    }
    
    /**
     * Removes the last key of the path from the map holding it.
     */
    public static Map<String, Object> without(Map<String, Object> root, Object... path) {
        Object[] parentPath = new Object[path.length - 1];
        System.arraycopy(path, 0, parentPath, 0, parentPath.length);
        mapAt(root, parentPath).remove(path[path.length - 1]);
        return root;
    }
}
