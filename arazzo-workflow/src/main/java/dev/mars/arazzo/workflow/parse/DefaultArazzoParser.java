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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.mars.arazzo.config.ArazzoConfiguration;
import dev.mars.arazzo.core.exceptions.ArazzoException;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.DocumentReadException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.DocumentNodes;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.ValidationResult;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Parses Arazzo documents from YAML or JSON text, or from a tree read elsewhere.
 *
 * <p>YAML is loaded with SnakeYAML's {@link SafeConstructor}, so only plain maps, lists and
 * scalars are created. Both readers reject duplicate keys unless configured otherwise.
 * Instances are immutable and may be shared; every parse gets its own
 * {@link BuildContext}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class DefaultArazzoParser implements ArazzoParser {
    
    private static final Logger logger = Logger.getLogger(DefaultArazzoParser.class.getName());
    
    static final String YAML = "YAML";
    static final String JSON = "JSON";
    
    private final ArazzoConfiguration configuration;
    private final DescriptionBuilder descriptionBuilder;
    private final ReferenceResolver referenceResolver;
    private final LoaderOptions loaderOptions;
    private final ObjectMapper objectMapper;
    
    public DefaultArazzoParser() {
        this(new ArazzoConfiguration());
    }
    
    public DefaultArazzoParser(ArazzoConfiguration configuration) {
        this.configuration = configuration;
        this.descriptionBuilder = new DescriptionBuilder(configuration);
        this.referenceResolver = new ReferenceResolver();
        this.loaderOptions = new LoaderOptions();
        this.loaderOptions.setAllowDuplicateKeys(configuration.isYamlDuplicateKeysAllowed());
        this.loaderOptions.setMaxAliasesForCollections(configuration.getYamlMaxAliases());
        this.objectMapper = JsonMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
    }
    
    @Override
    public ArazzoDescription parse(DocumentNode root) throws DocumentException {
        return build(root, new BuildContext(configuration));
    }
    
    @Override
    public ArazzoDescription parseYaml(String yamlContent) throws ArazzoException {
        return parse(readYaml(yamlContent));
    }
    
    @Override
    public ArazzoDescription parseJson(String jsonContent) throws ArazzoException {
        return parse(readJson(jsonContent));
    }
    
    @Override
    public ArazzoDescription parse(Path file) throws ArazzoException {
        boolean json = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new DocumentReadException(json ? JSON : YAML, "Failed to read file " + file, e);
        }
        logger.fine("Parsing " + file);
        return json ? parseJson(content) : parseYaml(content);
    }
    
    @Override
    public ValidationResult validate(DocumentNode root) {
        BuildContext context = new BuildContext(configuration);
        ValidationResult result = new ValidationResult();
        try {
            build(root, context);
        } catch (DocumentException e) {
            result.addError(e);
        }
        context.getWarnings().forEach(warning -> result.addWarning(warning.getFieldPath(), warning.getMessage()));
        return result;
    }
    
    @Override
    public ValidationResult validateYaml(String yamlContent) {
        try {
            return validate(readYaml(yamlContent));
        } catch (DocumentReadException e) {
            ValidationResult result = new ValidationResult();
            result.addError(null, null, e.getMessage());
            return result;
        }
    }
    
    /**
     * Loads YAML text into a document tree without building the model.
     */
    public DocumentNode readYaml(String yamlContent) throws DocumentReadException {
        Object data;
        try {
            data = new Yaml(new SafeConstructor(loaderOptions)).load(yamlContent);
        } catch (YAMLException e) {
            throw new DocumentReadException(YAML, e.getMessage(), e);
        }
        if (data == null) {
            throw new DocumentReadException(YAML, "Empty document", null);
        }
        return DocumentNodes.ofYaml(data);
    }
    
    /**
     * Reads JSON text into a document tree without building the model.
     */
    public DocumentNode readJson(String jsonContent) throws DocumentReadException {
        JsonNode data;
        try {
            data = objectMapper.readTree(jsonContent);
        } catch (JsonProcessingException e) {
            throw new DocumentReadException(JSON, e.getOriginalMessage(), e);
        }
        if (data == null || data.isMissingNode()) {
            throw new DocumentReadException(JSON, "Empty document", null);
        }
        return DocumentNodes.ofJson(data);
    }
    
    private ArazzoDescription build(DocumentNode root, BuildContext context) throws DocumentException {
        logger.fine("Building Arazzo description");
        ArazzoDescription description = descriptionBuilder.buildDescription(root, context);
        referenceResolver.verify(description, context);
        logger.fine("Built Arazzo description '" + description.getInfo().getTitle() + "' with "
                + description.getWorkflows().size() + " workflow(s) and "
                + context.getWarnings().size() + " warning(s)");
        return description;
    }
}
