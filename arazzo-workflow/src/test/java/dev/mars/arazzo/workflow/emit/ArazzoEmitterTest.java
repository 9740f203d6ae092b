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

package dev.mars.arazzo.workflow.emit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.arazzo.config.ArazzoConfiguration;
import dev.mars.arazzo.tree.DocumentNodes;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.Fixtures;
import dev.mars.arazzo.workflow.parse.DefaultArazzoParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static dev.mars.arazzo.workflow.Fixtures.mapAt;
import static org.junit.jupiter.api.Assertions.*;

class ArazzoEmitterTest {
    
    private DefaultArazzoParser parser;
    private ArazzoEmitter emitter;
    
    @BeforeEach
    void setUp() {
        ArazzoConfiguration configuration = new ArazzoConfiguration(new Properties());
        parser = new DefaultArazzoParser(configuration);
        emitter = new ArazzoEmitter(configuration);
    }
    
    private ArazzoDescription load(String fixture) throws Exception {
        return parser.parseYaml(Fixtures.read(fixture));
    }
    
    private static List<String> keys(JsonNode node) {
        List<String> keys = new ArrayList<>();
        node.fieldNames().forEachRemaining(keys::add);
        return keys;
    }
    
    // ========== Round trips ==========
    
    @ParameterizedTest
    @ValueSource(strings = {Fixtures.PETSTORE_YAML, Fixtures.PET_ADOPTION_YAML})
    void testJsonTreeReadsBackToSameModel(String fixture) throws Exception {
        ArazzoDescription description = load(fixture);
        
        ObjectNode tree = emitter.toJsonTree(description);
        
        assertEquals(description, parser.parse(DocumentNodes.ofJson(tree)));
    }
    
    @ParameterizedTest
    @ValueSource(strings = {Fixtures.PETSTORE_YAML, Fixtures.PET_ADOPTION_YAML})
    void testYamlTreeReadsBackToSameModel(String fixture) throws Exception {
        ArazzoDescription description = load(fixture);
        
        Map<String, Object> tree = emitter.toYamlTree(description);
        
        assertEquals(description, parser.parse(DocumentNodes.ofYaml(tree)));
    }
    
    @ParameterizedTest
    @ValueSource(strings = {Fixtures.PETSTORE_YAML, Fixtures.PET_ADOPTION_YAML})
    void testTextReadsBackToSameModel(String fixture) throws Exception {
        ArazzoDescription description = load(fixture);
        
        assertEquals(description, parser.parseJson(emitter.toJson(description)));
        assertEquals(description, parser.parseYaml(emitter.toYaml(description)));
    }
    
    @Test
    void testEmissionIsDeterministic() throws Exception {
        ArazzoDescription description = load(Fixtures.PET_ADOPTION_YAML);
        
        assertEquals(emitter.toYaml(description), emitter.toYaml(load(Fixtures.PET_ADOPTION_YAML)));
        assertEquals(emitter.toJson(description), emitter.toJson(description));
    }
    
    @Test
    void testCompactJsonWhenPrettyPrintDisabled() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(ArazzoConfiguration.JSON_PRETTY_PRINT, "false");
        ArazzoEmitter compact = new ArazzoEmitter(new ArazzoConfiguration(properties));
        
        String json = compact.toJson(load(Fixtures.PETSTORE_YAML));
        
        assertFalse(json.contains("\n"));
        assertTrue(json.startsWith("{\"arazzo\":\"1.0.1\""));
    }
    
    // ========== Shape of the output ==========
    
    @Test
    void testRootKeyOrder() throws Exception {
        ObjectNode tree = emitter.toJsonTree(load(Fixtures.PET_ADOPTION_YAML));
        
        assertEquals(List.of("arazzo", "info", "sourceDescriptions", "workflows", "components", "x-generated-by"),
                keys(tree));
        assertEquals(List.of("title", "summary", "version", "x-audience"), keys(tree.get("info")));
    }
    
    @Test
    void testAbsentOptionalFieldsAreNotWritten() throws Exception {
        ObjectNode tree = emitter.toJsonTree(load(Fixtures.PETSTORE_YAML));
        JsonNode workflow = tree.get("workflows").get(0);
        
        assertFalse(tree.has("components"));
        assertFalse(workflow.has("dependsOn"));
        assertFalse(workflow.has("parameters"));
        assertFalse(workflow.has("successActions"));
        assertFalse(workflow.get("steps").get(0).has("onFailure"));
        assertFalse(workflow.get("steps").get(0).get("successCriteria").get(0).has("type"));
    }
    
    @Test
    void testStepWritesOnlyItsOperationVariant() throws Exception {
        JsonNode steps = emitter.toJsonTree(load(Fixtures.PET_ADOPTION_YAML)).get("workflows").get(0).get("steps");
        
        assertEquals("findPetsByType", steps.get(0).get("operationId").asText());
        assertFalse(steps.get(0).has("operationPath"));
        assertFalse(steps.get(0).has("workflowId"));
        assertEquals("notifyOwner", steps.get(2).get("workflowId").asText());
        assertFalse(steps.get(2).get("parameters").get(0).has("in"));
    }
    
    @Test
    void testPayloadsKeepTheirShape() throws Exception {
        JsonNode workflows = emitter.toJsonTree(load(Fixtures.PET_ADOPTION_YAML)).get("workflows");
        JsonNode findPet = workflows.get(0).get("steps").get(0);
        JsonNode adoptBody = workflows.get(0).get("steps").get(1).get("requestBody");
        JsonNode notifyBody = workflows.get(1).get("steps").get(0).get("requestBody");
        
        assertEquals("$inputs.petType", findPet.get("parameters").get(0).get("value").asText());
        assertTrue(findPet.get("parameters").get(1).get("value").isInt());
        assertTrue(adoptBody.get("payload").isObject());
        assertEquals(2, adoptBody.get("payload").get("notes").size());
        assertEquals("Your adoption is complete", notifyBody.get("payload").asText());
    }
    
    @Test
    void testReferencesAreWrittenAsReferences() throws Exception {
        JsonNode findPet = emitter.toJsonTree(load(Fixtures.PET_ADOPTION_YAML))
                .get("workflows").get(0).get("steps").get(0);
        JsonNode pageSize = findPet.get("parameters").get(2);
        
        assertEquals(List.of("reference", "value"), keys(pageSize));
        assertEquals("$components.parameters.pageSize", pageSize.get("reference").asText());
        assertEquals(5, pageSize.get("value").asInt());
        assertEquals(List.of("reference"), keys(findPet.get("onSuccess").get(0)));
    }
    
    @Test
    void testCriterionTypes() throws Exception {
        JsonNode workflow = emitter.toJsonTree(load(Fixtures.PET_ADOPTION_YAML)).get("workflows").get(0);
        JsonNode jsonPath = workflow.get("steps").get(0).get("successCriteria").get(1);
        JsonNode expressionType = workflow.get("steps").get(1).get("successCriteria").get(0).get("type");
        
        assertEquals(List.of("context", "condition", "type"), keys(jsonPath));
        assertEquals("jsonpath", jsonPath.get("type").asText());
        assertEquals("jsonpath", expressionType.get("type").asText());
        assertEquals("draft-goessner-dispatch-jsonpath-00", expressionType.get("version").asText());
    }
    
    @Test
    void testRetryActionFields() throws Exception {
        JsonNode retry = emitter.toJsonTree(load(Fixtures.PET_ADOPTION_YAML))
                .get("workflows").get(0).get("steps").get(0).get("onFailure").get(0);
        
        assertEquals(List.of("name", "type", "retryAfter", "retryLimit", "criteria"), keys(retry));
        assertEquals(1.5, retry.get("retryAfter").asDouble());
        assertEquals(3, retry.get("retryLimit").asInt());
    }
    
    @Test
    void testExtensionsKeptAndUnknownKeysDropped() throws Exception {
        Map<String, Object> document = Fixtures.load(Fixtures.PET_ADOPTION_YAML);
        mapAt(document, "workflows", 0, "steps", 0).put("bogus", true);
        mapAt(document, "workflows", 0, "steps", 0).put("x-foo", Map.of("nested", List.of(1, 2)));
        
        JsonNode step = emitter.toJsonTree(parser.parse(DocumentNodes.ofYaml(document)))
                .get("workflows").get(0).get("steps").get(0);
        
        assertFalse(step.has("bogus"));
        assertEquals(2, step.get("x-foo").get("nested").size());
        assertEquals(30, step.get("x-timeout").asInt());
        List<String> keys = keys(step);
        assertEquals(List.of("x-timeout", "x-foo"), keys.subList(keys.size() - 2, keys.size()));
    }
    
    @Test
    void testComponentsSections() throws Exception {
        JsonNode components = emitter.toJsonTree(load(Fixtures.PET_ADOPTION_YAML)).get("components");
        
        assertEquals(List.of("inputs", "parameters", "successActions", "failureActions", "x-registry"), keys(components));
        assertEquals(List.of("apiKey", "pageSize"), keys(components.get("parameters")));
        assertEquals("header", components.get("parameters").get("apiKey").get("in").asText());
    }
}
