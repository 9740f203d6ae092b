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
import dev.mars.arazzo.core.exceptions.ConstraintViolationException;
import dev.mars.arazzo.core.exceptions.DanglingReferenceException;
import dev.mars.arazzo.core.exceptions.DocumentException;
import dev.mars.arazzo.core.exceptions.DuplicateIdentifierException;
import dev.mars.arazzo.core.exceptions.ErrorKind;
import dev.mars.arazzo.core.exceptions.InvalidUnionException;
import dev.mars.arazzo.core.exceptions.TypeMismatchException;
import dev.mars.arazzo.tree.DocumentNodes;
import dev.mars.arazzo.tree.NodePath;
import dev.mars.arazzo.workflow.ActionType;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.Criterion;
import dev.mars.arazzo.workflow.CriterionType;
import dev.mars.arazzo.workflow.Fixtures;
import dev.mars.arazzo.workflow.Step;
import dev.mars.arazzo.workflow.SuccessAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Map;
import java.util.Properties;

import static dev.mars.arazzo.workflow.Fixtures.mapAt;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Breaks one rule at a time in an otherwise valid description and checks the error kind
 * and location reported.
 */
class DescriptionRulesTest {
    
    private DefaultArazzoParser parser;
    private Map<String, Object> document;
    
    @BeforeEach
    void setUp() {
        parser = new DefaultArazzoParser(new ArazzoConfiguration(new Properties()));
        document = Fixtures.load(Fixtures.PET_ADOPTION_YAML);
    }
    
    private <T extends DocumentException> T assertRejected(Class<T> expected, Object... path) {
        T exception = assertThrows(expected, () -> parser.parse(DocumentNodes.ofYaml(document)));
        assertEquals(NodePath.of(path), exception.getPath(), exception.getMessage());
        return exception;
    }
    
    private ArazzoDescription parse() throws Exception {
        return parser.parse(DocumentNodes.ofYaml(document));
    }
    
    // ========== Actions ==========
    
    @Test
    void testGotoWithoutTargetIsRejected() {
        mapAt(document, "workflows", 0, "failureActions", 0).remove("stepId");
        
        assertRejected(InvalidUnionException.class, "workflows", 0, "failureActions", 0);
    }
    
    @Test
    void testGotoWithTwoTargetsIsRejected() {
        mapAt(document, "components", "successActions", "continue").put("workflowId", "notifyOwner");
        
        assertRejected(InvalidUnionException.class, "components", "successActions", "continue");
    }
    
    @Test
    void testEndWithTargetIsRejected() {
        mapAt(document, "workflows", 0, "successActions", 0).put("stepId", "findPet");
        
        assertRejected(ConstraintViolationException.class, "workflows", 0, "successActions", 0, "stepId");
    }
    
    @Test
    void testEndWithNullTargetIsAccepted() throws Exception {
        mapAt(document, "workflows", 0, "successActions", 0).put("stepId", null);
        
        SuccessAction done = parse().getWorkflow("adoptPet").getSuccessActions().get(0).getInline();
        assertEquals(ActionType.END, done.getType());
        assertNull(done.getTarget());
    }
    
    @Test
    void testSuccessActionCannotRetry() {
        mapAt(document, "workflows", 0, "successActions", 0).put("type", "retry");
        
        assertRejected(ConstraintViolationException.class, "workflows", 0, "successActions", 0, "type");
    }
    
    @Test
    void testUnknownActionTypeIsRejected() {
        mapAt(document, "components", "failureActions", "giveUp").put("type", "abort");
        
        ConstraintViolationException exception = assertRejected(ConstraintViolationException.class,
                "components", "failureActions", "giveUp", "type");
        assertTrue(exception.getMessage().contains("[end, goto, retry]"));
    }
    
    @Test
    void testRetryFieldsOnlyOnRetryActions() {
        mapAt(document, "workflows", 0, "failureActions", 0).put("retryLimit", 2);
        
        assertRejected(ConstraintViolationException.class, "workflows", 0, "failureActions", 0, "retryLimit");
    }
    
    @Test
    void testNegativeRetryValuesAreRejected() {
        mapAt(document, "workflows", 0, "steps", 0, "onFailure", 0).put("retryAfter", -1);
        
        assertRejected(ConstraintViolationException.class,
                "workflows", 0, "steps", 0, "onFailure", 0, "retryAfter");
    }
    
    @Test
    void testRetryLimitMustBeAnInteger() {
        mapAt(document, "workflows", 0, "steps", 0, "onFailure", 0).put("retryLimit", 2.5);
        
        TypeMismatchException exception = assertRejected(TypeMismatchException.class,
                "workflows", 0, "steps", 0, "onFailure", 0, "retryLimit");
        assertEquals(ErrorKind.TYPE_MISMATCH, exception.getKind());
    }
    
    // ========== Criteria ==========
    
    @Test
    void testUnknownCriterionTypeIsRejected() {
        mapAt(document, "workflows", 0, "steps", 0, "successCriteria", 0).put("type", "glob");
        
        assertRejected(ConstraintViolationException.class,
                "workflows", 0, "steps", 0, "successCriteria", 0, "type");
    }
    
    @Test
    void testExpressionTypeMustBeJsonPathOrXPath() {
        mapAt(document, "workflows", 0, "steps", 1, "successCriteria", 0, "type").put("type", "regex");
        
        assertRejected(ConstraintViolationException.class,
                "workflows", 0, "steps", 1, "successCriteria", 0, "type", "type");
    }
    
    @Test
    void testCriterionTypeMustBeNameOrObject() {
        mapAt(document, "workflows", 0, "steps", 0, "successCriteria", 0).put("type", 7);
        
        assertRejected(InvalidUnionException.class,
                "workflows", 0, "steps", 0, "successCriteria", 0, "type");
    }
    
    @Test
    void testRegexCriterionDoesNotNeedContext() throws Exception {
        mapAt(document, "workflows", 0, "failureActions", 0, "criteria", 0).remove("context");
        
        Criterion criterion = parse().getWorkflow("adoptPet").getFailureActions().get(0)
                .getInline().getCriteria().get(0);
        assertEquals(CriterionType.REGEX, criterion.getEffectiveType());
        assertNull(criterion.getContext());
    }
    
    // ========== Steps and parameters ==========
    
    @Test
    void testStepWithTwoOperationsIsRejected() {
        mapAt(document, "workflows", 0, "steps", 0).put("workflowId", "notifyOwner");
        
        InvalidUnionException exception = assertRejected(InvalidUnionException.class, "workflows", 0, "steps", 0);
        assertEquals(ErrorKind.AMBIGUOUS_OR_INVALID_UNION, exception.getKind());
    }
    
    @Test
    void testWorkflowStepParametersCannotSetLocation() {
        mapAt(document, "workflows", 0, "steps", 2, "parameters", 0).put("in", "query");
        
        assertRejected(ConstraintViolationException.class,
                "workflows", 0, "steps", 2, "parameters", 0, "in");
    }
    
    @Test
    void testUnknownParameterLocationIsRejected() {
        mapAt(document, "workflows", 0, "steps", 0, "parameters", 0).put("in", "body");
        
        assertRejected(ConstraintViolationException.class,
                "workflows", 0, "steps", 0, "parameters", 0, "in");
    }
    
    @Test
    void testDuplicateParameterIsRejected() {
        mapAt(document, "workflows", 0, "steps", 0, "parameters", 1).put("name", "type");
        
        DuplicateIdentifierException exception = assertRejected(DuplicateIdentifierException.class,
                "workflows", 0, "steps", 0, "parameters", 1, "name");
        assertEquals("type in query", exception.getName());
    }
    
    @Test
    void testSameParameterNameInAnotherLocationIsAllowed() throws Exception {
        Map<String, Object> limit = mapAt(document, "workflows", 0, "steps", 0, "parameters", 1);
        limit.put("name", "type");
        limit.put("in", "header");
        
        Step findPet = parse().getWorkflow("adoptPet").getStep("findPet");
        assertEquals(3, findPet.getParameters().size());
    }
    
    @Test
    void testDuplicateStepIdIsRejected() {
        mapAt(document, "workflows", 0, "steps", 1).put("stepId", "findPet");
        
        DuplicateIdentifierException exception = assertRejected(DuplicateIdentifierException.class,
                "workflows", 0, "steps", 1, "stepId");
        assertEquals("findPet", exception.getName());
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void testKeysThatReadAsTheSameStringAreRejected() {
        Map<Object, Object> step = (Map<Object, Object>) (Map<?, ?>) mapAt(document, "workflows", 0, "steps", 0);
        step.put(1, "integer key");
        step.put("1", "string key");
        
        DuplicateIdentifierException exception = assertRejected(DuplicateIdentifierException.class,
                "workflows", 0, "steps", 0, "1");
        assertEquals("1", exception.getName());
    }
    
    @Test
    void testWorkflowNeedsSteps() {
        mapAt(document, "workflows", 1).put("steps", new ArrayList<>());
        
        assertRejected(ConstraintViolationException.class, "workflows", 1, "steps");
    }
    
    @Test
    void testOutputNamesAreRestricted() {
        mapAt(document, "workflows", 0, "steps", 0, "outputs").put("pet id", "$response.body");
        
        assertRejected(ConstraintViolationException.class,
                "workflows", 0, "steps", 0, "outputs", "pet id");
    }
    
    @Test
    void testFieldOfWrongTypeIsRejected() {
        mapAt(document, "info").put("title", 42);
        
        assertRejected(TypeMismatchException.class, "info", "title");
    }
    
    // ========== Request bodies ==========
    
    @Test
    void testBlankContentTypeIsRejected() {
        mapAt(document, "workflows", 0, "steps", 1, "requestBody").put("contentType", "  ");
        
        assertRejected(ConstraintViolationException.class,
                "workflows", 0, "steps", 1, "requestBody", "contentType");
    }
    
    @Test
    void testRequestBodyWithoutPayloadNeedsNoContentType() throws Exception {
        Map<String, Object> requestBody = mapAt(document, "workflows", 0, "steps", 1, "requestBody");
        requestBody.remove("payload");
        requestBody.remove("contentType");
        
        Step adopt = parse().getWorkflow("adoptPet").getStep("adopt");
        assertNull(adopt.getRequestBody().getContentType());
        assertNull(adopt.getRequestBody().getPayload());
        assertEquals(1, adopt.getRequestBody().getReplacements().size());
    }
    
    // ========== Components and references ==========
    
    @Test
    void testComponentNamesAreRestricted() {
        mapAt(document, "components", "parameters").put("api key", Map.of("name", "k", "value", "v"));
        
        assertRejected(ConstraintViolationException.class, "components", "parameters", "api key");
    }
    
    @Test
    void testDanglingReferenceIsReportedWhereItAppears() {
        mapAt(document, "workflows", 0, "steps", 0, "parameters", 2).put("reference", "$components.parameters.missing");
        
        DanglingReferenceException exception = assertRejected(DanglingReferenceException.class,
                "workflows", 0, "steps", 0, "parameters", 2);
        assertEquals("$components.parameters.missing", exception.getReference());
    }
    
    @Test
    void testReferenceToWrongSectionIsDangling() {
        mapAt(document, "workflows", 0, "steps", 0, "onSuccess", 0).put("reference", "$components.failureActions.giveUp");
        
        DanglingReferenceException exception = assertRejected(DanglingReferenceException.class,
                "workflows", 0, "steps", 0, "onSuccess", 0);
        assertEquals("success action", exception.getExpectedKind());
    }
    
    @Test
    void testReferencesNeedComponents() {
        document.remove("components");
        
        assertRejected(DanglingReferenceException.class, "workflows", 0, "parameters", 0);
    }
}
