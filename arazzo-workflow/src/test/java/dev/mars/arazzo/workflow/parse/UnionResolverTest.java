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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.arazzo.config.ArazzoConfiguration;
import dev.mars.arazzo.core.exceptions.InvalidUnionException;
import dev.mars.arazzo.tree.DocumentNode;
import dev.mars.arazzo.tree.DocumentNodes;
import dev.mars.arazzo.workflow.ActionTarget;
import dev.mars.arazzo.workflow.InlineOrReference;
import dev.mars.arazzo.workflow.OperationReference;
import dev.mars.arazzo.workflow.Payload;
import dev.mars.arazzo.workflow.ReusableKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class UnionResolverTest {
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private UnionResolver resolver;
    private BuildContext context;
    
    @BeforeEach
    void setUp() {
        resolver = new UnionResolver();
        context = new BuildContext(new ArazzoConfiguration(new Properties()));
    }
    
    private static DocumentNode json(String text) throws Exception {
        return DocumentNodes.ofJson(MAPPER.readTree(text));
    }
    
    // ========== Payload ==========
    
    @Test
    void testContainersAreStructured() throws Exception {
        Payload object = resolver.resolvePayload(json("{\"petId\": \"$steps.find.outputs.id\"}"));
        Payload array = resolver.resolvePayload(json("[1, 2]"));
        
        assertEquals(Payload.Kind.STRUCTURED, object.getKind());
        assertEquals("$steps.find.outputs.id", object.getValue().get("petId").asText());
        assertEquals(Payload.Kind.STRUCTURED, array.getKind());
    }
    
    @Test
    void testDollarStringsAreExpressions() throws Exception {
        Payload payload = resolver.resolvePayload(json("\"$inputs.username\""));
        
        assertTrue(payload.isExpression());
        assertEquals("$inputs.username", payload.getExpression());
        assertNull(payload.getValue());
    }
    
    @Test
    void testOtherValuesAreScalars() throws Exception {
        assertEquals(Payload.scalar(TextNode.valueOf("available")), resolver.resolvePayload(json("\"available\"")));
        assertEquals(Payload.scalar(IntNode.valueOf(42)), resolver.resolvePayload(json("42")));
        assertTrue(resolver.resolvePayload(json("true")).isScalar());
        assertTrue(resolver.resolvePayload(json("null")).getValue().isNull());
    }
    
    @Test
    void testAllThreePayloadKindsAreDistinct() throws Exception {
        List<Payload> payloads = List.of(
                resolver.resolvePayload(json("\"available\"")),
                resolver.resolvePayload(json("{\"status\": \"available\"}")),
                resolver.resolvePayload(json("\"$inputs.status\"")));
        
        assertEquals(List.of(Payload.Kind.SCALAR, Payload.Kind.STRUCTURED, Payload.Kind.EXPRESSION),
                List.of(payloads.get(0).getKind(), payloads.get(1).getKind(), payloads.get(2).getKind()));
    }
    
    // ========== Operation reference ==========
    
    @Test
    void testSingleOperationReference() throws Exception {
        assertEquals(OperationReference.operationPath("#/paths/~1pets/get"),
                resolver.resolveOperationReference(json("{\"stepId\": \"s\", \"operationPath\": \"#/paths/~1pets/get\"}")));
    }
    
    @Test
    void testTwoOperationReferencesAreRejected() throws Exception {
        DocumentNode step = json("{\"stepId\": \"s\", \"operationId\": \"getPet\", \"workflowId\": \"other\"}");
        
        InvalidUnionException exception = assertThrows(InvalidUnionException.class,
                () -> resolver.resolveOperationReference(step));
        
        assertEquals(List.of("operationId", "operationPath", "workflowId"), exception.getCandidates());
        assertTrue(exception.getDetail().contains("[operationId, workflowId]"));
    }
    
    @Test
    void testNullOperationReferenceCountsAsAbsent() throws Exception {
        DocumentNode step = json("{\"stepId\": \"s\", \"operationId\": \"getPet\", \"workflowId\": null}");
        assertEquals(OperationReference.operationId("getPet"), resolver.resolveOperationReference(step));
    }
    
    @Test
    void testMissingOperationReferenceIsRejected() throws Exception {
        DocumentNode step = json("{\"stepId\": \"s\"}");
        assertThrows(InvalidUnionException.class, () -> resolver.resolveOperationReference(step));
    }
    
    // ========== Action target ==========
    
    @Test
    void testActionTargets() throws Exception {
        assertEquals(ActionTarget.step("retry"),
                resolver.resolveActionTarget(json("{\"stepId\": \"retry\"}"), true));
        assertEquals(ActionTarget.workflow("cleanup"),
                resolver.resolveActionTarget(json("{\"workflowId\": \"cleanup\"}"), false));
        assertNull(resolver.resolveActionTarget(json("{\"name\": \"stop\"}"), false));
    }
    
    @Test
    void testNullActionTargetCountsAsAbsent() throws Exception {
        assertNull(resolver.resolveActionTarget(json("{\"name\": \"stop\", \"stepId\": null}"), false));
        assertEquals(ActionTarget.step("retry"),
                resolver.resolveActionTarget(json("{\"stepId\": \"retry\", \"workflowId\": null}"), true));
        assertThrows(InvalidUnionException.class,
                () -> resolver.resolveActionTarget(json("{\"name\": \"jump\", \"stepId\": null}"), true));
    }
    
    @Test
    void testInvalidActionTargets() throws Exception {
        DocumentNode both = json("{\"stepId\": \"a\", \"workflowId\": \"b\"}");
        DocumentNode none = json("{\"name\": \"jump\"}");
        
        assertThrows(InvalidUnionException.class, () -> resolver.resolveActionTarget(both, false));
        assertThrows(InvalidUnionException.class, () -> resolver.resolveActionTarget(none, true));
    }
    
    // ========== Inline or reference ==========
    
    @Test
    void testReferenceIsRecordedForLaterResolution() throws Exception {
        DocumentNode node = json("{\"reference\": \"$components.parameters.pageSize\", \"value\": 5, \"x-note\": 1}");
        
        InlineOrReference<String> result = resolver.resolveInlineOrReference(node, ReusableKind.PARAMETER,
                n -> fail("inline builder must not run"), context);
        
        assertTrue(result.isReference());
        assertEquals("pageSize", result.getReference().getComponentName());
        assertEquals(Payload.scalar(IntNode.valueOf(5)), result.getReference().getValue());
        assertEquals(1, context.getReferences().size());
        assertEquals(node.getPath(), context.getReferences().get(0).getPath());
    }
    
    @Test
    void testInlineEntityIsBuilt() throws Exception {
        InlineOrReference<String> result = resolver.resolveInlineOrReference(json("{\"name\": \"limit\"}"),
                ReusableKind.PARAMETER, n -> n.get("name").asText(), context);
        
        assertTrue(result.isInline());
        assertEquals("limit", result.getInline());
        assertTrue(context.getReferences().isEmpty());
    }
    
    @Test
    void testReferenceWithInlineFieldsIsRejected() throws Exception {
        DocumentNode node = json("{\"reference\": \"$components.successActions.done\", \"name\": \"done\"}");
        
        InvalidUnionException exception = assertThrows(InvalidUnionException.class,
                () -> resolver.resolveInlineOrReference(node, ReusableKind.SUCCESS_ACTION, n -> "inline", context));
        
        assertEquals(List.of("reusable object", "inline success action"), exception.getCandidates());
    }
    
    @Test
    void testOnlyParameterReferencesMayOverrideValue() throws Exception {
        DocumentNode node = json("{\"reference\": \"$components.failureActions.giveUp\", \"value\": 1}");
        
        assertThrows(InvalidUnionException.class,
                () -> resolver.resolveInlineOrReference(node, ReusableKind.FAILURE_ACTION, n -> "inline", context));
    }
    
    // ========== Generic resolution ==========
    
    @Test
    void testFirstMatchHonoursCandidateOrder() throws Exception {
        List<UnionResolver.Candidate<String>> candidates = List.of(
                UnionResolver.candidate("number", DocumentNode::isNumber, n -> "number"),
                UnionResolver.candidate("anything", n -> true, n -> "anything"));
        
        assertEquals("number", resolver.firstMatch(json("1"), "test", candidates));
        assertEquals("anything", resolver.firstMatch(json("\"1\""), "test", candidates));
        assertThrows(InvalidUnionException.class, () -> resolver.exactlyOne(json("1"), "test", candidates));
    }
}
