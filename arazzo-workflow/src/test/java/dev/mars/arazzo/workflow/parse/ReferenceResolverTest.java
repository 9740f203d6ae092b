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

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.arazzo.config.ArazzoConfiguration;
import dev.mars.arazzo.core.exceptions.DanglingReferenceException;
import dev.mars.arazzo.tree.DocumentNodes;
import dev.mars.arazzo.tree.Extensions;
import dev.mars.arazzo.tree.NodePath;
import dev.mars.arazzo.workflow.ActionTarget;
import dev.mars.arazzo.workflow.ActionType;
import dev.mars.arazzo.workflow.ArazzoDescription;
import dev.mars.arazzo.workflow.Components;
import dev.mars.arazzo.workflow.FailureAction;
import dev.mars.arazzo.workflow.Fixtures;
import dev.mars.arazzo.workflow.InlineOrReference;
import dev.mars.arazzo.workflow.Parameter;
import dev.mars.arazzo.workflow.ParameterLocation;
import dev.mars.arazzo.workflow.Payload;
import dev.mars.arazzo.workflow.ReusableKind;
import dev.mars.arazzo.workflow.ReusableObject;
import dev.mars.arazzo.workflow.Step;
import dev.mars.arazzo.workflow.SuccessAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {
    
    private ReferenceResolver resolver;
    private Components components;
    
    @BeforeEach
    void setUp() {
        resolver = new ReferenceResolver();
        Parameter pageSize = new Parameter("pageSize", ParameterLocation.QUERY,
                Payload.scalar(IntNode.valueOf(20)), Extensions.empty());
        SuccessAction next = new SuccessAction("next", ActionType.GOTO, ActionTarget.step("adopt"),
                List.of(), Extensions.empty());
        FailureAction giveUp = new FailureAction("giveUp", ActionType.END, null, null, null,
                List.of(), Extensions.empty());
        components = new Components(Map.of(), Map.of("pageSize", pageSize), Map.of("next", next),
                Map.of("giveUp", giveUp), Extensions.empty());
    }
    
    private static <T> InlineOrReference<T> reference(String reference, ReusableKind kind, Payload value) {
        return InlineOrReference.reference(new ReusableObject(reference, kind, value));
    }
    
    @Test
    void testParameterReferenceResolvesToComponent() throws Exception {
        Parameter parameter = resolver.resolveParameter(
                reference("$components.parameters.pageSize", ReusableKind.PARAMETER, null), components);
        
        assertEquals("pageSize", parameter.getName());
        assertEquals(Payload.scalar(IntNode.valueOf(20)), parameter.getValue());
    }
    
    @Test
    void testParameterReferenceValueOverridesComponentValue() throws Exception {
        Parameter parameter = resolver.resolveParameter(
                reference("$components.parameters.pageSize", ReusableKind.PARAMETER, Payload.expression("$inputs.size")),
                components);
        
        assertEquals("pageSize", parameter.getName());
        assertEquals(ParameterLocation.QUERY, parameter.getIn());
        assertEquals(Payload.expression("$inputs.size"), parameter.getValue());
        assertEquals(Payload.scalar(IntNode.valueOf(20)), components.getParameters().get("pageSize").getValue());
    }
    
    @Test
    void testInlineEntitiesResolveToThemselves() throws Exception {
        Parameter inline = new Parameter("q", ParameterLocation.QUERY, Payload.scalar(TextNode.valueOf("cats")), null);
        
        assertSame(inline, resolver.resolveParameter(InlineOrReference.inline(inline), components));
    }
    
    @Test
    void testActionReferencesResolveWithinTheirSection() throws Exception {
        SuccessAction next = resolver.resolveSuccessAction(
                reference("$components.successActions.next", ReusableKind.SUCCESS_ACTION, null), components);
        FailureAction giveUp = resolver.resolveFailureAction(
                reference("$components.failureActions.giveUp", ReusableKind.FAILURE_ACTION, null), components);
        
        assertEquals(ActionTarget.step("adopt"), next.getTarget());
        assertEquals(ActionType.END, giveUp.getType());
    }
    
    @Test
    void testReferenceIntoAnotherSectionIsDangling() {
        DanglingReferenceException exception = assertThrows(DanglingReferenceException.class,
                () -> resolver.resolveSuccessAction(
                        reference("$components.failureActions.giveUp", ReusableKind.SUCCESS_ACTION, null), components));
        
        assertEquals("success action", exception.getExpectedKind());
        assertEquals(NodePath.root(), exception.getPath());
    }
    
    @Test
    void testUnknownComponentIsDangling() {
        assertThrows(DanglingReferenceException.class, () -> resolver.resolveParameter(
                reference("$components.parameters.apiKey", ReusableKind.PARAMETER, null), components));
        assertThrows(DanglingReferenceException.class, () -> resolver.resolveParameter(
                reference("$components.parameters.pageSize", ReusableKind.PARAMETER, null), null));
    }
    
    @Test
    void testActionReferenceWithoutComponentsIsDangling() {
        DanglingReferenceException success = assertThrows(DanglingReferenceException.class,
                () -> resolver.resolveSuccessAction(
                        reference("$components.successActions.next", ReusableKind.SUCCESS_ACTION, null), null));
        assertEquals(ReusableKind.SUCCESS_ACTION.getLabel(), success.getExpectedKind());
        DanglingReferenceException failure = assertThrows(DanglingReferenceException.class,
                () -> resolver.resolveFailureAction(
                        reference("$components.failureActions.giveUp", ReusableKind.FAILURE_ACTION, null), null));
        assertEquals("$components.failureActions.giveUp", failure.getReference());
    }
    
    @Test
    void testResolvesEveryReferenceInParsedDescription() throws Exception {
        DefaultArazzoParser parser = new DefaultArazzoParser(new ArazzoConfiguration(new Properties()));
        ArazzoDescription description = parser.parse(DocumentNodes.ofYaml(Fixtures.load(Fixtures.PET_ADOPTION_YAML)));
        Components parsed = description.getComponents();
        Step findPet = description.getWorkflow("adoptPet").getStep("findPet");
        
        Parameter pageSize = resolver.resolveParameter(findPet.getParameters().get(2), parsed);
        SuccessAction onSuccess = resolver.resolveSuccessAction(findPet.getOnSuccess().get(0), parsed);
        FailureAction onFailure = resolver.resolveFailureAction(
                description.getWorkflow("adoptPet").getStep("adopt").getOnFailure().get(0), parsed);
        Parameter apiKey = resolver.resolveParameter(description.getWorkflow("adoptPet").getParameters().get(0), parsed);
        
        assertEquals(Payload.scalar(IntNode.valueOf(5)), pageSize.getValue());
        assertEquals(ActionTarget.step("adopt"), onSuccess.getTarget());
        assertEquals("giveUp", onFailure.getName());
        assertEquals(ParameterLocation.HEADER, apiKey.getIn());
        assertEquals(Payload.expression("$inputs.apiKey"), apiKey.getValue());
    }
    
    @Test
    void testVerifyReportsFirstDanglingReference() throws Exception {
        BuildContext context = new BuildContext(new ArazzoConfiguration(new Properties()));
        NodePath first = NodePath.of("workflows", 0, "parameters", 0);
        context.recordReference(first, new ReusableObject("$components.parameters.missing", ReusableKind.PARAMETER));
        context.recordReference(NodePath.of("workflows", 0, "parameters", 1),
                new ReusableObject("$components.parameters.alsoMissing", ReusableKind.PARAMETER));
        ArazzoDescription description = new DefaultArazzoParser(new ArazzoConfiguration(new Properties()))
                .parseYaml(Fixtures.read(Fixtures.PETSTORE_YAML));
        
        DanglingReferenceException exception = assertThrows(DanglingReferenceException.class,
                () -> resolver.verify(description, context));
        
        assertEquals(first, exception.getPath());
        assertEquals("$components.parameters.missing", exception.getReference());
    }
}
