package com.aquiferai.pipeline.service;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.gateway.ModelRole;
import com.aquiferai.pipeline.PipelineConstants;
import com.aquiferai.pipeline.model.ConversationTurn;
import com.aquiferai.pipeline.model.QueryComplexity;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.support.InMemoryGraphStore;
import com.aquiferai.support.ScriptedModelGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanningServiceImplTest {

    private ScriptedModelGateway modelGateway;
    private PipelineProperties properties;
    private PlanningServiceImpl planningService;

    @BeforeEach
    void setUp() {
        modelGateway = new ScriptedModelGateway();
        properties = new PipelineProperties();
        planningService = new PlanningServiceImpl(modelGateway, new InMemoryGraphStore(),
                new PipelineContextService(new JsonProcessingService(new ObjectMapper())), properties,
                new PipelineMetricsService());
    }

    @Test
    void testCompoundPlan() {
        modelGateway.respond(ModelRole.PLANNER, """
                {"complexity": "COMPOUND", "rationale": "two lookups",
                 "subTasks": [
                   {"id": "st1", "description": "Aquifers in Norway", "queryType": "filter", "requiredEntityKinds": ["Aquifer", "Country"]},
                   {"id": "st2", "description": "Aquifers in Denmark", "queryType": "filter", "requiredEntityKinds": ["Aquifer", "Country"]}
                 ]}
                """);

        QueryPlan plan = planningService.plan("Which aquifers are in Norway and which in Denmark?", List.of());

        assertEquals(QueryComplexity.COMPOUND, plan.complexity());
        assertEquals(2, plan.subTasks().size());
        assertEquals("st2", plan.subTasks().get(1).id());
        assertEquals("Which aquifers are in Norway and which in Denmark?", plan.originalQuestion());
        assertTrue(plan.subTasks().stream().allMatch(SubTask::isIndependent));
    }

    @Test
    void testGatewayFailureGivesFallbackPlan() {
        modelGateway.fail(ModelRole.PLANNER);

        QueryPlan plan = planningService.plan("What is the porosity of aquifer 12?", List.of());

        assertEquals(QueryComplexity.SIMPLE, plan.complexity());
        assertEquals(1, plan.subTasks().size());
        assertEquals("What is the porosity of aquifer 12?", plan.subTasks().get(0).description());
        assertEquals(List.of("Aquifer"), plan.subTasks().get(0).requiredEntityKinds());
        assertTrue(plan.rationale().startsWith(PipelineConstants.FALLBACK_PLAN_RATIONALE));
    }

    @Test
    void testUnparseableResponseGivesFallbackPlan() {
        modelGateway.respond(ModelRole.PLANNER, "I think you should look at the aquifers.");

        QueryPlan plan = planningService.plan("List basins", List.of());

        assertEquals(1, plan.subTasks().size());
        assertTrue(plan.rationale().startsWith(PipelineConstants.FALLBACK_PLAN_RATIONALE));
    }

    @Test
    void testEmptySubTasksGiveFallbackPlan() {
        modelGateway.respond(ModelRole.PLANNER, "{\"complexity\": \"SIMPLE\", \"subTasks\": []}");

        QueryPlan plan = planningService.plan("List basins", List.of());

        assertEquals("List basins", plan.subTasks().get(0).description());
        assertTrue(plan.rationale().startsWith(PipelineConstants.FALLBACK_PLAN_RATIONALE));
    }

    @Test
    void testAnalyticalWithoutComparisonIsDowngraded() {
        modelGateway.respond(ModelRole.PLANNER, """
                {"complexity": "ANALYTICAL", "subTasks": [{"description": "Aquifers in the Congo basin"}]}
                """);

        QueryPlan plan = planningService.plan("Show aquifers in the Congo basin", List.of());

        assertEquals(QueryComplexity.SIMPLE, plan.complexity());
        assertEquals("st1", plan.subTasks().get(0).id());
        assertEquals(PipelineConstants.DEFAULT_QUERY_TYPE, plan.subTasks().get(0).queryType());
    }

    @Test
    void testAnalyticalIsKeptForComparisons() {
        modelGateway.respond(ModelRole.PLANNER, """
                {"complexity": "ANALYTICAL", "subTasks": [
                  {"id": "st1", "description": "Porosity of aquifers in Norway"},
                  {"id": "st2", "description": "Porosity of aquifers in Denmark"},
                  {"id": "st3", "description": "Compare averages", "dependsOn": ["st1", "st2"]}
                ]}
                """);

        QueryPlan plan = planningService.plan("Compare the average porosity of Norway and Denmark", List.of());

        assertEquals(QueryComplexity.ANALYTICAL, plan.complexity());
        assertEquals(List.of("st1", "st2"), plan.subTasks().get(2).dependsOn());
    }

    @Test
    void testForwardDependenciesAreDropped() {
        modelGateway.respond(ModelRole.PLANNER, """
                {"complexity": "COMPOUND", "subTasks": [
                  {"id": "st1", "description": "Basins", "dependsOn": ["st2"]},
                  {"id": "st2", "description": "Countries", "dependsOn": ["st1", "st9"]}
                ]}
                """);

        QueryPlan plan = planningService.plan("Basins and countries", List.of());

        assertTrue(plan.subTasks().get(0).dependsOn().isEmpty());
        assertEquals(List.of("st1"), plan.subTasks().get(1).dependsOn());
    }

    @Test
    void testPlanIsTruncatedToMaxSubTasks() {
        properties.setMaxSubTasks(2);
        modelGateway.respond(ModelRole.PLANNER, """
                {"complexity": "COMPOUND", "subTasks": [
                  {"description": "one"}, {"description": "two"}, {"description": "three"}
                ]}
                """);

        QueryPlan plan = planningService.plan("Three things", List.of());

        assertEquals(2, plan.subTasks().size());
        assertEquals(List.of("st1", "st2"), plan.subTasks().stream().map(SubTask::id).toList());
    }

    @Test
    void testOnlyRecentTurnsReachThePlanner() {
        modelGateway.respond(ModelRole.PLANNER, "{\"subTasks\": [{\"description\": \"Deep aquifers\"}]}");
        List<ConversationTurn> history = List.of(
                new ConversationTurn("first question", "first answer"),
                new ConversationTurn("second question", "second answer"),
                new ConversationTurn("third question", "third answer"),
                new ConversationTurn("fourth question", "fourth answer"));

        planningService.plan("And the deepest?", history);

        String rendered = String.valueOf(modelGateway.calls(ModelRole.PLANNER).get(0).params().get("history"));
        assertFalse(rendered.contains("first question"));
        assertTrue(rendered.contains("second question"));
        assertTrue(rendered.contains("fourth answer"));
    }

    @Test
    void testAnalyticalLanguage() {
        assertTrue(PlanningServiceImpl.hasAnalyticalLanguage("Rank the basins by porosity"));
        assertTrue(PlanningServiceImpl.hasAnalyticalLanguage("How many aquifers are in Brazil?"));
        assertFalse(PlanningServiceImpl.hasAnalyticalLanguage("Show aquifer 42"));
        assertEquals(QueryComplexity.COMPOUND,
                PlanningServiceImpl.resolveComplexity("Show aquifers", null, 2));
    }
}
