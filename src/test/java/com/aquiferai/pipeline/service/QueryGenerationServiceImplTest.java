package com.aquiferai.pipeline.service;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.gateway.ModelRole;
import com.aquiferai.pipeline.PipelineConstants;
import com.aquiferai.pipeline.model.CandidateQuery;
import com.aquiferai.pipeline.model.QueryComplexity;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;
import com.aquiferai.support.InMemoryGraphStore;
import com.aquiferai.support.ScriptedModelGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryGenerationServiceImplTest {

    private ScriptedModelGateway modelGateway;
    private QueryGenerationServiceImpl generationService;

    private final SubTask basinTask = new SubTask("st1", "Aquifers in the Congo basin", "filter",
            List.of("Basin", "Aquifer"), List.of());
    private final QueryPlan plan = new QueryPlan("Which aquifers are in the Congo basin?", QueryComplexity.SIMPLE,
            List.of(basinTask), "");

    @BeforeEach
    void setUp() {
        modelGateway = new ScriptedModelGateway();
        generationService = new QueryGenerationServiceImpl(modelGateway, new InMemoryGraphStore(),
                new PipelineContextService(new JsonProcessingService(new ObjectMapper())), new PipelineProperties());
    }

    @Test
    void testGeneratesCandidateForSubTask() {
        modelGateway.respond(ModelRole.QUERY_WRITER, """
                {"subTaskId": "st1",
                 "queryText": "MATCH (a:Aquifer)-[:LOCATED_IN_BASIN]->(b:Basin) WHERE b.name = 'Congo' RETURN a.OBJECTID LIMIT 20",
                 "explanation": "Aquifers linked to the Congo basin",
                 "expectedColumns": ["a.OBJECTID"]}
                """);

        CandidateQuery candidate = generationService.generate(basinTask, plan, List.of());

        assertEquals("st1", candidate.subTaskId());
        assertTrue(candidate.queryText().startsWith("MATCH (a:Aquifer)"));
        assertEquals(List.of("a.OBJECTID"), candidate.expectedColumns());

        Map<String, Object> params = modelGateway.calls(ModelRole.QUERY_WRITER).get(0).params();
        assertEquals("Basin, Aquifer", params.get("entityKinds"));
        assertEquals("None.", params.get("prerequisites"));
    }

    @Test
    void testSubTaskIdComesFromTheSubTask() {
        modelGateway.respond(ModelRole.QUERY_WRITER,
                "{\"subTaskId\": \"st7\", \"queryText\": \"MATCH (b:Basin) RETURN b.name LIMIT 5\"}");

        CandidateQuery candidate = generationService.generate(basinTask, plan, List.of());

        assertEquals("st1", candidate.subTaskId());
        assertEquals("", candidate.explanation());
    }

    @Test
    void testFencedQueryTextIsUnwrapped() {
        modelGateway.respond(ModelRole.QUERY_WRITER,
                "{\"queryText\": \"```cypher\\nMATCH (b:Basin) RETURN b.name LIMIT 5\\n```\"}");

        CandidateQuery candidate = generationService.generate(basinTask, plan, List.of());

        assertEquals("MATCH (b:Basin) RETURN b.name LIMIT 5", candidate.queryText());
    }

    @Test
    void testPrerequisiteRowsAreShared() {
        modelGateway.respond(ModelRole.QUERY_WRITER, "{\"queryText\": \"MATCH (b:Basin) RETURN b.name LIMIT 5\"}");
        ValidationOutcome prerequisite = ValidationOutcome.valid("st0", "q", "q",
                List.of(Map.of("b.name", "Congo")), 4, 0);

        generationService.generate(basinTask, plan, List.of(prerequisite));

        String rendered = String.valueOf(modelGateway.calls(ModelRole.QUERY_WRITER).get(0).params().get("prerequisites"));
        assertTrue(rendered.contains("st0"));
        assertTrue(rendered.contains("Congo"));
    }

    @Test
    void testGatewayFailureGivesFallbackQuery() {
        modelGateway.fail(ModelRole.QUERY_WRITER);

        CandidateQuery candidate = generationService.generate(basinTask, plan, List.of());

        assertEquals("MATCH (n:Basin) RETURN n LIMIT 10", candidate.queryText());
        assertEquals(List.of("n"), candidate.expectedColumns());
        assertTrue(candidate.explanation().startsWith(PipelineConstants.FALLBACK_QUERY_EXPLANATION));
    }

    @Test
    void testBlankQueryGivesFallbackQuery() {
        modelGateway.respond(ModelRole.QUERY_WRITER, "{\"queryText\": \"  \", \"explanation\": \"nothing\"}");

        CandidateQuery candidate = generationService.generate(basinTask, plan, List.of());

        assertEquals("MATCH (n:Basin) RETURN n LIMIT 10", candidate.queryText());
    }

    @Test
    void testFallbackUsesDefaultKindForUnknownKinds() {
        SubTask vague = new SubTask("st2", "Something about wells", null, List.of("Well"), List.of());

        CandidateQuery candidate = generationService.fallbackQuery(vague, "test");

        assertEquals("MATCH (n:Aquifer) RETURN n LIMIT 10", candidate.queryText());
        assertEquals("st2", candidate.subTaskId());
    }
}
