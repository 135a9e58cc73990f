package com.aquiferai.pipeline.service;

import static com.aquiferai.pipeline.PipelineConstants.*;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.gateway.GatewayException;
import com.aquiferai.gateway.ModelGateway;
import com.aquiferai.gateway.ModelRole;
import com.aquiferai.graph.GraphStore;
import com.aquiferai.graph.SchemaVocabulary;
import com.aquiferai.pipeline.api.QueryGenerationService;
import com.aquiferai.pipeline.model.CandidateQuery;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class QueryGenerationServiceImpl implements QueryGenerationService {

    private final ModelGateway modelGateway;
    private final GraphStore graphStore;
    private final PipelineContextService contextService;
    private final PipelineProperties properties;

    @Override
    public CandidateQuery generate(SubTask subTask, QueryPlan plan, List<ValidationOutcome> prerequisites) {
        SchemaVocabulary vocabulary = graphStore.schemaVocabulary();
        CandidateQuery draft;
        try {
            draft = modelGateway.generateStructured(ModelRole.QUERY_WRITER, QUERY_WRITER_SYSTEM_PROMPT,
                    QUERY_WRITER_USER_TEMPLATE, Map.of(
                            "question", plan.originalQuestion(),
                            "subTaskId", subTask.id(),
                            "description", subTask.description(),
                            "queryType", subTask.queryType() != null ? subTask.queryType() : DEFAULT_QUERY_TYPE,
                            "entityKinds", subTask.requiredEntityKinds().isEmpty()
                                    ? "any" : String.join(", ", subTask.requiredEntityKinds()),
                            "prerequisites", contextService.describePrerequisites(prerequisites),
                            "schema", vocabulary.describe()),
                    CandidateQuery.class);
        } catch (GatewayException ex) {
            log.warn("Query generation degraded for sub-task {}: {}", subTask.id(), ex.getMessage());
            return fallbackQuery(subTask, ex.getMessage());
        }
        String queryText = CypherText.stripCodeFences(draft.queryText());
        if (!StringUtils.hasText(queryText)) {
            log.warn("Query writer returned no query for sub-task {}.", subTask.id());
            return fallbackQuery(subTask, "query writer returned no query");
        }
        String explanation = draft.explanation() != null ? draft.explanation() : "";
        return new CandidateQuery(subTask.id(), queryText, explanation, draft.expectedColumns());
    }

    /**
     * Conservative query scoped to the first required entity kind the schema knows, capped at a small row limit.
     */
    @Override
    public CandidateQuery fallbackQuery(SubTask subTask, String reason) {
        SchemaVocabulary vocabulary = graphStore.schemaVocabulary();
        String kind = subTask.requiredEntityKinds().stream()
                .filter(vocabulary::knowsEntityKind)
                .findFirst()
                .orElse(properties.getSchema().getDefaultEntityKind());
        String query = "MATCH (n:" + kind + ") RETURN n LIMIT " + FALLBACK_ROW_LIMIT;
        return new CandidateQuery(subTask.id(), query, FALLBACK_QUERY_EXPLANATION + reason, List.of("n"));
    }
}
