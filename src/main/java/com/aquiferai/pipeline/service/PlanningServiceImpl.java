package com.aquiferai.pipeline.service;

import static com.aquiferai.pipeline.PipelineConstants.*;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.gateway.GatewayException;
import com.aquiferai.gateway.ModelGateway;
import com.aquiferai.gateway.ModelRole;
import com.aquiferai.graph.GraphStore;
import com.aquiferai.pipeline.api.PlanningService;
import com.aquiferai.pipeline.model.ConversationTurn;
import com.aquiferai.pipeline.model.QueryComplexity;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanningServiceImpl implements PlanningService {

    private static final Pattern ANALYTICAL_LANGUAGE = Pattern.compile(
            "\\b(compare|compared|comparison|versus|vs\\.?|rank|ranking|ranked|top|best|worst|highest|lowest"
                    + "|most|least|average|avg|mean|median|sum|total|count|how many|max|maximum|min|minimum"
                    + "|distribution|correlat\\w*|aggregate\\w*|trend\\w*|better|worse|more than|less than)\\b",
            Pattern.CASE_INSENSITIVE);

    private final ModelGateway modelGateway;
    private final GraphStore graphStore;
    private final PipelineContextService contextService;
    private final PipelineProperties properties;
    private final PipelineMetricsService metricsService;

    @Override
    public QueryPlan plan(String question, List<ConversationTurn> history) {
        List<ConversationTurn> window = lastTurns(history, properties.getContextPairs());
        QueryPlan draft;
        try {
            draft = modelGateway.generateStructured(ModelRole.PLANNER, PLANNER_SYSTEM_PROMPT, PLANNER_USER_TEMPLATE,
                    Map.of("question", question,
                            "history", contextService.describeHistory(window),
                            "schema", graphStore.schemaVocabulary().describe()),
                    QueryPlan.class);
        } catch (GatewayException ex) {
            log.warn("Planning degraded, using fallback plan: {}", ex.getMessage());
            QueryPlan fallback = fallbackPlan(question, ex.getMessage());
            metricsService.recordPlan(fallback, true);
            return fallback;
        }
        QueryPlan plan = normalize(question, draft);
        if (plan == null) {
            log.warn("Planner returned no usable sub-tasks, using fallback plan.");
            QueryPlan fallback = fallbackPlan(question, "planner returned no sub-tasks");
            metricsService.recordPlan(fallback, true);
            return fallback;
        }
        metricsService.recordPlan(plan, false);
        return plan;
    }

    @Override
    public QueryPlan fallbackPlan(String question, String reason) {
        SubTask subTask = new SubTask(SUB_TASK_PREFIX + 1, question, DEFAULT_QUERY_TYPE,
                List.of(properties.getSchema().getDefaultEntityKind()), List.of());
        return new QueryPlan(question, QueryComplexity.SIMPLE, List.of(subTask), FALLBACK_PLAN_RATIONALE + reason);
    }

    /**
     * Validates the planner output at the stage boundary: assigns missing ids, drops sub-tasks beyond
     * the configured maximum, keeps only dependencies on earlier sub-tasks, and fills in complexity.
     *
     * @return null when no sub-task with a description remains
     */
    QueryPlan normalize(String question, QueryPlan draft) {
        if (draft == null || draft.subTasks().isEmpty()) {
            return null;
        }
        List<SubTask> subTasks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SubTask raw : draft.subTasks()) {
            if (raw == null || !StringUtils.hasText(raw.description())) {
                continue;
            }
            if (subTasks.size() >= properties.getMaxSubTasks()) {
                log.info("Plan truncated to {} sub-tasks.", properties.getMaxSubTasks());
                break;
            }
            String id = StringUtils.hasText(raw.id()) && !seen.contains(raw.id().trim())
                    ? raw.id().trim()
                    : SUB_TASK_PREFIX + (subTasks.size() + 1);
            List<String> dependsOn = raw.dependsOn().stream()
                    .filter(seen::contains)
                    .distinct()
                    .toList();
            String queryType = StringUtils.hasText(raw.queryType()) ? raw.queryType() : DEFAULT_QUERY_TYPE;
            subTasks.add(new SubTask(id, raw.description(), queryType, raw.requiredEntityKinds(), dependsOn));
            seen.add(id);
        }
        if (subTasks.isEmpty()) {
            return null;
        }
        QueryComplexity complexity = resolveComplexity(question, draft.complexity(), subTasks.size());
        String rationale = draft.rationale() != null ? draft.rationale() : "";
        return new QueryPlan(question, complexity, subTasks, rationale);
    }

    static QueryComplexity resolveComplexity(String question, QueryComplexity proposed, int subTaskCount) {
        QueryComplexity structural = subTaskCount > 1 ? QueryComplexity.COMPOUND : QueryComplexity.SIMPLE;
        if (proposed == null) {
            return structural;
        }
        if (proposed == QueryComplexity.ANALYTICAL && !hasAnalyticalLanguage(question)) {
            return structural;
        }
        return proposed;
    }

    static boolean hasAnalyticalLanguage(String question) {
        return question != null && ANALYTICAL_LANGUAGE.matcher(question).find();
    }

    private static List<ConversationTurn> lastTurns(List<ConversationTurn> history, int pairs) {
        if (history == null || history.isEmpty() || pairs <= 0) {
            return List.of();
        }
        return history.subList(Math.max(0, history.size() - pairs), history.size());
    }
}
