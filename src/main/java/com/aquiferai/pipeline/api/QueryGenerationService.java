package com.aquiferai.pipeline.api;

import com.aquiferai.pipeline.model.CandidateQuery;
import com.aquiferai.pipeline.model.QueryPlan;
import com.aquiferai.pipeline.model.SubTask;
import com.aquiferai.pipeline.model.ValidationOutcome;

import java.util.List;

/**
 * Produces exactly one candidate query per sub-task.
 */
public interface QueryGenerationService {

    /**
     * @param subTask       the sub-task to cover
     * @param plan          the plan the sub-task belongs to
     * @param prerequisites outcomes of the sub-tasks named in {@link SubTask#dependsOn()}
     * @return a candidate query; the conservative default query when generation fails
     */
    CandidateQuery generate(SubTask subTask, QueryPlan plan, List<ValidationOutcome> prerequisites);

    CandidateQuery fallbackQuery(SubTask subTask, String reason);
}
