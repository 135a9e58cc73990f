package com.aquiferai.pipeline.api;

import com.aquiferai.pipeline.model.ConversationTurn;
import com.aquiferai.pipeline.model.QueryPlan;

import java.util.List;

/**
 * Turns a question into a structured plan.
 */
public interface PlanningService {

    /**
     * Plans a question. Never fails: when the planner cannot produce a usable plan a single
     * sub-task plan built from the raw question is returned.
     *
     * @param question the user question
     * @param history  recent turns of the session, oldest first
     * @return a plan with at least one sub-task
     */
    QueryPlan plan(String question, List<ConversationTurn> history);

    /**
     * Builds the single sub-task plan used when planning fails.
     */
    QueryPlan fallbackPlan(String question, String reason);
}
