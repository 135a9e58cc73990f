package com.aquiferai.pipeline;

import java.util.List;

public final class PipelineConstants {

    private PipelineConstants() {
    }

    // Stage labels used in logs and stream events
    public static final String STAGE_PLAN = "plan";
    public static final String STAGE_GENERATE = "generate";
    public static final String STAGE_VALIDATE = "validate";
    public static final String STAGE_SYNTHESIZE = "synthesize";
    public static final String STAGE_FORMAT = "format";

    // Sub-task defaults
    public static final String SUB_TASK_PREFIX = "st";
    public static final String DEFAULT_QUERY_TYPE = "lookup";
    public static final int FALLBACK_ROW_LIMIT = 10;

    // Fallback texts
    public static final String FALLBACK_PLAN_RATIONALE = "Fallback plan due to error: ";
    public static final String FALLBACK_QUERY_EXPLANATION = "Default query used because query generation failed: ";
    public static final String NO_DATA_SUMMARY = "No data was retrieved successfully for this question.";
    public static final String EMPTY_RESULT_SUMMARY = "The queries ran successfully but no records matched this question.";
    public static final String NO_DATA_ACTION = "Rephrase the question or name a specific basin, country or aquifer.";
    public static final String NO_DATA_RATIONALE = "None of the generated queries returned records to analyze.";
    public static final List<String> NO_DATA_FOLLOW_UPS = List.of(
            "Which basins have aquifers with the highest porosity?",
            "List aquifers located in a specific country.",
            "What are the deepest aquifers in the dataset?"
    );
    public static final String DEGRADED_SUMMARY_FORMAT = "Retrieved %d records from %d successful queries.";
    public static final String DEGRADED_QUALITY_NOTE = "Detailed analysis was unavailable; showing raw results only.";
    public static final String RESULTS_DATA_KEY = "results";

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the planning stage of a question answering system over a graph of saline aquifers.
            Decompose the user's question into the smallest set of retrieval sub-tasks needed to answer it.

            Complexity levels:
            - SIMPLE: one lookup or filter, answered by exactly one sub-task.
            - COMPOUND: several independent lookups whose results are combined.
            - ANALYTICAL: comparisons, rankings or aggregations across result sets.

            Rules:
            - Use ANALYTICAL only when the question compares, ranks or aggregates.
            - Sub-task ids are "st1", "st2", ... in order.
            - dependsOn may only reference earlier sub-task ids.
            - requiredEntityKinds uses the entity kinds from the schema exactly as written.

            Return only JSON with this shape:
            {
              "complexity": "SIMPLE|COMPOUND|ANALYTICAL",
              "rationale": "one or two sentences",
              "subTasks": [
                {
                  "id": "st1",
                  "description": "what to retrieve",
                  "queryType": "lookup|filter|aggregation|comparison|spatial",
                  "requiredEntityKinds": ["Aquifer"],
                  "dependsOn": []
                }
              ]
            }
            """;

    public static final String PLANNER_USER_TEMPLATE = """
            Question:
            {question}

            Recent conversation:
            {history}

            Schema:
            {schema}
            """;

    public static final String QUERY_WRITER_SYSTEM_PROMPT = """
            You write Cypher queries for a Neo4j graph of saline aquifers.

            Rules:
            - Use only the entity kinds, relationship kinds and property keys listed in the schema.
            - Labels and relationship types are case-sensitive.
            - Always use an explicit RETURN clause with specific properties and include a.OBJECTID for aquifers.
            - OBJECTID is a string.
            - Use OPTIONAL MATCH for relationships that may be missing.
            - Do not compute values in the RETURN clause and do not use map projections.
            - Add a LIMIT unless the sub-task asks for an aggregate.
            - Do not use query parameters; inline literal values.

            Return only JSON with this shape:
            {
              "subTaskId": "st1",
              "queryText": "MATCH (a:Aquifer) RETURN a.OBJECTID, a.Porosity LIMIT 10",
              "explanation": "what the query retrieves",
              "expectedColumns": ["a.OBJECTID", "a.Porosity"]
            }
            """;

    public static final String QUERY_WRITER_USER_TEMPLATE = """
            Original question:
            {question}

            Sub-task {subTaskId}:
            {description}

            Query type: {queryType}
            Required entity kinds: {entityKinds}

            Results of prerequisite sub-tasks:
            {prerequisites}

            Schema:
            {schema}
            """;

    public static final String HEALER_SYSTEM_PROMPT = """
            You repair broken Cypher queries for a Neo4j graph of saline aquifers.

            Common problems:
            - Misspelled or wrongly cased labels, for example Aquifier instead of Aquifer.
            - Relationship types that are not in the schema.
            - Unbalanced parentheses, brackets or braces.
            - Missing MATCH or RETURN clauses.
            - Properties that do not exist.

            Return only the corrected Cypher query. No explanation, no markdown.
            Do not return any of the previously failed queries again.
            """;

    public static final String HEALER_USER_TEMPLATE = """
            Query:
            {query}

            Error category: {category}
            Error message:
            {error}

            Previously failed queries:
            {previousAttempts}

            Schema:
            {schema}
            """;

    public static final String SYNTHESIZER_SYSTEM_PROMPT = """
            You analyze query results about saline aquifers for CO2 storage screening and write a prescriptive report.

            Reference ranges:
            - Porosity above 0.18 is excellent, 0.12 to 0.18 is acceptable, below 0.12 is poor.
            - Permeability above 100 md is excellent, 50 to 100 md is acceptable, below 50 md makes injection difficult.
            - Depth between 800 m and 3000 m keeps CO2 supercritical.

            Rules:
            - Interpret numbers, do not only restate them.
            - Mention when data is partial or missing.
            - Recommendation priority runs from 1 (most urgent) to 5.
            - Visualization types: table, map, chart, stats.

            Return only JSON with this shape:
            {
              "summary": "two to four sentences",
              "insights": [{"title": "...", "description": "...", "importance": "high|medium|low"}],
              "recommendations": [{"action": "...", "rationale": "...", "priority": 1}],
              "followUpQuestions": ["..."],
              "visualizationHints": [{"type": "table", "dataKey": "results", "config": {}}],
              "dataQualityNotes": ["..."]
            }
            """;

    public static final String SYNTHESIZER_USER_TEMPLATE = """
            Question:
            {question}

            Plan ({complexity}):
            {plan}

            Results:
            {results}

            Failed sub-tasks:
            {failures}
            """;
}
