package com.aquiferai.graph;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Query execution against the aquifer graph.
 */
public interface GraphStore {

    /**
     * Runs a query and returns its rows as column to value maps.
     *
     * @throws GraphStoreException when the store rejects the query, fails, or exceeds {@code timeout}
     */
    List<Map<String, Object>> execute(String queryText, Duration timeout);

    SchemaVocabulary schemaVocabulary();

    boolean isAvailable();
}
