package com.aquiferai.support;

import com.aquiferai.config.PipelineProperties;
import com.aquiferai.graph.GraphStore;
import com.aquiferai.graph.GraphStoreException;
import com.aquiferai.graph.SchemaVocabulary;
import com.aquiferai.pipeline.service.CypherText;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Graph store answering from canned rows keyed by whitespace-normalized query text.
 * Unknown queries return no rows.
 */
public class InMemoryGraphStore implements GraphStore {

    private final SchemaVocabulary vocabulary;
    private final Map<String, List<Map<String, Object>>> results = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final List<String> executed = Collections.synchronizedList(new ArrayList<>());
    private volatile Consumer<String> onExecute = query -> { };
    private volatile boolean available = true;

    public InMemoryGraphStore() {
        PipelineProperties.SchemaConfig schema = new PipelineProperties().getSchema();
        this.vocabulary = new SchemaVocabulary(schema.getEntityKinds(), schema.getRelationshipKinds(),
                schema.getPropertyKeys());
    }

    public InMemoryGraphStore returning(String query, List<Map<String, Object>> rows) {
        results.put(CypherText.normalize(query), rows);
        return this;
    }

    public InMemoryGraphStore failing(String query, String message) {
        failures.put(CypherText.normalize(query), message);
        return this;
    }

    public InMemoryGraphStore onExecute(Consumer<String> hook) {
        this.onExecute = hook;
        return this;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public List<String> executedQueries() {
        synchronized (executed) {
            return List.copyOf(executed);
        }
    }

    @Override
    public List<Map<String, Object>> execute(String queryText, Duration timeout) {
        String key = CypherText.normalize(queryText);
        executed.add(key);
        onExecute.accept(key);
        String failure = failures.get(key);
        if (failure != null) {
            throw new GraphStoreException(failure);
        }
        return results.getOrDefault(key, List.of());
    }

    @Override
    public SchemaVocabulary schemaVocabulary() {
        return vocabulary;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public static List<Map<String, Object>> aquiferRows(int count) {
        List<Map<String, Object>> rows = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            rows.add(Map.of("a.OBJECTID", String.valueOf(i), "a.Porosity", 0.1 + i / 100.0));
        }
        return rows;
    }
}
