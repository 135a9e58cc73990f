package com.aquiferai.graph;

import com.aquiferai.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Entity;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Point;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private final Driver neo4jDriver;
    private final PipelineProperties properties;

    @Override
    public List<Map<String, Object>> execute(String queryText, Duration timeout) {
        TransactionConfig config = TransactionConfig.builder().withTimeout(timeout).build();
        try (Session session = neo4jDriver.session()) {
            Result result = session.run(queryText, config);
            List<Map<String, Object>> rows = new ArrayList<>();
            while (result.hasNext()) {
                rows.add(toRow(result.next()));
            }
            return rows;
        } catch (Neo4jException ex) {
            String code = ex.code() != null ? ex.code() : "unknown";
            log.debug("Graph query failed (code={}): {}", code, ex.getMessage());
            throw new GraphStoreException(code + ": " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new GraphStoreException("Graph query failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public SchemaVocabulary schemaVocabulary() {
        PipelineProperties.SchemaConfig schema = properties.getSchema();
        return new SchemaVocabulary(schema.getEntityKinds(), schema.getRelationshipKinds(), schema.getPropertyKeys());
    }

    @Override
    public boolean isAvailable() {
        try {
            neo4jDriver.verifyConnectivity();
            return true;
        } catch (RuntimeException ex) {
            log.warn("Graph store connectivity check failed: {}", ex.getMessage());
            return false;
        }
    }

    private Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : record.keys()) {
            Value value = record.get(key);
            row.put(key, value.isNull() ? null : toPlain(value.asObject()));
        }
        return row;
    }

    /**
     * Converts driver values into JSON-friendly structures. Nodes and relationships become their
     * property maps and points become GeoJSON-like maps.
     */
    static Object toPlain(Object value) {
        if (value instanceof Entity entity) {
            Map<String, Object> properties = new LinkedHashMap<>();
            entity.asMap().forEach((key, nested) -> properties.put(key, toPlain(nested)));
            return properties;
        }
        if (value instanceof Point point) {
            List<Double> coordinates = Double.isNaN(point.z())
                    ? List.of(point.x(), point.y())
                    : List.of(point.x(), point.y(), point.z());
            Map<String, Object> geo = new LinkedHashMap<>();
            geo.put("type", "Point");
            geo.put("coordinates", coordinates);
            geo.put("srid", point.srid());
            return geo;
        }
        if (value instanceof Path path) {
            List<Object> nodes = new ArrayList<>();
            path.nodes().forEach(node -> nodes.add(toPlain(node)));
            return nodes;
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(item -> converted.add(toPlain(item)));
            return converted;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((key, nested) -> converted.put(String.valueOf(key), toPlain(nested)));
            return converted;
        }
        return value;
    }
}
