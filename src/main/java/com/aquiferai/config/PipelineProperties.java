package com.aquiferai.config;

import com.aquiferai.gateway.ModelRole;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private LlmBackend backend = LlmBackend.OLLAMA;
    private ModelsConfig models = new ModelsConfig();
    private SchemaConfig schema = new SchemaConfig();
    private int maxRetries = 3;
    private int maxSubTasks = 5;
    private Duration queryTimeout = Duration.ofSeconds(30);
    private Duration gatewayTimeout = Duration.ofSeconds(120);
    private Duration subTaskTimeout = Duration.ofMinutes(5);
    private int sampleRowsPerSubTask = 20;
    private int maxSynthesisRows = 100;
    private int workerConcurrency = 4;
    private int contextPairs = 3;
    private Duration sessionLockTimeout = Duration.ofSeconds(60);
    private Duration streamRetention = Duration.ofMinutes(30);

    public enum LlmBackend {
        OLLAMA, OPENAI, GOOGLE
    }

    public static class RoleModelConfig {
        private String model;
        private Double temperature;

        public RoleModelConfig() {
        }

        public RoleModelConfig(String model, Double temperature) {
            this.model = model;
            this.temperature = temperature;
        }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
    }

    public static class ModelsConfig {
        private RoleModelConfig planner = new RoleModelConfig("llama3.2:3b", 0.1);
        private RoleModelConfig queryWriter = new RoleModelConfig("qwen2.5-coder:7b", 0.0);
        private RoleModelConfig healer = new RoleModelConfig("llama3.2:3b", 0.0);
        private RoleModelConfig synthesizer = new RoleModelConfig("llama3:8b", 0.3);

        public RoleModelConfig getPlanner() { return planner; }
        public void setPlanner(RoleModelConfig planner) { this.planner = planner; }
        public RoleModelConfig getQueryWriter() { return queryWriter; }
        public void setQueryWriter(RoleModelConfig queryWriter) { this.queryWriter = queryWriter; }
        public RoleModelConfig getHealer() { return healer; }
        public void setHealer(RoleModelConfig healer) { this.healer = healer; }
        public RoleModelConfig getSynthesizer() { return synthesizer; }
        public void setSynthesizer(RoleModelConfig synthesizer) { this.synthesizer = synthesizer; }

        public RoleModelConfig forRole(ModelRole role) {
            RoleModelConfig config = switch (role) {
                case PLANNER -> planner;
                case QUERY_WRITER -> queryWriter;
                case HEALER -> healer;
                case SYNTHESIZER -> synthesizer;
            };
            return config != null ? config : new RoleModelConfig();
        }
    }

    public static class SchemaConfig {
        private List<String> entityKinds = new ArrayList<>(
                List.of("Aquifer", "Basin", "Country", "Continent", "Cluster", "RiskAssessment"));
        private List<String> relationshipKinds = new ArrayList<>(
                List.of("LOCATED_IN_BASIN", "PART_OF", "IS_LOCATED_IN_COUNTRY", "LOCATED_IN_CONTINENT",
                        "LOCATED_IN", "WITHIN", "HAS_RISK"));
        private List<String> propertyKeys = new ArrayList<>(
                List.of("OBJECTID", "AquiferHydrogeologicClassification", "Basin", "Boundary_coordinates",
                        "Cluster", "Continent", "Country", "Depth", "Lake_area", "Location", "Parameter_area",
                        "Parameter_shape", "Permeability", "Porosity", "Recharge", "Thickness", "name",
                        "risk_level", "seismic_risk", "regulatory_score"));
        private String defaultEntityKind = "Aquifer";

        public List<String> getEntityKinds() { return entityKinds; }
        public void setEntityKinds(List<String> entityKinds) { this.entityKinds = entityKinds; }
        public List<String> getRelationshipKinds() { return relationshipKinds; }
        public void setRelationshipKinds(List<String> relationshipKinds) { this.relationshipKinds = relationshipKinds; }
        public List<String> getPropertyKeys() { return propertyKeys; }
        public void setPropertyKeys(List<String> propertyKeys) { this.propertyKeys = propertyKeys; }
        public String getDefaultEntityKind() { return defaultEntityKind; }
        public void setDefaultEntityKind(String defaultEntityKind) { this.defaultEntityKind = defaultEntityKind; }
    }

    public LlmBackend getBackend() {
        return backend;
    }

    public void setBackend(LlmBackend backend) {
        this.backend = backend;
    }

    public ModelsConfig getModels() {
        return models;
    }

    public void setModels(ModelsConfig models) {
        this.models = models != null ? models : new ModelsConfig();
    }

    public SchemaConfig getSchema() {
        return schema;
    }

    public void setSchema(SchemaConfig schema) {
        this.schema = schema != null ? schema : new SchemaConfig();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public int getMaxSubTasks() {
        return maxSubTasks;
    }

    public void setMaxSubTasks(int maxSubTasks) {
        this.maxSubTasks = Math.max(1, maxSubTasks);
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public Duration getGatewayTimeout() {
        return gatewayTimeout;
    }

    public void setGatewayTimeout(Duration gatewayTimeout) {
        this.gatewayTimeout = gatewayTimeout;
    }

    public Duration getSubTaskTimeout() {
        return subTaskTimeout;
    }

    public void setSubTaskTimeout(Duration subTaskTimeout) {
        this.subTaskTimeout = subTaskTimeout;
    }

    public int getSampleRowsPerSubTask() {
        return sampleRowsPerSubTask;
    }

    public void setSampleRowsPerSubTask(int sampleRowsPerSubTask) {
        this.sampleRowsPerSubTask = sampleRowsPerSubTask;
    }

    public int getMaxSynthesisRows() {
        return maxSynthesisRows;
    }

    public void setMaxSynthesisRows(int maxSynthesisRows) {
        this.maxSynthesisRows = maxSynthesisRows;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public int getContextPairs() {
        return contextPairs;
    }

    public void setContextPairs(int contextPairs) {
        this.contextPairs = contextPairs;
    }

    public Duration getSessionLockTimeout() {
        return sessionLockTimeout;
    }

    public void setSessionLockTimeout(Duration sessionLockTimeout) {
        this.sessionLockTimeout = sessionLockTimeout;
    }

    public Duration getStreamRetention() {
        return streamRetention;
    }

    public void setStreamRetention(Duration streamRetention) {
        this.streamRetention = streamRetention;
    }
}
