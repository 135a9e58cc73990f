package com.aquiferai.pipeline.model;

public enum ValidationStatus {
    VALID,
    SYNTAX_ERROR,
    SCHEMA_ERROR,
    EXECUTION_ERROR
}
