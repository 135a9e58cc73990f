package com.aquiferai.pipeline.model;

public enum QueryComplexity {
    SIMPLE,
    COMPOUND,
    ANALYTICAL
}
