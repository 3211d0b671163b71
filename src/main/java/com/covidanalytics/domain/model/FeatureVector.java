package com.covidanalytics.domain.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Value
public class FeatureVector {

    String entity;
    Map<ClusterFeature, Double> values;

    public FeatureVector(String entity, Map<ClusterFeature, Double> values) {
        this.entity = entity;
        this.values = Collections.unmodifiableMap(values.isEmpty()
                ? new EnumMap<>(ClusterFeature.class)
                : new EnumMap<>(values));
    }

    public double get(ClusterFeature feature) {
        Double value = values.get(feature);
        if (value == null) {
            throw new IllegalArgumentException("No value for " + feature + " on " + entity);
        }
        return value;
    }
}
