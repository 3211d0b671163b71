package com.covidanalytics.domain.model;

import com.covidanalytics.infrastructure.query.Column;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Cross-sectional feature table, one vector per entity, ordered by entity name.
 */
@Slf4j
@Value
public class FeatureTable {

    List<ClusterFeature> features;
    List<FeatureVector> vectors;

    public FeatureTable(List<ClusterFeature> features, List<FeatureVector> vectors) {
        TreeMap<String, FeatureVector> byEntity = new TreeMap<>();
        for (FeatureVector vector : vectors) {
            if (byEntity.putIfAbsent(vector.getEntity(), vector) != null) {
                log.warn("Duplicate feature vector for {} ignored", vector.getEntity());
            }
        }
        this.features = List.copyOf(features);
        this.vectors = List.copyOf(byEntity.values());
    }

    /**
     * Builds the table from one row per entity. Rows missing the entity or any
     * selected feature are dropped.
     */
    public static FeatureTable fromRows(ResultTable table, Column entityColumn, List<ClusterFeature> features) {
        List<FeatureVector> vectors = new ArrayList<>(table.size());
        int dropped = 0;
        rows:
        for (ResultRow row : table.getRows()) {
            Object entity = row.get(entityColumn);
            if (entity == null) {
                dropped++;
                continue;
            }
            Map<ClusterFeature, Double> values = new EnumMap<>(ClusterFeature.class);
            for (ClusterFeature feature : features) {
                OptionalDouble value = Scalars.toDouble(row.get(feature.getColumn()));
                if (value.isEmpty()) {
                    dropped++;
                    continue rows;
                }
                values.put(feature, value.getAsDouble());
            }
            vectors.add(new FeatureVector(entity.toString(), values));
        }
        if (dropped > 0) {
            log.warn("Dropped {} entities with incomplete features {}", dropped, features);
        }
        return new FeatureTable(features, vectors);
    }

    public int size() {
        return vectors.size();
    }
}
