package com.covidanalytics.domain.model;

import lombok.Value;

@Value
public class ClusterAssignment {
    String entity;
    int cluster;
}
