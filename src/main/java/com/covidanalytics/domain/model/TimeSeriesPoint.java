package com.covidanalytics.domain.model;

import lombok.Value;

import java.time.LocalDate;

@Value
public class TimeSeriesPoint {
    LocalDate period;
    double value;
}
