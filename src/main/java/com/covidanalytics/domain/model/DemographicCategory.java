package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.InvalidFilterException;

public enum DemographicCategory {
    RACE_ETHNICITY("Race Ethnicity"),
    AGE_GROUP("Age Group"),
    GENDER("Gender");

    private final String label;

    DemographicCategory(String label) {
        this.label = label;
    }

    /** Value stored in the warehouse's DEMOGRAPHIC_CATEGORY column. */
    public String getLabel() {
        return label;
    }

    public static DemographicCategory fromName(String name) {
        if (name != null) {
            String normalized = name.trim().replace('_', ' ');
            for (DemographicCategory category : values()) {
                if (category.label.equalsIgnoreCase(normalized)) {
                    return category;
                }
            }
        }
        throw new InvalidFilterException("Invalid demographic category '" + name
                + "'. Choose from [Race Ethnicity, Age Group, Gender]");
    }
}
