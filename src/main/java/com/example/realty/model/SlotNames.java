package com.example.realty.model;

import java.util.List;

public final class SlotNames {

    public static final String GOAL = "goal";
    public static final String BUDGET_MIN = "budget_min";
    public static final String BUDGET_MAX = "budget_max";
    public static final String PROPERTY_TYPE = "property_type";
    public static final String LOCATION = "location";

    public static final List<String> ALL = List.of(GOAL, BUDGET_MIN, BUDGET_MAX, PROPERTY_TYPE, LOCATION);

    private SlotNames() {}

    public static boolean isKnown(String name) {
        return name != null && ALL.contains(name);
    }
}
