package com.example.realty.model;

public enum LeadTemperature {
    BURNING,
    HOT,
    WARM,
    COLD
}
