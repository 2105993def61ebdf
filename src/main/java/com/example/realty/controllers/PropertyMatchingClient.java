package com.example.realty.controllers;

import com.example.realty.dto.PropertySummary;

import java.util.List;
import java.util.Map;

public interface PropertyMatchingClient {

    /** Properties of the tenant that fit the given slots; empty list when nothing matches or the call fails. */
    List<PropertySummary> match(Long tenantId, Map<String, String> slots);
}
