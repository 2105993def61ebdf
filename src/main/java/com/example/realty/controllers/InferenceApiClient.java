package com.example.realty.controllers;

import com.example.realty.model.Language;

import java.util.Map;
import java.util.Optional;

public interface InferenceApiClient {

    /** Raw JSON object of slot name to value, as returned by the extraction service. Empty on any failure. */
    Optional<String> extractEntities(String text, Language language);

    /** Free-form answer to a customer question. Empty on any failure. */
    Optional<String> answer(Long tenantId, String question, Language language, Map<String, String> slots);
}
