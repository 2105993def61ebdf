package com.example.realty.controllers.impl;

import com.example.realty.config.BotConfig;
import com.example.realty.controllers.InferenceApiClient;
import com.example.realty.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class InferenceApiClientImpl implements InferenceApiClient {

    private final RestTemplate restTemplate;
    private final BotConfig config;

    @Override
    public Optional<String> extractEntities(String text, Language language) {
        try {
            String url = config.getInferenceUrl() + "/extract";
            var body = new ExtractRequest(text, language.code());
            ResponseEntity<String> response = restTemplate.postForEntity(url, jsonEntity(body), String.class);
            String raw = response.getBody();
            return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(raw);
        } catch (Exception e) {
            log.warn("Entity extraction failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> answer(Long tenantId, String question, Language language, Map<String, String> slots) {
        try {
            String url = config.getInferenceUrl() + "/answer";
            var body = new AnswerRequest(tenantId, question, language.code(), slots);
            AnswerResponse response = restTemplate.postForObject(url, jsonEntity(body), AnswerResponse.class);
            if (response == null || response.answer() == null || response.answer().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(response.answer().trim());
        } catch (Exception e) {
            log.warn("Answer lookup failed for tenant={}: {}", tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    private static <T> HttpEntity<T> jsonEntity(T body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private record ExtractRequest(String text, String language) {}

    private record AnswerRequest(Long tenantId, String question, String language, Map<String, String> slots) {}

    record AnswerResponse(String answer) {}
}
