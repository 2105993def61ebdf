package com.example.realty.controllers.impl;

import com.example.realty.config.BotConfig;
import com.example.realty.controllers.PropertyMatchingClient;
import com.example.realty.dto.PropertySummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PropertyMatchingClientImpl implements PropertyMatchingClient {

    private final RestTemplate restTemplate;
    private final BotConfig config;

    @Override
    public List<PropertySummary> match(Long tenantId, Map<String, String> slots) {
        try {
            String url = config.getMatchingUrl() + "/tenants/" + tenantId + "/properties/match";

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<Map<String, String>> entity = new HttpEntity<>(slots, headers);

            ResponseEntity<PropertySummary[]> response = restTemplate.postForEntity(url, entity, PropertySummary[].class);
            PropertySummary[] body = response.getBody();
            return body != null ? Arrays.asList(body) : Collections.emptyList();
        } catch (Exception e) {
            log.warn("Property matching failed for tenant={}: {}", tenantId, e.getMessage());
            return Collections.emptyList();
        }
    }
}
