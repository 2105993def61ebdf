package com.example.realty.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class RestConfig {

    private final BotConfig config;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public WebClient.Builder whatsappWebClientBuilder() {
        return WebClient.builder().baseUrl(config.getWhatsappApiUrl());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
