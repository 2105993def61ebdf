package com.example.realty.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Data
public class BotConfig {

    @Value("${inference.api.base-url}")
    String inferenceUrl;

    @Value("${matching.api.base-url}")
    String matchingUrl;

    @Value("${whatsapp.api.base-url:https://graph.facebook.com/v18.0}")
    String whatsappApiUrl;

    @Value("${http.connect-timeout-ms:3000}")
    int connectTimeoutMs;

    @Value("${http.read-timeout-ms:10000}")
    int readTimeoutMs;
}
