package com.example.realty.service.channel.whatsapp;

import com.example.realty.config.BotConfig;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.model.Channel;
import com.example.realty.model.TenantChannel;
import com.example.realty.service.channel.ChannelConnection;
import com.example.realty.service.channel.ChannelConnector;
import com.example.realty.service.channel.InboundSink;
import com.example.realty.service.exception.ChannelAuthenticationException;
import com.example.realty.service.exception.ChannelDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * WhatsApp Cloud API. Connecting only checks that the access token can see the phone number.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WhatsAppChannelConnector implements ChannelConnector {

    private final WebClient.Builder whatsappWebClientBuilder;
    private final BotConfig config;

    @Override
    public Channel channel() {
        return Channel.WHATSAPP;
    }

    @Override
    public ChannelConnection connect(TenantChannel credentials, InboundSink sink) {
        TenantChannelKey key = new TenantChannelKey(credentials.getTenantId(), Channel.WHATSAPP);
        if (isBlank(credentials.getPhoneNumberId()) || isBlank(credentials.getAccessToken())) {
            throw new ChannelAuthenticationException("WhatsApp credentials missing for " + key);
        }

        WebClient client = whatsappWebClientBuilder.clone()
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.getAccessToken())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        Duration timeout = Duration.ofMillis(config.getReadTimeoutMs());

        try {
            client.get()
                    .uri("/{phoneNumberId}?fields=display_phone_number", credentials.getPhoneNumberId())
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                throw new ChannelAuthenticationException("WhatsApp rejected the access token of " + key, e);
            }
            throw new ChannelDeliveryException("WhatsApp check failed for " + key + " with HTTP " + status, e);
        } catch (WebClientException | IllegalStateException e) {
            throw new ChannelDeliveryException("WhatsApp unreachable for " + key, e);
        }

        log.info("WhatsApp number {} ready for {}", credentials.getPhoneNumberId(), key);
        return new WhatsAppChannelConnection(key, client, credentials.getPhoneNumberId(), timeout);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
