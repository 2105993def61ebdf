package com.example.realty.service.channel.whatsapp;

import com.example.realty.dto.OutboundReply;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.service.channel.ChannelConnection;
import com.example.realty.service.exception.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;

/**
 * Outbound half of a WhatsApp number. Inbound messages reach the engine through the events endpoint.
 */
@Slf4j
class WhatsAppChannelConnection implements ChannelConnection {

    private final TenantChannelKey key;
    private final WebClient client;
    private final String phoneNumberId;
    private final Duration timeout;
    private volatile boolean open = true;

    WhatsAppChannelConnection(TenantChannelKey key, WebClient client, String phoneNumberId, Duration timeout) {
        this.key = key;
        this.client = client;
        this.phoneNumberId = phoneNumberId;
        this.timeout = timeout;
    }

    @Override
    public void send(OutboundReply reply) {
        if (!open) {
            throw new ChannelDeliveryException("WhatsApp connection " + key + " is closed");
        }
        try {
            client.post()
                    .uri("/{phoneNumberId}/messages", phoneNumberId)
                    .bodyValue(WhatsAppMessages.body(reply, "Options"))
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
        } catch (WebClientException e) {
            throw new ChannelDeliveryException("WhatsApp send to " + reply.channelIdentity() + " on " + key + " failed", e);
        } catch (IllegalStateException e) {
            // block() timed out
            throw new ChannelDeliveryException("WhatsApp send on " + key + " timed out", e);
        }
    }

    @Override
    public boolean isAlive() {
        return open;
    }

    @Override
    public void close() {
        if (open) {
            open = false;
            log.info("WhatsApp connection {} closed", key);
        }
    }
}
