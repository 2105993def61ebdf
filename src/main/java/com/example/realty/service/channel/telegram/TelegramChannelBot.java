package com.example.realty.service.channel.telegram;

import com.example.realty.dto.TenantChannelKey;
import com.example.realty.service.channel.InboundSink;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.ZoneId;

/**
 * Long-polling bot of one tenant. Holds no conversation logic, updates go straight to the sink.
 */
@Slf4j
class TelegramChannelBot extends TelegramLongPollingBot {

    private final TenantChannelKey key;
    private final InboundSink sink;
    private final ZoneId zone;
    private volatile String username;

    TelegramChannelBot(String token, String username, TenantChannelKey key, InboundSink sink, ZoneId zone) {
        super(token);
        this.username = username;
        this.key = key;
        this.sink = sink;
        this.zone = zone;
    }

    @Override
    public String getBotUsername() {
        return username;
    }

    void setUsername(String username) {
        this.username = username;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasCallbackQuery()) {
            answer(update.getCallbackQuery().getId());
        }
        try {
            TelegramUpdateMapper.toEvent(key.tenantId(), update, zone).ifPresent(sink::accept);
        } catch (RuntimeException e) {
            log.warn("Update {} on {} could not be handed over: {}", update.getUpdateId(), key, e.toString());
        }
    }

    private void answer(String callbackId) {
        try {
            execute(new AnswerCallbackQuery(callbackId));
        } catch (TelegramApiException e) {
            log.debug("answerCallbackQuery failed on {}: {}", key, e.getMessage());
        }
    }
}
