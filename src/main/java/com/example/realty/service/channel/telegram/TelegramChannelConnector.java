package com.example.realty.service.channel.telegram;

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
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.BotSession;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramChannelConnector implements ChannelConnector {

    private final TelegramBotsApi botsApi;
    private final Clock clock;

    @Override
    public Channel channel() {
        return Channel.TELEGRAM;
    }

    @Override
    public ChannelConnection connect(TenantChannel credentials, InboundSink sink) {
        TenantChannelKey key = new TenantChannelKey(credentials.getTenantId(), Channel.TELEGRAM);
        if (credentials.getBotToken() == null || credentials.getBotToken().isBlank()) {
            throw new ChannelAuthenticationException("No bot token configured for " + key);
        }

        TelegramChannelBot bot = new TelegramChannelBot(
                credentials.getBotToken(), credentials.getBotUsername(), key, sink, clock.getZone());

        User me;
        try {
            me = bot.execute(new GetMe());
        } catch (TelegramApiRequestException e) {
            Integer code = e.getErrorCode();
            if (code != null && (code == 401 || code == 404)) {
                throw new ChannelAuthenticationException("Telegram rejected the token of " + key, e);
            }
            throw new ChannelDeliveryException("Telegram getMe failed for " + key, e);
        } catch (TelegramApiException e) {
            throw new ChannelDeliveryException("Telegram unreachable for " + key, e);
        }
        bot.setUsername(me.getUserName());

        BotSession session;
        try {
            session = botsApi.registerBot(bot);
        } catch (TelegramApiException e) {
            throw new ChannelDeliveryException("Could not start long polling for " + key, e);
        }
        log.info("Telegram bot @{} polling for {}", me.getUserName(), key);
        return new TelegramChannelConnection(key, bot, session);
    }
}
