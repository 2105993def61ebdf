package com.example.realty.service.channel.telegram;

import com.example.realty.dto.OutboundReply;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.service.channel.ChannelConnection;
import com.example.realty.service.exception.ChannelDeliveryException;
import com.example.realty.service.util.KeyboardUtil;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;

@Slf4j
class TelegramChannelConnection implements ChannelConnection {

    static final int BUTTONS_PER_ROW = 2;

    private final TenantChannelKey key;
    private final TelegramChannelBot bot;
    private final BotSession session;

    TelegramChannelConnection(TenantChannelKey key, TelegramChannelBot bot, BotSession session) {
        this.key = key;
        this.bot = bot;
        this.session = session;
    }

    @Override
    public void send(OutboundReply reply) {
        SendMessage message = new SendMessage(reply.channelIdentity(), reply.text());
        if (reply.hasButtons()) {
            message.setReplyMarkup(KeyboardUtil.fromButtons(reply.buttons(), BUTTONS_PER_ROW));
        }
        try {
            bot.execute(message);
        } catch (TelegramApiException e) {
            throw new ChannelDeliveryException("Telegram send to " + reply.channelIdentity() + " on " + key + " failed", e);
        }
    }

    @Override
    public boolean isAlive() {
        return session.isRunning();
    }

    @Override
    public void close() {
        if (session.isRunning()) {
            session.stop();
        }
        bot.onClosing();
        log.info("Telegram session {} closed", key);
    }
}
