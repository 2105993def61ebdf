package com.example.realty.service.channel.telegram;

import com.example.realty.dto.InboundEvent;
import com.example.realty.model.Channel;
import com.example.realty.model.EventKind;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Telegram update to channel-neutral event. Text and shared contacts become TEXT, captioned photos
 * IMAGE_DESCRIPTION, inline button presses BUTTON. Everything else is ignored.
 */
final class TelegramUpdateMapper {

    private TelegramUpdateMapper() {}

    static Optional<InboundEvent> toEvent(Long tenantId, Update update, ZoneId zone) {
        if (update.hasCallbackQuery()) {
            CallbackQuery cbq = update.getCallbackQuery();
            if (cbq.getData() == null || cbq.getMessage() == null) {
                return Optional.empty();
            }
            return Optional.of(event(tenantId, cbq.getMessage().getChatId(), cbq.getFrom(),
                    EventKind.BUTTON, cbq.getData(), LocalDateTime.now(zone)));
        }

        if (!update.hasMessage()) {
            return Optional.empty();
        }
        Message msg = update.getMessage();
        LocalDateTime sentAt = msg.getDate() == null
                ? LocalDateTime.now(zone)
                : LocalDateTime.ofInstant(Instant.ofEpochSecond(msg.getDate()), zone);

        if (msg.hasText()) {
            return Optional.of(event(tenantId, msg.getChatId(), msg.getFrom(), EventKind.TEXT, msg.getText(), sentAt));
        }
        if (msg.hasContact() && msg.getContact().getPhoneNumber() != null) {
            return Optional.of(event(tenantId, msg.getChatId(), msg.getFrom(), EventKind.TEXT,
                    msg.getContact().getPhoneNumber(), sentAt));
        }
        if (msg.hasPhoto() && msg.getCaption() != null && !msg.getCaption().isBlank()) {
            return Optional.of(event(tenantId, msg.getChatId(), msg.getFrom(), EventKind.IMAGE_DESCRIPTION,
                    msg.getCaption(), sentAt));
        }
        return Optional.empty();
    }

    private static InboundEvent event(Long tenantId, Long chatId, User from, EventKind kind, String payload,
                                      LocalDateTime timestamp) {
        return InboundEvent.builder()
                .tenantId(tenantId)
                .channel(Channel.TELEGRAM)
                .channelIdentity(String.valueOf(chatId))
                .displayName(displayName(from))
                .kind(kind)
                .payload(payload)
                .timestamp(timestamp)
                .build();
    }

    static String displayName(User from) {
        if (from == null) {
            return null;
        }
        String first = from.getFirstName() == null ? "" : from.getFirstName().trim();
        String last = from.getLastName() == null ? "" : from.getLastName().trim();
        String full = (first + " " + last).trim();
        return full.isEmpty() ? from.getUserName() : full;
    }
}
