package com.example.realty.service.channel.telegram;

import com.example.realty.dto.InboundEvent;
import com.example.realty.model.Channel;
import com.example.realty.model.EventKind;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Contact;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramUpdateMapperTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void shouldMapTextMessage() {
        Message message = message();
        message.setText("looking for a villa");
        message.setDate(1772445600);

        InboundEvent event = TelegramUpdateMapper.toEvent(7L, update(message), UTC).orElseThrow();

        assertThat(event.getTenantId()).isEqualTo(7L);
        assertThat(event.getChannel()).isEqualTo(Channel.TELEGRAM);
        assertThat(event.getChannelIdentity()).isEqualTo("100");
        assertThat(event.getKind()).isEqualTo(EventKind.TEXT);
        assertThat(event.getPayload()).isEqualTo("looking for a villa");
        assertThat(event.getDisplayName()).isEqualTo("Sara Karimi");
        assertThat(event.getTimestamp()).isEqualTo(LocalDateTime.of(2026, 3, 2, 10, 0));
    }

    @Test
    void shouldMapSharedContactToText() {
        Message message = message();
        Contact contact = new Contact();
        contact.setPhoneNumber("+971501234567");
        message.setContact(contact);

        Optional<InboundEvent> event = TelegramUpdateMapper.toEvent(7L, update(message), UTC);

        assertThat(event).get().extracting(InboundEvent::getPayload).isEqualTo("+971501234567");
    }

    @Test
    void shouldMapCaptionedPhotoOnly() {
        Message captioned = message();
        captioned.setPhoto(List.of(new PhotoSize()));
        captioned.setCaption("something like this in JVC");
        Message bare = message();
        bare.setPhoto(List.of(new PhotoSize()));

        assertThat(TelegramUpdateMapper.toEvent(7L, update(captioned), UTC))
                .get().extracting(InboundEvent::getKind).isEqualTo(EventKind.IMAGE_DESCRIPTION);
        assertThat(TelegramUpdateMapper.toEvent(7L, update(bare), UTC)).isEmpty();
    }

    @Test
    void shouldMapButtonPress() {
        CallbackQuery query = new CallbackQuery();
        query.setData("slot:goal:living");
        query.setMessage(message());
        query.setFrom(user("Sara", null, "sara_k"));
        Update update = new Update();
        update.setCallbackQuery(query);

        InboundEvent event = TelegramUpdateMapper.toEvent(7L, update, UTC).orElseThrow();

        assertThat(event.getKind()).isEqualTo(EventKind.BUTTON);
        assertThat(event.getPayload()).isEqualTo("slot:goal:living");
        assertThat(event.getChannelIdentity()).isEqualTo("100");
    }

    @Test
    void shouldFallBackToUsername() {
        assertThat(TelegramUpdateMapper.displayName(user(null, " ", "sara_k"))).isEqualTo("sara_k");
        assertThat(TelegramUpdateMapper.displayName(null)).isNull();
    }

    @Test
    void shouldIgnoreUpdatesWithoutMessage() {
        assertThat(TelegramUpdateMapper.toEvent(7L, new Update(), UTC)).isEmpty();
    }

    private static Update update(Message message) {
        Update update = new Update();
        update.setMessage(message);
        return update;
    }

    private static Message message() {
        Chat chat = new Chat();
        chat.setId(100L);
        chat.setType("private");
        Message message = new Message();
        message.setChat(chat);
        message.setFrom(user("Sara", "Karimi", "sara_k"));
        return message;
    }

    private static User user(String first, String last, String username) {
        User user = new User();
        user.setId(42L);
        user.setFirstName(first);
        user.setLastName(last);
        user.setUserName(username);
        user.setIsBot(false);
        return user;
    }
}
