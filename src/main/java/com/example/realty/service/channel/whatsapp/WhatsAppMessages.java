package com.example.realty.service.channel.whatsapp;

import com.example.realty.dto.OutboundReply;
import com.example.realty.dto.ReplyButton;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cloud API message bodies. Up to three buttons go out as reply buttons, more as a single-section list.
 */
final class WhatsAppMessages {

    static final int MAX_REPLY_BUTTONS = 3;
    static final int MAX_LIST_ROWS = 10;
    static final int BUTTON_TITLE_LIMIT = 20;
    static final int ROW_TITLE_LIMIT = 24;

    private WhatsAppMessages() {}

    static Map<String, Object> body(OutboundReply reply, String listLabel) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messaging_product", "whatsapp");
        body.put("recipient_type", "individual");
        body.put("to", reply.channelIdentity());

        if (!reply.hasButtons()) {
            body.put("type", "text");
            body.put("text", Map.of("body", reply.text()));
            return body;
        }

        body.put("type", "interactive");
        body.put("interactive", reply.buttons().size() <= MAX_REPLY_BUTTONS
                ? buttons(reply)
                : list(reply, listLabel));
        return body;
    }

    private static Map<String, Object> buttons(OutboundReply reply) {
        List<Map<String, Object>> buttons = new ArrayList<>();
        for (ReplyButton button : reply.buttons()) {
            buttons.add(Map.of("type", "reply",
                    "reply", Map.of("id", button.data(), "title", truncate(button.label(), BUTTON_TITLE_LIMIT))));
        }
        return Map.of(
                "type", "button",
                "body", Map.of("text", reply.text()),
                "action", Map.of("buttons", buttons));
    }

    private static Map<String, Object> list(OutboundReply reply, String listLabel) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ReplyButton button : reply.buttons().subList(0, Math.min(MAX_LIST_ROWS, reply.buttons().size()))) {
            rows.add(Map.of("id", button.data(), "title", truncate(button.label(), ROW_TITLE_LIMIT)));
        }
        return Map.of(
                "type", "list",
                "body", Map.of("text", reply.text()),
                "action", Map.of(
                        "button", truncate(listLabel, BUTTON_TITLE_LIMIT),
                        "sections", List.of(Map.of("rows", rows))));
    }

    static String truncate(String value, int limit) {
        if (value == null) {
            return "";
        }
        return value.length() <= limit ? value : value.substring(0, limit);
    }
}
