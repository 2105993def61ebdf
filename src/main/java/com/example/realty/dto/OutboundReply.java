package com.example.realty.dto;

import java.util.List;

public record OutboundReply(String channelIdentity, String text, List<ReplyButton> buttons) {

    public OutboundReply {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public static OutboundReply text(String channelIdentity, String text) {
        return new OutboundReply(channelIdentity, text, List.of());
    }

    public boolean hasButtons() {
        return !buttons.isEmpty();
    }
}
