package com.example.realty.service.brain;

import com.example.realty.dto.ReplyButton;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Language;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of one transition. {@code path} lists every state entered during the turn, the last one being
 * the state the lead ends up in; a turn that stays put has a single-element path.
 */
@Value
@Builder
public class Outcome {

    String replyText;

    @Singular
    List<ReplyButton> buttons;

    @Singular("step")
    List<ConversationState> path;

    /** only keys the lead did not have before */
    @Singular
    Map<String, String> slotUpdates;

    /** null when unchanged */
    Language language;

    /** null when unchanged */
    String phone;

    /** null when unchanged */
    Integer contactRetries;

    @Singular
    List<Directive> directives;

    public ConversationState getNextState() {
        return path.get(path.size() - 1);
    }

    public boolean hasReply() {
        return replyText != null && !replyText.isBlank();
    }

    public List<AdminAlert> getAdminAlerts() {
        return directives.stream()
                .filter(d -> d.type() == DirectiveType.NOTIFY_ADMIN)
                .map(Directive::alert)
                .toList();
    }
}
