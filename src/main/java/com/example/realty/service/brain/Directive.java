package com.example.realty.service.brain;

/**
 * Side effect requested by a turn. The brain only describes it; the dispatcher carries it out.
 */
public record Directive(DirectiveType type, AdminAlert alert) {

    private static final Directive PERSIST = new Directive(DirectiveType.PERSIST, null);
    private static final Directive SEND_REPLY = new Directive(DirectiveType.SEND_REPLY, null);

    public static Directive persist() {
        return PERSIST;
    }

    public static Directive sendReply() {
        return SEND_REPLY;
    }

    public static Directive notifyAdmin(AdminAlert alert) {
        return new Directive(DirectiveType.NOTIFY_ADMIN, alert);
    }
}
