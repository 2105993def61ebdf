package com.example.realty.service.followup;

import java.util.Optional;
import java.util.UUID;

/**
 * Kind of scheduler claim. Encoded as the prefix of the claim token so a stale claim can be resolved
 * without knowing which pass took it.
 */
public enum ClaimKind {
    DRIP("drip:"),
    GHOST("ghost:");

    private final String prefix;

    ClaimKind(String prefix) {
        this.prefix = prefix;
    }

    public String newToken() {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }

    public static Optional<ClaimKind> ofToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (ClaimKind kind : values()) {
            if (token.startsWith(kind.prefix)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
