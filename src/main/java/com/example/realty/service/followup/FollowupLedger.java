package com.example.realty.service.followup;

import com.example.realty.model.ConversationState;
import com.example.realty.model.Lead;
import com.example.realty.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Single-writer claims on a lead's follow-up window. Every operation is one conditional update, so two
 * scheduler runs (or two nodes) racing for the same lead cannot both win.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FollowupLedger {

    private final LeadRepository leadRepository;
    private final FollowupPolicy policy;

    @Transactional
    public Optional<String> claim(Long leadId, ClaimKind kind, boolean forced, LocalDateTime now) {
        String token = kind.newToken();
        int updated = switch (kind) {
            case GHOST -> leadRepository.claimGhost(leadId, token, now, ConversationState.FOLLOWUP_EXCLUDED);
            case DRIP -> forced
                    ? leadRepository.claimDripForced(leadId, token, now, ConversationState.FOLLOWUP_EXCLUDED)
                    : leadRepository.claimDrip(leadId, token, now, ConversationState.FOLLOWUP_EXCLUDED);
        };
        if (updated == 0) {
            log.debug("Lead {} {} claim lost, already handled", leadId, kind);
            return Optional.empty();
        }
        return Optional.of(token);
    }

    /** Records a delivered send and frees the claim. */
    @Transactional
    public boolean commit(Long leadId, String token, int sentStage, LocalDateTime now) {
        ClaimKind kind = ClaimKind.ofToken(token).orElse(ClaimKind.DRIP);
        int updated;
        if (kind == ClaimKind.GHOST) {
            updated = leadRepository.commitGhost(leadId, token, now);
        } else {
            FollowupPolicy.StageAdvance advance = policy.afterSend(sentStage, now);
            updated = leadRepository.commitDrip(leadId, token, advance.stage(), advance.nextFollowupAt(),
                    advance.enabled(), now);
        }
        if (updated == 0) {
            log.warn("Lead {} claim {} vanished before commit", leadId, token);
            return false;
        }
        log.info("Lead {} {} follow-up committed (stage {})", leadId, kind, sentStage);
        return true;
    }

    @Transactional
    public boolean release(Long leadId, String token) {
        int updated = leadRepository.releaseClaim(leadId, token);
        if (updated > 0) {
            log.debug("Lead {} claim {} released", leadId, token);
        }
        return updated > 0;
    }

    /**
     * Resolves a claim whose holder never came back. Delivery is unknown, so the window is treated as
     * sent and advanced without a resend.
     */
    @Transactional
    public boolean recover(Lead lead, LocalDateTime now) {
        String token = lead.getFollowupClaimToken();
        if (token == null) {
            return false;
        }
        log.warn("Recovering stale {} claim on lead {} taken at {}",
                ClaimKind.ofToken(token).orElse(ClaimKind.DRIP), lead.getId(), lead.getFollowupClaimedAt());
        return commit(lead.getId(), token, lead.getFollowupStage(), now);
    }
}
