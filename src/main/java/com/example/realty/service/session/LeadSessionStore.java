package com.example.realty.service.session;

import com.example.realty.config.EngineProperties;
import com.example.realty.dto.LeadKey;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Language;
import com.example.realty.model.Lead;
import com.example.realty.repository.LeadRepository;
import com.example.realty.service.exception.SessionStoreException;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable lead state with a short-lived read cache in front of it. The database is authoritative:
 * the cache only ever holds what was last written successfully.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadSessionStore {

    private final LeadRepository leadRepository;
    private final EngineProperties properties;
    private final Clock clock;

    private final Map<LeadKey, CachedLead> cache = new ConcurrentHashMap<>();

    public Lead resolve(LeadKey key, String displayName, Language defaultLanguage) {
        Optional<Lead> cached = cached(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        Lead lead = leadRepository
                .findByTenantIdAndChannelAndChannelIdentity(key.tenantId(), key.channel(), key.channelIdentity())
                .orElseGet(() -> create(key, displayName, defaultLanguage));
        remember(lead);
        return lead;
    }

    /** Like {@link #resolve} but never creates a lead. */
    public Optional<Lead> find(LeadKey key) {
        Optional<Lead> cached = cached(key);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Lead> lead = leadRepository
                .findByTenantIdAndChannelAndChannelIdentity(key.tenantId(), key.channel(), key.channelIdentity());
        lead.ifPresent(this::remember);
        return lead;
    }

    /** Reads straight from the database, refreshing the cache. */
    public Optional<Lead> reload(Long leadId) {
        Optional<Lead> lead = leadRepository.findById(leadId);
        lead.ifPresent(this::remember);
        return lead;
    }

    public Optional<Lead> findById(Long leadId) {
        return leadRepository.findById(leadId);
    }

    public Lead save(Lead lead) {
        LeadKey key = LeadKey.of(lead);
        try {
            Lead saved = leadRepository.save(lead);
            remember(saved);
            return saved;
        } catch (RuntimeException e) {
            cache.remove(key);
            log.error("Failed to persist lead {} ({}): {}", lead.getId(), key, e.getMessage());
            throw new SessionStoreException("Could not persist lead " + key, e);
        }
    }

    public void evict(LeadKey key) {
        cache.remove(key);
    }

    public List<Lead> findDueForFollowup(LocalDateTime now, int limit) {
        return leadRepository.findDueForFollowup(now, ConversationState.FOLLOWUP_EXCLUDED, PageRequest.of(0, limit));
    }

    public List<Lead> findGhostCandidates(LocalDateTime cutoff, int limit) {
        return leadRepository.findGhostCandidates(cutoff, ConversationState.FOLLOWUP_EXCLUDED, PageRequest.of(0, limit));
    }

    public List<Lead> findStaleClaims(LocalDateTime before) {
        return leadRepository.findStaleClaims(before);
    }

    private Lead create(LeadKey key, String displayName, Language defaultLanguage) {
        Lead lead = Lead.builder()
                .tenantId(key.tenantId())
                .channel(key.channel())
                .channelIdentity(key.channelIdentity())
                .displayName(displayName)
                .language(defaultLanguage == null ? Language.EN : defaultLanguage)
                .conversationState(ConversationState.START)
                .build();
        try {
            Lead saved = leadRepository.save(lead);
            log.info("New lead {} for {}", saved.getId(), key);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // created concurrently by another node
            return leadRepository
                    .findByTenantIdAndChannelAndChannelIdentity(key.tenantId(), key.channel(), key.channelIdentity())
                    .orElseThrow(() -> new SessionStoreException("Could not create lead " + key, e));
        } catch (RuntimeException e) {
            throw new SessionStoreException("Could not create lead " + key, e);
        }
    }

    private Optional<Lead> cached(LeadKey key) {
        CachedLead entry = cache.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.getExpiresAt().isBefore(LocalDateTime.now(clock))) {
            cache.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.getLead());
    }

    private void remember(Lead lead) {
        cache.put(LeadKey.of(lead), CachedLead.builder()
                .lead(lead)
                .expiresAt(LocalDateTime.now(clock).plus(properties.getSession().getCacheTtl()))
                .build());
    }

    @Data
    @Builder
    static class CachedLead {
        private Lead lead;
        private LocalDateTime expiresAt;
    }
}
