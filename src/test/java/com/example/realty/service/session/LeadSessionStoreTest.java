package com.example.realty.service.session;

import com.example.realty.config.EngineProperties;
import com.example.realty.dto.LeadKey;
import com.example.realty.model.Channel;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Language;
import com.example.realty.model.Lead;
import com.example.realty.repository.LeadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class LeadSessionStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);
    private static final LeadKey KEY = new LeadKey(7L, Channel.TELEGRAM, "100");

    @Autowired
    private LeadRepository leadRepository;

    private LeadSessionStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        store = new LeadSessionStore(leadRepository, new EngineProperties(), clock);
    }

    @Test
    void shouldCreateLeadOnFirstContact() {
        Lead lead = store.resolve(KEY, "Sara", Language.FA);

        assertThat(lead.getId()).isNotNull();
        assertThat(lead.getConversationState()).isEqualTo(ConversationState.START);
        assertThat(lead.getLanguage()).isEqualTo(Language.FA);
        assertThat(lead.getDisplayName()).isEqualTo("Sara");
        assertThat(leadRepository.findByTenantIdAndChannelAndChannelIdentity(7L, Channel.TELEGRAM, "100")).isPresent();
    }

    @Test
    void shouldServeRepeatedResolveFromCache() {
        Lead first = store.resolve(KEY, "Sara", Language.EN);

        assertThat(store.resolve(KEY, "Sara", Language.EN)).isSameAs(first);

        store.evict(KEY);
        Lead reloaded = store.resolve(KEY, "Sara", Language.EN);
        assertThat(reloaded.getId()).isEqualTo(first.getId());
    }

    @Test
    void shouldFindWithoutCreating() {
        assertThat(store.find(KEY)).isEmpty();
        assertThat(leadRepository.count()).isZero();

        Lead created = store.resolve(KEY, "Sara", Language.EN);
        store.evict(KEY);

        assertThat(store.find(KEY)).get().extracting(Lead::getId).isEqualTo(created.getId());
    }

    @Test
    void shouldKeepIdentitiesApartPerChannel() {
        Lead telegram = store.resolve(KEY, null, Language.EN);
        Lead whatsapp = store.resolve(new LeadKey(7L, Channel.WHATSAPP, "100"), null, Language.EN);
        Lead otherTenant = store.resolve(new LeadKey(8L, Channel.TELEGRAM, "100"), null, Language.EN);

        assertThat(telegram.getId()).isNotEqualTo(whatsapp.getId()).isNotEqualTo(otherTenant.getId());
    }

    @Test
    void shouldPersistSlotsAndState() {
        Lead lead = store.resolve(KEY, "Sara", Language.EN);
        lead.setConversationState(ConversationState.SLOT_FILLING);
        lead.getSlots().put("goal", "investment");
        store.save(lead);
        store.evict(KEY);

        Lead reloaded = store.reload(lead.getId()).orElseThrow();

        assertThat(reloaded.getConversationState()).isEqualTo(ConversationState.SLOT_FILLING);
        assertThat(reloaded.getSlots()).containsEntry("goal", "investment");
    }

    @Test
    void shouldFindOnlyDueUnclaimedFunnelLeads() {
        Lead due = persist("1", ConversationState.SLOT_FILLING, NOW.minusMinutes(5));
        persist("2", ConversationState.SLOT_FILLING, NOW.plusHours(1));
        persist("3", ConversationState.HANDOFF, NOW.minusMinutes(5));
        Lead disabled = persist("4", ConversationState.WARMUP, NOW.minusMinutes(5));
        disabled.setFollowupEnabled(false);
        Lead claimed = persist("5", ConversationState.ENGAGEMENT, NOW.minusMinutes(5));
        claimed.setFollowupClaimToken("drip:taken");
        claimed.setFollowupClaimedAt(NOW);
        leadRepository.saveAll(List.of(disabled, claimed));

        assertThat(store.findDueForFollowup(NOW, 10)).extracting(Lead::getId).containsExactly(due.getId());
    }

    @Test
    void shouldFindGhostsOnlyWithPhone() {
        Lead withPhone = persist("1", ConversationState.ENGAGEMENT, null);
        withPhone.setPhone("+971501234567");
        withPhone.setLastInteractionAt(NOW.minusHours(3));
        Lead noPhone = persist("2", ConversationState.ENGAGEMENT, null);
        noPhone.setLastInteractionAt(NOW.minusHours(3));
        Lead recent = persist("3", ConversationState.ENGAGEMENT, null);
        recent.setPhone("+971501234568");
        recent.setLastInteractionAt(NOW.minusMinutes(30));
        leadRepository.saveAll(List.of(withPhone, noPhone, recent));

        assertThat(store.findGhostCandidates(NOW.minusHours(2), 10))
                .extracting(Lead::getId).containsExactly(withPhone.getId());
    }

    private Lead persist(String identity, ConversationState state, LocalDateTime nextFollowupAt) {
        return leadRepository.save(Lead.builder()
                .tenantId(7L)
                .channel(Channel.TELEGRAM)
                .channelIdentity(identity)
                .conversationState(state)
                .nextFollowupAt(nextFollowupAt)
                .build());
    }
}
