package com.example.realty.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "lead",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_lead_channel_identity",
                columnNames = {"tenant_id", "channel", "channel_identity"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Channel channel;

    /** chat id on Telegram, phone number on WhatsApp */
    @Column(name = "channel_identity", nullable = false, length = 100)
    private String channelIdentity;

    private String displayName;
    private String phone;
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(length = 5)
    @Builder.Default
    private Language language = Language.EN;

    @Enumerated(EnumType.STRING)
    @Column(name = "conversation_state", nullable = false, length = 30)
    @Builder.Default
    private ConversationState conversationState = ConversationState.START;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "lead_slot", joinColumns = @JoinColumn(name = "lead_id"))
    @MapKeyColumn(name = "slot_name", length = 40)
    @Column(name = "slot_value", length = 255)
    @Builder.Default
    private Map<String, String> slots = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    @Builder.Default
    private LeadTemperature temperature = LeadTemperature.COLD;

    @Builder.Default
    private int leadScore = 0;

    @Builder.Default
    private int followupStage = 0;

    private LocalDateTime nextFollowupAt;
    private LocalDateTime lastContactedAt;

    @Builder.Default
    private boolean followupEnabled = true;

    @Builder.Default
    private boolean ghostReminderSent = false;

    /** set while a scheduler tick owns this lead */
    @Column(length = 40)
    private String followupClaimToken;

    private LocalDateTime followupClaimedAt;

    @Builder.Default
    private int contactRetries = 0;

    private LocalDateTime lastInteractionAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 12)
    @Builder.Default
    private DeliveryStatus deliveryStatus = DeliveryStatus.DELIVERED;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public String slot(String name) {
        return slots == null ? null : slots.get(name);
    }

    public boolean hasSlot(String name) {
        String value = slot(name);
        return value != null && !value.isBlank();
    }
}
