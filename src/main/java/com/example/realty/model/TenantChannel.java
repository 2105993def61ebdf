package com.example.realty.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "tenant_channel",
        uniqueConstraints = @UniqueConstraint(columnNames = {"tenant_id", "channel"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TenantChannel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Channel channel;

    // Telegram
    private String botToken;
    private String botUsername;

    // WhatsApp Cloud API
    private String phoneNumberId;
    @Column(length = 512)
    private String accessToken;

    @Builder.Default
    private boolean enabled = true;
}
