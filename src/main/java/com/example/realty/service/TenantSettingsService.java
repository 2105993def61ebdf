package com.example.realty.service;

import com.example.realty.config.EngineProperties;
import com.example.realty.model.Channel;
import com.example.realty.model.Tenant;
import com.example.realty.model.TenantChannel;
import com.example.realty.repository.TenantChannelRepository;
import com.example.realty.repository.TenantRepository;
import com.example.realty.service.exception.TenantNotFoundException;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-mostly tenant configuration. Tenants are provisioned elsewhere, so cached entries expire; the only
 * write is the admin address.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantSettingsService {

    private final TenantRepository tenantRepository;
    private final TenantChannelRepository channelRepository;
    private final EngineProperties properties;
    private final Clock clock;

    private final Map<Long, CachedTenant> cachedTenants = new ConcurrentHashMap<>();

    public Tenant getTenant(Long tenantId) {
        return findTenant(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
    }

    public Optional<Tenant> findTenant(Long tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        CachedTenant cached = cachedTenants.get(tenantId);
        if (cached != null) {
            if (cached.getExpiresAt().isAfter(LocalDateTime.now(clock))) {
                return Optional.of(cached.getTenant());
            }
            cachedTenants.remove(tenantId);
        }
        Optional<Tenant> loaded = tenantRepository.findById(tenantId);
        loaded.ifPresent(this::remember);
        return loaded;
    }

    public List<Tenant> activeTenants() {
        return tenantRepository.findByActiveTrue();
    }

    public List<TenantChannel> enabledChannels(Long tenantId) {
        return channelRepository.findByTenantIdAndEnabledTrue(tenantId);
    }

    public Optional<TenantChannel> channel(Long tenantId, Channel channel) {
        return channelRepository.findByTenantIdAndChannel(tenantId, channel);
    }

    /** Passing a null address clears it, which silences admin alerts for the tenant. */
    public Tenant bindAdminAddress(Long tenantId, Channel channel, String address) {
        Tenant tenant = tenantRepository.findById(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
        String normalized = address == null || address.isBlank() ? null : address.trim();
        tenant.setAdminAddress(normalized);
        if (channel != null) {
            tenant.setAdminChannel(channel);
        }
        Tenant saved = tenantRepository.save(tenant);
        remember(saved);
        if (normalized == null) {
            log.info("Admin address cleared for tenant {}", tenantId);
        } else {
            log.info("Admin address for tenant {} bound to {} on {}", tenantId, normalized, saved.getAdminChannel());
        }
        return saved;
    }

    private void remember(Tenant tenant) {
        cachedTenants.put(tenant.getId(), CachedTenant.builder()
                .tenant(tenant)
                .expiresAt(LocalDateTime.now(clock).plus(properties.getSession().getTenantCacheTtl()))
                .build());
    }

    @Data
    @Builder
    static class CachedTenant {
        private Tenant tenant;
        private LocalDateTime expiresAt;
    }
}
