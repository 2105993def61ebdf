package com.example.realty.service;

import com.example.realty.config.EngineProperties;
import com.example.realty.model.Channel;
import com.example.realty.model.Tenant;
import com.example.realty.repository.TenantChannelRepository;
import com.example.realty.repository.TenantRepository;
import com.example.realty.service.exception.TenantNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TenantSettingsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private TenantRepository tenantRepository;
    private Clock clock;
    private TenantSettingsService service;

    @BeforeEach
    void setUp() {
        tenantRepository = mock(TenantRepository.class);
        clock = mock(Clock.class);
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        when(clock.instant()).thenReturn(NOW);
        service = new TenantSettingsService(tenantRepository, mock(TenantChannelRepository.class),
                new EngineProperties(), clock);
        when(tenantRepository.save(any(Tenant.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void shouldCacheTenantLookups() {
        when(tenantRepository.findById(7L)).thenReturn(Optional.of(Tenant.builder().id(7L).name("Acme").build()));

        service.findTenant(7L);
        service.findTenant(7L);

        verify(tenantRepository, times(1)).findById(7L);
    }

    @Test
    void shouldReloadTenantOnceCacheExpires() {
        when(tenantRepository.findById(7L)).thenReturn(
                Optional.of(Tenant.builder().id(7L).name("Acme").adminAddress("100").build()),
                Optional.of(Tenant.builder().id(7L).name("Acme").adminAddress("200").build()));

        assertThat(service.findTenant(7L)).get().extracting(Tenant::getAdminAddress).isEqualTo("100");

        when(clock.instant()).thenReturn(NOW.plusSeconds(4 * 60));
        assertThat(service.findTenant(7L)).get().extracting(Tenant::getAdminAddress).isEqualTo("100");

        when(clock.instant()).thenReturn(NOW.plusSeconds(6 * 60));
        assertThat(service.findTenant(7L)).get().extracting(Tenant::getAdminAddress).isEqualTo("200");
        verify(tenantRepository, times(2)).findById(7L);
    }

    @Test
    void shouldBindAndRebindAdminAddress() {
        when(tenantRepository.findById(7L)).thenReturn(Optional.of(Tenant.builder().id(7L).name("Acme").build()));

        Tenant bound = service.bindAdminAddress(7L, Channel.WHATSAPP, " 971500000001 ");

        assertThat(bound.getAdminAddress()).isEqualTo("971500000001");
        assertThat(bound.getAdminChannel()).isEqualTo(Channel.WHATSAPP);
        assertThat(service.findTenant(7L)).get().extracting(Tenant::getAdminAddress).isEqualTo("971500000001");
    }

    @Test
    void shouldKeepChannelWhenClearingAddress() {
        Tenant tenant = Tenant.builder().id(7L).name("Acme").adminChannel(Channel.WHATSAPP).adminAddress("971500000001").build();
        when(tenantRepository.findById(7L)).thenReturn(Optional.of(tenant));

        Tenant cleared = service.bindAdminAddress(7L, null, null);

        assertThat(cleared.getAdminAddress()).isNull();
        assertThat(cleared.getAdminChannel()).isEqualTo(Channel.WHATSAPP);
    }

    @Test
    void shouldRejectUnknownTenant() {
        when(tenantRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getTenant(9L)).isInstanceOf(TenantNotFoundException.class);
        assertThatThrownBy(() -> service.bindAdminAddress(9L, null, "x")).isInstanceOf(TenantNotFoundException.class);
    }
}
