package com.example.realty.service.dispatch;

import com.example.realty.dto.OutboundReply;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.model.Tenant;
import com.example.realty.service.TenantSettingsService;
import com.example.realty.service.brain.AdminAlert;
import com.example.realty.service.channel.ChannelConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Best-effort alerts to the tenant's admin. Sent off the lead's turn, failures are logged and never retried.
 */
@Slf4j
@Service
public class AdminNotifier {

    private final DispatcherRegistry registry;
    private final TenantSettingsService settingsService;
    private final AdminAlertFormatter formatter;
    private final Executor executor;

    public AdminNotifier(DispatcherRegistry registry,
                         TenantSettingsService settingsService,
                         AdminAlertFormatter formatter,
                         @Qualifier("notificationExecutor") Executor executor) {
        this.registry = registry;
        this.settingsService = settingsService;
        this.formatter = formatter;
        this.executor = executor;
    }

    public void notify(AdminAlert alert) {
        try {
            executor.execute(() -> deliver(alert));
        } catch (RejectedExecutionException e) {
            log.warn("Admin alert {} for lead {} dropped: {}", alert.kind(), alert.leadId(), e.getMessage());
        }
    }

    void deliver(AdminAlert alert) {
        try {
            Optional<Tenant> tenant = settingsService.findTenant(alert.tenantId());
            if (tenant.isEmpty()) {
                log.warn("Admin alert {} for unknown tenant {}", alert.kind(), alert.tenantId());
                return;
            }
            String address = tenant.get().getAdminAddress();
            if (address == null || address.isBlank()) {
                log.warn("Tenant {} has no admin address, {} alert for lead {} suppressed",
                        alert.tenantId(), alert.kind(), alert.leadId());
                return;
            }
            TenantChannelKey key = new TenantChannelKey(alert.tenantId(), tenant.get().getAdminChannel());
            Optional<ChannelConnection> connection = registry.connection(key);
            if (connection.isEmpty()) {
                log.warn("No live {} connection for admin alert {} on lead {}", key, alert.kind(), alert.leadId());
                return;
            }
            connection.get().send(OutboundReply.text(address, formatter.format(alert, tenant.get())));
            log.info("Admin alert {} for lead {} sent to tenant {}", alert.kind(), alert.leadId(), alert.tenantId());
        } catch (RuntimeException e) {
            log.warn("Admin alert {} for lead {} failed: {}", alert.kind(), alert.leadId(), e.toString());
        }
    }
}
