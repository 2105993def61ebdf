package com.example.realty.service.manager;

import com.example.realty.config.EngineProperties;
import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.model.Channel;
import com.example.realty.model.Tenant;
import com.example.realty.model.TenantChannel;
import com.example.realty.service.TenantSettingsService;
import com.example.realty.service.channel.ChannelConnector;
import com.example.realty.service.dispatch.ChannelDispatcher;
import com.example.realty.service.dispatch.ChannelDispatcherFactory;
import com.example.realty.service.dispatch.DispatcherRegistry;
import com.example.realty.service.dispatch.TurnResult;
import com.example.realty.service.exception.ChannelAuthenticationException;
import com.example.realty.service.exception.DispatcherNotRunningException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts, stops and supervises one dispatcher per (tenant, channel). A tenant whose credentials are
 * rejected ends up FAILED and stays that way until started again explicitly; the others keep running.
 */
@Slf4j
@Service
public class MultiTenantBotManager {

    private final DispatcherRegistry registry;
    private final ChannelDispatcherFactory dispatcherFactory;
    private final TenantSettingsService settingsService;
    private final EngineProperties properties;
    private final Clock clock;
    private final Map<Channel, ChannelConnector> connectors = new EnumMap<>(Channel.class);

    private final Map<TenantChannelKey, BotStatus> statuses = new ConcurrentHashMap<>();
    private final Set<TenantChannelKey> rejectedCredentials = ConcurrentHashMap.newKeySet();
    // connecting and draining can take long, so each (tenant, channel) is serialized on its own monitor
    private final Map<TenantChannelKey, Object> locks = new ConcurrentHashMap<>();

    public MultiTenantBotManager(DispatcherRegistry registry,
                                 ChannelDispatcherFactory dispatcherFactory,
                                 TenantSettingsService settingsService,
                                 EngineProperties properties,
                                 Clock clock,
                                 List<ChannelConnector> connectors) {
        this.registry = registry;
        this.dispatcherFactory = dispatcherFactory;
        this.settingsService = settingsService;
        this.properties = properties;
        this.clock = clock;
        connectors.forEach(c -> this.connectors.put(c.channel(), c));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        List<Tenant> tenants = settingsService.activeTenants();
        log.info("Starting bots for {} active tenants", tenants.size());
        for (Tenant tenant : tenants) {
            for (TenantChannel channel : settingsService.enabledChannels(tenant.getId())) {
                start(new TenantChannelKey(tenant.getId(), channel.getChannel()));
            }
        }
    }

    /** No-op when already running. Never throws for connection problems, they end up in the status. */
    public BotStatus start(TenantChannelKey key) {
        synchronized (lockFor(key)) {
            rejectedCredentials.remove(key);
            return doStart(key);
        }
    }

    public BotStatus stop(TenantChannelKey key) {
        synchronized (lockFor(key)) {
            return doStop(key);
        }
    }

    public BotStatus restart(TenantChannelKey key) {
        synchronized (lockFor(key)) {
            doStop(key);
            rejectedCredentials.remove(key);
            return doStart(key);
        }
    }

    /**
     * Routes an event to its tenant's dispatcher, starting it on demand. Credentials known to be rejected
     * are not retried here.
     */
    public CompletableFuture<TurnResult> dispatch(InboundEvent event) {
        TenantChannelKey key = event.leadKey().tenantChannel();
        Optional<ChannelDispatcher> dispatcher = registry.get(key).filter(ChannelDispatcher::isRunning);
        if (dispatcher.isEmpty() && !rejectedCredentials.contains(key)) {
            synchronized (lockFor(key)) {
                doStart(key);
            }
            dispatcher = registry.get(key).filter(ChannelDispatcher::isRunning);
        }
        return dispatcher
                .map(d -> d.dispatch(event))
                .orElseGet(() -> CompletableFuture.failedFuture(
                        new DispatcherNotRunningException("No running dispatcher for " + key)));
    }

    public List<BotStatus> statuses() {
        return statuses.values().stream()
                .sorted(Comparator.comparing((BotStatus s) -> s.key().tenantId())
                        .thenComparing(s -> s.key().channel()))
                .toList();
    }

    public Optional<BotStatus> status(TenantChannelKey key) {
        return Optional.ofNullable(statuses.get(key));
    }

    /** Restarts dispatchers whose transport died underneath them. */
    @Scheduled(fixedDelayString = "${engine.dispatch.supervisor-interval:PT1M}",
            initialDelayString = "${engine.dispatch.supervisor-interval:PT1M}")
    public void supervise() {
        for (ChannelDispatcher dispatcher : registry.all()) {
            if (dispatcher.isRunning() && !dispatcher.isAlive()) {
                log.warn("Connection of {} is dead, restarting", dispatcher.key());
                try {
                    restart(dispatcher.key());
                } catch (RuntimeException e) {
                    log.error("Restart of {} failed: {}", dispatcher.key(), e.getMessage());
                }
            }
        }
    }

    @PreDestroy
    public void stopAll() {
        for (ChannelDispatcher dispatcher : registry.all()) {
            try {
                stop(dispatcher.key());
            } catch (RuntimeException e) {
                log.warn("Stopping {} failed: {}", dispatcher.key(), e.getMessage());
            }
        }
    }

    private Object lockFor(TenantChannelKey key) {
        return locks.computeIfAbsent(key, k -> new Object());
    }

    private BotStatus doStop(TenantChannelKey key) {
        Optional<ChannelDispatcher> dispatcher = registry.get(key);
        if (dispatcher.isEmpty()) {
            return statuses.computeIfAbsent(key, k -> BotStatus.stopped(k, now()));
        }
        try {
            dispatcher.get().stop(properties.getDispatch().getDrainTimeout());
        } finally {
            registry.remove(key, dispatcher.get());
        }
        BotStatus status = BotStatus.stopped(key, now());
        statuses.put(key, status);
        return status;
    }

    private BotStatus doStart(TenantChannelKey key) {
        Optional<ChannelDispatcher> existing = registry.get(key);
        if (existing.isPresent() && existing.get().isRunning()) {
            return statuses.computeIfAbsent(key, k -> BotStatus.running(k, now()));
        }

        Optional<TenantChannel> credentials = settingsService.channel(key.tenantId(), key.channel())
                .filter(TenantChannel::isEnabled);
        if (credentials.isEmpty()) {
            return record(BotStatus.failed(key, "channel not configured or disabled", now()));
        }
        ChannelConnector connector = connectors.get(key.channel());
        if (connector == null) {
            return record(BotStatus.failed(key, "no connector for " + key.channel(), now()));
        }

        ChannelDispatcher dispatcher = dispatcherFactory.create(credentials.get(), connector);
        try {
            dispatcher.start();
        } catch (ChannelAuthenticationException e) {
            log.error("Bot {} not started, credentials rejected: {}", key, e.getMessage());
            rejectedCredentials.add(key);
            return record(BotStatus.failed(key, e.getMessage(), now()));
        } catch (RuntimeException e) {
            log.error("Bot {} not started: {}", key, e.getMessage());
            return record(BotStatus.failed(key, e.getMessage(), now()));
        }

        existing.ifPresent(stale -> registry.remove(key, stale));
        ChannelDispatcher raced = registry.putIfAbsent(key, dispatcher);
        if (raced != null) {
            dispatcher.stop(properties.getDispatch().getDrainTimeout());
            return statuses.computeIfAbsent(key, k -> BotStatus.running(k, now()));
        }
        log.info("Bot {} running", key);
        return record(BotStatus.running(key, now()));
    }

    private BotStatus record(BotStatus status) {
        statuses.put(status.key(), status);
        return status;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
