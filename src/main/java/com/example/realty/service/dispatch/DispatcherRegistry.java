package com.example.realty.service.dispatch;

import com.example.realty.dto.TenantChannelKey;
import com.example.realty.service.channel.ChannelConnection;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running dispatchers by (tenant, channel). Only the bot manager writes here.
 */
@Component
public class DispatcherRegistry {

    private final Map<TenantChannelKey, ChannelDispatcher> dispatchers = new ConcurrentHashMap<>();

    public Optional<ChannelDispatcher> get(TenantChannelKey key) {
        return Optional.ofNullable(dispatchers.get(key));
    }

    /** @return the dispatcher already registered under the key, or null when {@code dispatcher} was added */
    public ChannelDispatcher putIfAbsent(TenantChannelKey key, ChannelDispatcher dispatcher) {
        return dispatchers.putIfAbsent(key, dispatcher);
    }

    public boolean remove(TenantChannelKey key, ChannelDispatcher dispatcher) {
        return dispatchers.remove(key, dispatcher);
    }

    public Collection<ChannelDispatcher> all() {
        return List.copyOf(dispatchers.values());
    }

    public Optional<ChannelConnection> connection(TenantChannelKey key) {
        return get(key).filter(ChannelDispatcher::isAlive).flatMap(ChannelDispatcher::connection);
    }
}
