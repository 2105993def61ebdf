package com.example.realty.service.dispatch;

import com.example.realty.config.EngineProperties;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.model.TenantChannel;
import com.example.realty.service.channel.ChannelConnector;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChannelDispatcherFactory {

    private final TurnProcessor processor;
    private final LeadSequencer sequencer;
    private final EngineProperties properties;

    public ChannelDispatcher create(TenantChannel credentials, ChannelConnector connector) {
        TenantChannelKey key = new TenantChannelKey(credentials.getTenantId(), credentials.getChannel());
        EngineProperties.DispatchConfig config = properties.getDispatch();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getThreadPoolSize());
        executor.setMaxPoolSize(config.getThreadPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("dispatch-" + key.tenantId() + "-" + key.channel().name().toLowerCase() + "-");
        executor.initialize();

        return new ChannelDispatcher(key, credentials, connector, processor, sequencer, executor);
    }
}
