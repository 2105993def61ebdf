package com.example.realty.service.channel;

import com.example.realty.model.Channel;
import com.example.realty.model.TenantChannel;
import com.example.realty.service.exception.ChannelAuthenticationException;

public interface ChannelConnector {

    Channel channel();

    /**
     * Opens the transport with the tenant's credentials and starts feeding inbound events to {@code sink}.
     *
     * @throws ChannelAuthenticationException when the credentials are rejected
     */
    ChannelConnection connect(TenantChannel credentials, InboundSink sink);
}
