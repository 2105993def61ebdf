package com.example.realty.service.channel;

import com.example.realty.dto.OutboundReply;
import com.example.realty.service.exception.ChannelDeliveryException;

/**
 * A live link to one tenant's bot on one channel.
 */
public interface ChannelConnection {

    /**
     * @throws ChannelDeliveryException when the transport did not accept the message
     */
    void send(OutboundReply reply);

    boolean isAlive();

    /** Releases the transport. Safe to call more than once. */
    void close();
}
