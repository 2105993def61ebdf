package com.example.realty.service.channel;

import com.example.realty.dto.InboundEvent;

/** Where a channel connection delivers the events it receives. */
@FunctionalInterface
public interface InboundSink {
    void accept(InboundEvent event);
}
