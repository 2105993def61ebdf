package com.example.realty.service.dispatch;

import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.model.TenantChannel;
import com.example.realty.service.channel.ChannelConnection;
import com.example.realty.service.channel.ChannelConnector;
import com.example.realty.service.channel.InboundSink;
import com.example.realty.service.exception.DispatcherNotRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * One tenant's bot on one channel: owns the transport connection and a worker pool. Turns of the same
 * lead are serialized by the {@link LeadSequencer}; different leads share the pool.
 */
@Slf4j
public class ChannelDispatcher implements InboundSink {

    private final TenantChannelKey key;
    private final TenantChannel credentials;
    private final ChannelConnector connector;
    private final TurnProcessor processor;
    private final LeadSequencer sequencer;
    private final ThreadPoolTaskExecutor executor;

    private volatile ChannelConnection connection;
    private volatile boolean running;

    ChannelDispatcher(TenantChannelKey key,
                      TenantChannel credentials,
                      ChannelConnector connector,
                      TurnProcessor processor,
                      LeadSequencer sequencer,
                      ThreadPoolTaskExecutor executor) {
        this.key = key;
        this.credentials = credentials;
        this.connector = connector;
        this.processor = processor;
        this.sequencer = sequencer;
        this.executor = executor;
    }

    /**
     * Connects the transport. On failure the pool is released and the exception is rethrown.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            connection = connector.connect(credentials, this);
        } catch (RuntimeException e) {
            executor.shutdown();
            throw e;
        }
        running = true;
        log.info("Dispatcher {} started", key);
    }

    public CompletableFuture<TurnResult> dispatch(InboundEvent event) {
        if (!running) {
            return CompletableFuture.failedFuture(new DispatcherNotRunningException("Dispatcher " + key + " is not running"));
        }
        ChannelConnection current = connection;
        return sequencer.submit(event.leadKey(), executor, () -> processor.process(event, current));
    }

    /** Entry point for the transport's own receive loop. */
    @Override
    public void accept(InboundEvent event) {
        dispatch(event).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Event from {} on {} not processed: {}", event.getChannelIdentity(), key, error.toString());
            } else if (result.status() == TurnResult.Status.ABORTED) {
                log.warn("Turn for lead {} aborted: {}", result.leadId(), result.detail());
            }
        });
    }

    /**
     * Rejects new events, lets in-flight turns finish within {@code drainTimeout} and abandons the rest.
     * Interrupted turns release their follow-up claims on the way out.
     */
    public synchronized void stop(Duration drainTimeout) {
        if (!running && connection == null) {
            return;
        }
        running = false;
        ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
        pool.shutdown();
        try {
            if (!pool.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = pool.shutdownNow();
                log.warn("Dispatcher {} did not drain in {}, abandoning {} queued turns", key, drainTimeout, dropped.size());
                abandon(dropped);
            }
        } catch (InterruptedException e) {
            abandon(pool.shutdownNow());
            Thread.currentThread().interrupt();
        } finally {
            closeConnection();
        }
        log.info("Dispatcher {} stopped", key);
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isAlive() {
        ChannelConnection current = connection;
        return running && current != null && current.isAlive();
    }

    public Optional<ChannelConnection> connection() {
        return Optional.ofNullable(connection);
    }

    public TenantChannelKey key() {
        return key;
    }

    private void abandon(List<Runnable> dropped) {
        DispatcherNotRunningException reason = new DispatcherNotRunningException("Dispatcher " + key + " stopped");
        for (Runnable task : dropped) {
            if (task instanceof LeadSequencer.SequencedTask<?> sequenced) {
                sequenced.abandon(reason);
            }
        }
    }

    private void closeConnection() {
        ChannelConnection current = connection;
        connection = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Closing {} connection failed: {}", key, e.getMessage());
            }
        }
    }
}
