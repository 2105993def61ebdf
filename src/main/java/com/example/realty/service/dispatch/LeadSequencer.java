package com.example.realty.service.dispatch;

import com.example.realty.dto.LeadKey;
import com.example.realty.service.exception.DispatcherNotRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * The one gate every lead mutation passes through. Tasks for the same lead run strictly one after
 * another in submission order; tasks for different leads run in parallel on whatever executor they
 * were submitted with.
 */
@Slf4j
@Component
public class LeadSequencer {

    private final Map<LeadKey, Lane> lanes = new ConcurrentHashMap<>();

    public <T> CompletableFuture<T> submit(LeadKey key, Executor executor, Supplier<T> work) {
        CompletableFuture<T> future = new CompletableFuture<>();
        SequencedTask<T> task = new SequencedTask<>(key, executor, work, future);

        boolean[] idle = new boolean[1];
        lanes.compute(key, (k, lane) -> {
            Lane current = lane != null ? lane : new Lane();
            current.queue.addLast(task);
            if (!current.active) {
                current.active = true;
                idle[0] = true;
            }
            return current;
        });
        if (idle[0]) {
            drain(key);
        }
        return future;
    }

    /** Number of leads with queued or running work. */
    public int activeLanes() {
        return lanes.size();
    }

    private void drain(LeadKey key) {
        SequencedTask<?> next = pollOrRetire(key);
        if (next == null) {
            return;
        }
        try {
            next.executor.execute(next);
        } catch (RejectedExecutionException e) {
            log.warn("Task for {} rejected: {}", key, e.getMessage());
            next.fail(new DispatcherNotRunningException("Executor rejected work for " + key));
            drain(key);
        }
    }

    private SequencedTask<?> pollOrRetire(LeadKey key) {
        SequencedTask<?>[] out = new SequencedTask<?>[1];
        lanes.computeIfPresent(key, (k, lane) -> {
            out[0] = lane.queue.pollFirst();
            // an empty lane is dropped, the next submit starts a fresh one
            return out[0] == null ? null : lane;
        });
        return out[0];
    }

    private static final class Lane {
        private final Deque<SequencedTask<?>> queue = new ArrayDeque<>();
        private boolean active;
    }

    /**
     * Handed to the executor. An executor that drops it without running it (shutdownNow) must call
     * {@link #abandon(Throwable)} so the lane moves on.
     */
    public final class SequencedTask<T> implements Runnable {

        private final LeadKey key;
        private final Executor executor;
        private final Supplier<T> work;
        private final CompletableFuture<T> future;

        private SequencedTask(LeadKey key, Executor executor, Supplier<T> work, CompletableFuture<T> future) {
            this.key = key;
            this.executor = executor;
            this.work = work;
            this.future = future;
        }

        @Override
        public void run() {
            try {
                future.complete(work.get());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            } finally {
                drain(key);
            }
        }

        public void abandon(Throwable reason) {
            fail(reason);
            drain(key);
        }

        private void fail(Throwable reason) {
            future.completeExceptionally(reason);
        }
    }
}
