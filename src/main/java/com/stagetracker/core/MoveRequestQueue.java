package com.stagetracker.core;

import com.google.common.base.Preconditions;
import com.stagetracker.model.MoveRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO between request handlers and the single {@link MoveProcessor}.
 * <p>
 * When the queue is full, {@link #submit} blocks the caller until the
 * processor frees a slot. Requests are never dropped silently: once the
 * queue is closed, submissions fail with {@link MoveRejectedException}.
 */
@Slf4j
public class MoveRequestQueue {
    private final BlockingQueue<MoveRequest> requests;
    private final int capacity;
    private final AtomicLong acceptedCount = new AtomicLong(0);
    private volatile boolean closed;

    public MoveRequestQueue(int capacity) {
        Preconditions.checkArgument(capacity > 0, "queue capacity must be positive: %s", capacity);
        this.capacity = capacity;
        this.requests = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueue a move request, waiting for space if the queue is full
     */
    public void submit(MoveRequest request) {
        Preconditions.checkNotNull(request, "request");
        if (closed) {
            log.warn("Move request refused, queue closed: {}", request);
            throw new MoveRejectedException("Move queue is closed, request refused for item " + request.getItemId());
        }
        try {
            requests.put(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MoveRejectedException("Interrupted while waiting to enqueue move for item " + request.getItemId(), e);
        }
        acceptedCount.incrementAndGet();
        log.debug("Move request queued: {} ({} pending)", request, requests.size());
    }

    /**
     * Next request in submission order, waiting up to {@code timeout} for one
     */
    Optional<MoveRequest> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(requests.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Stop accepting new requests. Already queued requests stay queued.
     */
    void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return requests.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Total requests successfully enqueued since startup
     */
    public long acceptedCount() {
        return acceptedCount.get();
    }
}
