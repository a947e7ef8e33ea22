package com.stagetracker.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stagetracker.model.MoveOutcome;
import com.stagetracker.model.MoveRequest;
import com.stagetracker.storage.StageStorage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background worker that drains the {@link MoveRequestQueue} on a single
 * dedicated thread and applies each request to the {@link StageIndex} and
 * then to the stage directories.
 * <p>
 * This is the only writer of index membership after startup. Requests are
 * applied one at a time in submission order, so two moves of the same item
 * never race.
 */
@Slf4j
public class MoveProcessor {
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final StageIndex index;
    private final MoveRequestQueue queue;
    private final StageStorage storage;
    private final Duration pollInterval;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdownSignal = new AtomicBoolean(false);
    private final Object progress = new Object();
    private long processedCount;
    private volatile ExecutorService worker;

    public MoveProcessor(StageIndex index, MoveRequestQueue queue, StageStorage storage, Duration pollInterval) {
        this.index = index;
        this.queue = queue;
        this.storage = storage;
        this.pollInterval = pollInterval;
    }

    /**
     * Launch the worker thread. Calling it again has no effect.
     */
    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        worker = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("move-processor-%d")
                .setDaemon(true)
                .build());
        worker.execute(this::run);
        log.info("Move processor started (queue capacity: {})", queue.getCapacity());
    }

    /**
     * Fire the shutdown signal. The worker finishes the request it is
     * applying and exits; anything still queued is abandoned.
     */
    @PreDestroy
    public void shutdown() {
        if (!shutdownSignal.compareAndSet(false, true)) {
            return;
        }
        queue.close();
        if (worker == null) {
            return;
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Move processor did not stop within {}", SHUTDOWN_WAIT);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
        log.info("Move processor stopped, {} queued requests abandoned", queue.pending());
    }

    public boolean isShutdown() {
        return shutdownSignal.get();
    }

    private void run() {
        while (!shutdownSignal.get()) {
            Optional<MoveRequest> next;
            try {
                next = queue.poll(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next.isEmpty()) {
                continue;
            }
            try {
                apply(next.get());
            } catch (RuntimeException e) {
                log.error("Unexpected error applying {}", next.get(), e);
            } finally {
                markProcessed();
            }
        }
        log.debug("Move processor loop exited");
    }

    /**
     * Apply one request: remove from the source stage, add to the
     * destination, then rename the file. A request whose item is no longer
     * in the source stage changes nothing. A failed rename is logged and
     * the index is left in its post-move state.
     */
    MoveOutcome apply(MoveRequest request) {
        long id = request.getItemId();
        if (!index.remove(request.getSource(), id)) {
            log.debug("Ignoring stale move, item {} not in {}: {}", id, request.getSource(), request);
            return MoveOutcome.STALE;
        }
        index.add(request.getDestination(), id);

        try {
            storage.move(id, request.getSource(), request.getDestination());
        } catch (IOException e) {
            log.error("Move failed: {} -> {}",
                    storage.itemPath(request.getSource(), id),
                    storage.itemPath(request.getDestination(), id), e);
            return MoveOutcome.STORAGE_FAILED;
        }
        log.debug("Moved item {} from {} to {}", id, request.getSource(), request.getDestination());
        return MoveOutcome.APPLIED;
    }

    private void markProcessed() {
        synchronized (progress) {
            processedCount++;
            progress.notifyAll();
        }
    }

    public long processedCount() {
        synchronized (progress) {
            return processedCount;
        }
    }

    /**
     * Wait until every request accepted by the queue so far has been applied.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long target = queue.acceptedCount();
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (progress) {
            while (processedCount < target) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    return false;
                }
                progress.wait(remaining);
            }
            return true;
        }
    }
}
