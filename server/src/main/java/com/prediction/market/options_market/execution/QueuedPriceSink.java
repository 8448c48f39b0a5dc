package com.prediction.market.options_market.execution;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.prediction.market.options_market.engine.PriceSink;
import com.prediction.market.options_market.entity.PricePoint;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a slow {@link PriceSink} on its own thread so the simulation never
 * waits for it. Points are delivered in order; when the queue is full the
 * newest point is dropped.
 */
@Slf4j
public class QueuedPriceSink implements PriceSink, AutoCloseable {

    private static final long CLOSE_TIMEOUT_MS = 2000;

    private final PriceSink delegate;
    private final String name;
    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();

    public QueuedPriceSink(String name, PriceSink delegate, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be >= 1: " + capacity);
        }
        this.name = name;
        this.delegate = delegate;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(capacity), r -> {
                Thread thread = new Thread(r, "price-sink-" + name);
                thread.setDaemon(true);
                return thread;
            }, new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void onPrice(PricePoint point) {
        try {
            executor.execute(() -> deliver(point));
        } catch (RejectedExecutionException e) {
            long total = dropped.incrementAndGet();
            if (executor.isShutdown()) {
                log.debug("Sink {} closed, dropping point {}", name, point.getSequenceIndex());
            } else {
                log.warn("Sink {} queue full, dropping point {} (dropped={})", name, point.getSequenceIndex(), total);
            }
        }
    }

    private void deliver(PricePoint point) {
        try {
            delegate.onPrice(point);
        } catch (RuntimeException e) {
            log.error("Sink {} failed on point {}", name, point.getSequenceIndex(), e);
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueuedCount() {
        return executor.getQueue().size();
    }

    /**
     * Delivers what is queued, waiting up to two seconds, then stops the thread.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Sink {} did not drain within {}ms, {} points discarded", name, CLOSE_TIMEOUT_MS,
                    executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
