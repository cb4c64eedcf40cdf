package com.framecap.framecap.service.consumer;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.service.pool.FrameQueue;

import jakarta.annotation.PreDestroy;

/**
 * Single-threaded consumer stage.
 *
 * Subclasses only implement {@link #process}; the buffer is released downstream
 * afterwards even if processing fails.
 */
public abstract class AbstractConsumerStage implements ConsumerStage {

    private static final Logger logger = LoggerFactory.getLogger(AbstractConsumerStage.class);

    private final String name;
    private final ExecutorService executor;
    private final AtomicInteger held = new AtomicInteger();
    private final AtomicLong processed = new AtomicLong();
    private volatile FrameSink downstream;

    protected AbstractConsumerStage(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("stage-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Work on the buffer contents. Runs on the stage thread.
     */
    protected abstract void process(FrameBuffer buffer, FrameInfo frameInfo);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setDownstream(FrameSink downstream) {
        this.downstream = downstream;
    }

    @Override
    public void accept(FrameBuffer buffer, FrameInfo frameInfo) {
        held.incrementAndGet();
        try {
            executor.execute(() -> handle(buffer, frameInfo));
        } catch (RejectedExecutionException e) {
            logger.warn("Stage {} is shut down, passing frame {} through", name, frameInfo.getSequenceId());
            release(buffer);
        }
    }

    @Override
    public void pullFrom(FrameQueue completed) {
        try {
            executor.execute(() -> {
                FrameBuffer buffer = completed.pop();
                if (buffer != null) {
                    held.incrementAndGet();
                    handle(buffer, buffer.getFrameInfo());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Stage {} is shut down, frame left in completed queue", name);
        }
    }

    @Override
    public void release(FrameBuffer buffer) {
        FrameSink next = downstream;
        if (next == null) {
            throw new IllegalStateException("Stage " + name + " has no downstream sink");
        }
        held.decrementAndGet();
        next.accept(buffer, buffer.getFrameInfo());
    }

    @Override
    public int heldCount() {
        return held.get();
    }

    @Override
    public boolean awaitIdle(long timeoutMs) {
        try {
            Future<?> marker = executor.submit(() -> { });
            marker.get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            return true;
        } catch (TimeoutException e) {
            logger.warn("Stage {} still busy after {} ms", name, timeoutMs);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    /**
     * Run a task on the stage thread, ordered with the frames already queued
     */
    protected void executeOnStage(Runnable task) {
        executor.execute(task);
    }

    public long getProcessedCount() {
        return processed.get();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Stage {} did not terminate in time", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        logger.info("Stage {} stopped", name);
    }

    private void handle(FrameBuffer buffer, FrameInfo frameInfo) {
        try {
            process(buffer, frameInfo);
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            logger.error("Stage {} failed on frame {}: {}", name, frameInfo.getSequenceId(), e.getMessage(), e);
        } finally {
            release(buffer);
        }
    }
}
