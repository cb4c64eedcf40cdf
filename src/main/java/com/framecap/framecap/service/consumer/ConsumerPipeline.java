package com.framecap.framecap.service.consumer;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.service.pool.FrameBufferPool;

/**
 * Chains consumer stages for one session: each stage releases into the next one,
 * the last releases into the pool's recycled queue.
 */
public class ConsumerPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerPipeline.class);

    private final FrameBufferPool pool;
    private final List<ConsumerStage> stages;

    public ConsumerPipeline(FrameBufferPool pool, List<? extends ConsumerStage> stages) {
        this.pool = pool;
        this.stages = List.copyOf(stages);

        for (int i = 0; i < this.stages.size(); i++) {
            FrameSink next = (i + 1 < this.stages.size())
                    ? this.stages.get(i + 1)
                    : (buffer, frameInfo) -> pool.recycle(buffer);
            this.stages.get(i).setDownstream(next);
        }

        logger.info("Consumer pipeline: {}", describe());
    }

    /**
     * A buffer is waiting in the completed queue
     */
    public void frameReady() {
        if (stages.isEmpty()) {
            FrameBuffer buffer = pool.completed().pop();
            if (buffer != null) {
                pool.recycle(buffer);
            }
            return;
        }
        stages.get(0).pullFrom(pool.completed());
    }

    /**
     * Wait for every stage, in chain order, to finish what it has been given
     *
     * @return false if a stage did not become idle in time
     */
    public boolean awaitIdle(long timeoutMs) {
        boolean idle = true;
        for (ConsumerStage stage : stages) {
            idle &= stage.awaitIdle(timeoutMs);
        }
        return idle;
    }

    /**
     * Buffers currently accepted by a stage and not yet released
     */
    public int heldCount() {
        int held = 0;
        for (ConsumerStage stage : stages) {
            held += stage.heldCount();
        }
        return held;
    }

    private String describe() {
        StringBuilder sb = new StringBuilder("completed");
        for (ConsumerStage stage : stages) {
            sb.append(" -> ").append(stage.getName());
        }
        return sb.append(" -> recycled").toString();
    }
}
