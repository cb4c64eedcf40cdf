package com.framecap.framecap.service.consumer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.framecap.framecap.model.FrameBuffer;
import com.framecap.framecap.model.FrameInfo;
import com.framecap.framecap.model.FrameStatus;
import com.framecap.framecap.service.pool.FrameBufferPool;

class ConsumerPipelineTest {

    private final List<String> trace = new CopyOnWriteArrayList<>();
    private final List<AbstractConsumerStage> stages = new ArrayList<>();
    private FrameBufferPool pool;

    private class RecordingStage extends AbstractConsumerStage {
        volatile boolean fail;
        volatile CountDownLatch gate;

        RecordingStage(String name) {
            super(name);
            stages.add(this);
        }

        @Override
        protected void process(FrameBuffer buffer, FrameInfo frameInfo) {
            CountDownLatch g = gate;
            if (g != null) {
                try {
                    g.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            trace.add(getName() + ":" + frameInfo.getSequenceId());
            if (fail) {
                throw new IllegalStateException("boom");
            }
        }
    }

    @BeforeEach
    void setUp() {
        pool = FrameBufferPool.allocate(3, 16);
    }

    @AfterEach
    void tearDown() {
        stages.forEach(AbstractConsumerStage::shutdown);
    }

    private void completeFrame(long sequenceId) {
        FrameBuffer buffer = pool.recycled().pop();
        FrameInfo info = FrameInfo.builder().sequenceId(sequenceId).status(FrameStatus.OK).build();
        buffer.setSequenceId(sequenceId);
        buffer.setFrameInfo(info);
        pool.completed().push(buffer);
    }

    @Test
    void frameReady_PassesThroughEveryStageThenRecycles() {
        RecordingStage first = new RecordingStage("first");
        RecordingStage second = new RecordingStage("second");
        ConsumerPipeline pipeline = new ConsumerPipeline(pool, List.of(first, second));

        completeFrame(1);
        pipeline.frameReady();
        completeFrame(2);
        pipeline.frameReady();

        assertThat(pipeline.awaitIdle(5000)).isTrue();
        assertThat(trace).containsSubsequence("first:1", "second:1");
        assertThat(trace).containsSubsequence("first:2", "second:2");
        assertThat(trace.stream().filter(s -> s.startsWith("first"))).containsExactly("first:1", "first:2");
        assertThat(pool.recycled().size()).isEqualTo(3);
        assertThat(pipeline.heldCount()).isZero();
        assertThat(first.getProcessedCount()).isEqualTo(2);
    }

    @Test
    void failingStage_StillReleasesDownstream() {
        RecordingStage first = new RecordingStage("first");
        RecordingStage second = new RecordingStage("second");
        first.fail = true;
        ConsumerPipeline pipeline = new ConsumerPipeline(pool, List.of(first, second));

        completeFrame(7);
        pipeline.frameReady();

        assertThat(pipeline.awaitIdle(5000)).isTrue();
        assertThat(trace).containsExactly("first:7", "second:7");
        assertThat(pool.recycled().size()).isEqualTo(3);
        assertThat(first.getProcessedCount()).isZero();
    }

    @Test
    void slowStage_HoldsBufferUntilDone() throws Exception {
        RecordingStage slow = new RecordingStage("slow");
        CountDownLatch gate = new CountDownLatch(1);
        slow.gate = gate;
        ConsumerPipeline pipeline = new ConsumerPipeline(pool, List.of(slow));

        completeFrame(1);
        pipeline.frameReady();

        long deadline = System.currentTimeMillis() + 5000;
        while ((pool.snapshot().getHeld() == 0 || pipeline.heldCount() == 0) && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(pool.snapshot().getHeld()).isEqualTo(1);
        assertThat(pipeline.heldCount()).isEqualTo(1);
        assertThatPoolReleaseIsRefused();

        gate.countDown();
        assertThat(pipeline.awaitIdle(5000)).isTrue();
        assertThat(pool.recycled().size()).isEqualTo(3);
        pool.release();
        assertThat(pool.isReleased()).isTrue();
    }

    private void assertThatPoolReleaseIsRefused() {
        boolean refused = false;
        try {
            pool.release();
        } catch (RuntimeException e) {
            refused = true;
        }
        assertThat(refused).isTrue();
    }

    @Test
    void noStages_RecyclesDirectly() {
        ConsumerPipeline pipeline = new ConsumerPipeline(pool, List.of());

        completeFrame(1);
        pipeline.frameReady();

        assertThat(pool.recycled().size()).isEqualTo(3);
        assertThat(pool.completed().isEmpty()).isTrue();
    }

    @Test
    void shutDownStage_PassesFramesThrough() {
        RecordingStage first = new RecordingStage("first");
        RecordingStage second = new RecordingStage("second");
        ConsumerPipeline pipeline = new ConsumerPipeline(pool, List.of(first, second));
        second.shutdown();

        completeFrame(1);
        pipeline.frameReady();

        assertThat(first.awaitIdle(5000)).isTrue();
        assertThat(trace).containsExactly("first:1");
        assertThat(pool.recycled().size()).isEqualTo(3);
    }
}
