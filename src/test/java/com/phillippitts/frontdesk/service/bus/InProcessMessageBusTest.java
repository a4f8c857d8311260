package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.domain.AudioClear;
import com.phillippitts.frontdesk.domain.TranscriptEvent;
import com.phillippitts.frontdesk.exception.MessageBusException;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class InProcessMessageBusTest {

    private SimpleMeterRegistry meterRegistry;
    private InProcessMessageBus bus;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        bus = new InProcessMessageBus(new SyncExecutor(), new PipelineMetrics(meterRegistry));
    }

    @Test
    void deliversToTheSubscribedConsumerAndAcks() {
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe(PipelineQueues.TRANSCRIPTS, event -> received.add(event.text()));

        bus.publish(PipelineQueues.TRANSCRIPTS, TranscriptEvent.finalized("s1", "hello"));

        assertThat(received).containsExactly("hello");
        assertThat(deliveries("transcripts", "ack")).isEqualTo(1.0);
    }

    @Test
    void publishWithoutConsumerFails() {
        assertThatThrownBy(() -> bus.publish(PipelineQueues.AUDIO_CLEAR, new AudioClear("s1", "barge-in")))
                .isInstanceOf(MessageBusException.class)
                .satisfies(e -> assertThat(((MessageBusException) e).getQueueName()).isEqualTo("audio-clear"));
    }

    @Test
    void secondConsumerOnSameQueueIsRejected() {
        bus.subscribe(PipelineQueues.AUDIO_CLEAR, clear -> { });

        assertThatThrownBy(() -> bus.subscribe(PipelineQueues.AUDIO_CLEAR, clear -> { }))
                .isInstanceOf(MessageBusException.class);
    }

    @Test
    void failingHandlerNacksWithoutRequeueAndKeepsConsuming() {
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe(PipelineQueues.TRANSCRIPTS, event -> {
            if (event.text().equals("bad")) {
                throw new IllegalStateException("handler bug");
            }
            received.add(event.text());
        });

        bus.publish(PipelineQueues.TRANSCRIPTS, TranscriptEvent.finalized("s1", "bad"));
        bus.publish(PipelineQueues.TRANSCRIPTS, TranscriptEvent.finalized("s1", "good"));

        assertThat(received).containsExactly("good");
        assertThat(deliveries("transcripts", "nack")).isEqualTo(1.0);
        assertThat(deliveries("transcripts", "ack")).isEqualTo(1.0);
    }

    @Test
    void handlerSeesSessionAndQueueInThreadContext() {
        List<String> context = new CopyOnWriteArrayList<>();
        bus.subscribe(PipelineQueues.AUDIO_CLEAR, clear -> {
            context.add(ThreadContext.get("sessionId"));
            context.add(ThreadContext.get("queue"));
        });

        bus.publish(PipelineQueues.AUDIO_CLEAR, new AudioClear("s42", "barge-in"));

        assertThat(context).containsExactly("s42", "audio-clear");
        assertThat(ThreadContext.get("sessionId")).isNull();
        assertThat(ThreadContext.get("queue")).isNull();
    }

    @Test
    void shutdownRejectsFurtherWork() {
        bus.subscribe(PipelineQueues.AUDIO_CLEAR, clear -> { });

        bus.shutdown();

        assertThatThrownBy(() -> bus.publish(PipelineQueues.AUDIO_CLEAR, new AudioClear("s1", "x")))
                .isInstanceOf(MessageBusException.class);
        assertThatThrownBy(() -> bus.subscribe(PipelineQueues.TRANSCRIPTS, e -> { }))
                .isInstanceOf(MessageBusException.class);
    }

    @Test
    void preservesPerSessionOrderOnAPool() {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            InProcessMessageBus pooled = new InProcessMessageBus(pool, new PipelineMetrics(new SimpleMeterRegistry()));
            List<String> a = new CopyOnWriteArrayList<>();
            List<String> b = new CopyOnWriteArrayList<>();
            pooled.subscribe(PipelineQueues.TRANSCRIPTS, event ->
                    (event.sessionId().equals("a") ? a : b).add(event.text()));

            for (int i = 0; i < 100; i++) {
                pooled.publish(PipelineQueues.TRANSCRIPTS, TranscriptEvent.interim("a", "a" + i));
                pooled.publish(PipelineQueues.TRANSCRIPTS, TranscriptEvent.interim("b", "b" + i));
            }

            await().atMost(Duration.ofSeconds(5)).until(() -> a.size() == 100 && b.size() == 100);
            for (int i = 0; i < 100; i++) {
                assertThat(a.get(i)).isEqualTo("a" + i);
                assertThat(b.get(i)).isEqualTo("b" + i);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private double deliveries(String queue, String result) {
        return meterRegistry.counter("frontdesk.bus.deliveries", "queue", queue, "result", result).count();
    }
}
