package com.phillippitts.frontdesk.service.metrics;

import com.phillippitts.frontdesk.domain.ConfidenceTier;
import com.phillippitts.frontdesk.service.events.TurnCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the call pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Turn outcomes and router tiers</li>
 *   <li>Generation latency and time to first sentence</li>
 *   <li>Playback chunks, throttling and clears</li>
 *   <li>Barge-in triggers</li>
 *   <li>Queue acknowledgements and provider failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under the {@code frontdesk.} prefix.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "frontdesk";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts the terminal outcome of each turn.
     */
    @EventListener
    public void onTurnCompleted(TurnCompletedEvent event) {
        Counter.builder(METRIC_PREFIX + ".turn.outcome")
                .description("Number of turns by terminal outcome")
                .tag("outcome", event.outcome().name().toLowerCase())
                .tag("tier", event.tier().name().toLowerCase())
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".turn.duration")
                .description("Time from request to terminal outcome")
                .tag("outcome", event.outcome().name().toLowerCase())
                .register(registry)
                .record(event.durationMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Records which tier the router picked and whether it queried the knowledge base.
     */
    public void recordRoute(ConfidenceTier tier, boolean retrievalPerformed) {
        Counter.builder(METRIC_PREFIX + ".route")
                .description("Router decisions by tier")
                .tag("tier", tier.name().toLowerCase())
                .tag("retrieval", Boolean.toString(retrievalPerformed))
                .register(registry)
                .increment();
    }

    /**
     * Records reply generation latency.
     *
     * @param status terminal status of the stream (completed, cancelled, failed)
     */
    public void recordGenerationLatency(long durationNanos, String status) {
        Timer.builder(METRIC_PREFIX + ".generation.latency")
                .description("Time to stream a full reply")
                .tag("status", status)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordFirstSentenceLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".generation.first-sentence")
                .description("Time from request to the first complete sentence")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordSynthesisLatency(long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time to synthesize one sentence")
                .tag("success", Boolean.toString(success))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementChunksSent() {
        Counter.builder(METRIC_PREFIX + ".playback.chunks")
                .description("Audio chunks sent to the carrier")
                .register(registry)
                .increment();
    }

    public void incrementThrottled() {
        Counter.builder(METRIC_PREFIX + ".playback.throttled")
                .description("Chunks delayed by backpressure")
                .register(registry)
                .increment();
    }

    /**
     * Records a playback clear and how many queued items it dropped.
     */
    public void recordPlaybackCleared(String reason, int droppedItems) {
        Counter.builder(METRIC_PREFIX + ".playback.clears")
                .description("Playback clears by reason")
                .tag("reason", reason)
                .register(registry)
                .increment();
        DistributionSummary.builder(METRIC_PREFIX + ".playback.dropped")
                .description("Queued audio items dropped per clear")
                .register(registry)
                .record(droppedItems);
    }

    public void incrementBargeIn() {
        Counter.builder(METRIC_PREFIX + ".bargein.triggers")
                .description("Barge-in triggers")
                .register(registry)
                .increment();
    }

    /**
     * Records a message delivery result on a pipeline queue.
     *
     * @param queue queue name
     * @param acked true for ack, false for nack without requeue
     */
    public void recordDelivery(String queue, boolean acked) {
        Counter.builder(METRIC_PREFIX + ".bus.deliveries")
                .description("Queue deliveries by result")
                .tag("queue", queue)
                .tag("result", acked ? "ack" : "nack")
                .register(registry)
                .increment();
    }

    public void incrementProviderFailure(String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".provider.failures")
                .description("Provider failures by provider and reason")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
