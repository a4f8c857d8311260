package com.phillippitts.frontdesk.service.reply;

import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.domain.ChatTurn;
import com.phillippitts.frontdesk.domain.RouteDecision;
import com.phillippitts.frontdesk.exception.ProviderTimeoutException;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.service.session.ConversationHistory;
import com.phillippitts.frontdesk.util.LogSanitizer;
import com.phillippitts.frontdesk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Streams a generated reply and hands each completed sentence to synthesis as soon as it exists.
 *
 * <p>The prompt is the session history followed by the caller's query, augmented with retrieved
 * passages for grounded routes. On completion only the raw query and the final reply text are
 * written back to history; a cancelled or failed turn leaves history untouched.
 *
 * <p>The token is checked on every fragment. Cancellation also resolves the wait at once, so the
 * caller never blocks on a stream nobody will hear. The wait is bounded by
 * {@code reply.generation-timeout}.
 */
@Component
public class ReplyStreamer {

    private static final Logger LOG = LogManager.getLogger(ReplyStreamer.class);
    private static final String PROVIDER = "reply-generator";

    private final ReplyGenerator generator;
    private final ReplyProperties properties;
    private final PipelineMetrics metrics;

    public ReplyStreamer(ReplyGenerator generator, ReplyProperties properties, PipelineMetrics metrics) {
        this.generator = generator;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Streams one reply, blocking until it completes, fails, times out or is cancelled.
     *
     * @param history      session history; updated on completion only
     * @param query        raw finalized caller text
     * @param decision     router decision; grounded decisions inject their passages
     * @param token        turn cancellation token
     * @param sentenceSink receives each completed sentence, in order
     */
    public ReplyOutcome stream(ConversationHistory history, String query, RouteDecision decision,
                               CancellationToken token, Consumer<String> sentenceSink) {
        long start = System.nanoTime();
        List<ChatTurn> prompt = new ArrayList<>(history.snapshot());
        prompt.add(ChatTurn.user(PromptFormatter.userTurn(query, decision, properties.getGroundingInstruction())));

        SentenceBuffer buffer = new SentenceBuffer();
        AtomicInteger emitted = new AtomicInteger();
        AtomicBoolean firstSentence = new AtomicBoolean(true);
        CompletableFuture<String> done = new CompletableFuture<>();
        token.onCancel(() -> done.cancel(false));

        Consumer<String> emit = sentence -> {
            if (token.isCancelled()) {
                return;
            }
            if (firstSentence.compareAndSet(true, false)) {
                metrics.recordFirstSentenceLatency(System.nanoTime() - start);
            }
            emitted.incrementAndGet();
            LOG.debug("Streaming sentence: '{}'", LogSanitizer.preview(sentence));
            sentenceSink.accept(sentence);
        };

        if (!done.isDone()) {
            try {
                generator.generate(prompt, new ReplyStreamListener() {
                    @Override
                    public void onFragment(String fragment) {
                        if (token.isCancelled() || done.isDone()) {
                            return;
                        }
                        buffer.append(fragment).forEach(emit);
                    }

                    @Override
                    public void onComplete(String fullText) {
                        if (token.isCancelled() || done.isDone()) {
                            return;
                        }
                        buffer.flush().ifPresent(emit);
                        done.complete(buffer.fullText().isEmpty() && fullText != null ? fullText : buffer.fullText());
                    }

                    @Override
                    public void onError(Throwable error) {
                        done.completeExceptionally(error);
                    }
                });
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        }

        ReplyOutcome outcome = await(done, token, emitted);
        metrics.recordGenerationLatency(System.nanoTime() - start, outcome.status().name().toLowerCase());
        if (outcome.status() == ReplyOutcome.Status.COMPLETED) {
            history.recordExchange(query, outcome.text());
            LOG.info("Reply complete in {}ms: {} sentences, '{}'", TimeUtils.elapsedMillis(start),
                    outcome.sentences(), LogSanitizer.preview(outcome.text()));
        }
        return outcome;
    }

    private ReplyOutcome await(CompletableFuture<String> done, CancellationToken token, AtomicInteger emitted) {
        Duration timeout = properties.getGenerationTimeout();
        try {
            String text = done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (token.isCancelled()) {
                return ReplyOutcome.cancelled(emitted.get());
            }
            return ReplyOutcome.completed(text, emitted.get());
        } catch (CancellationException e) {
            LOG.info("Reply cancelled for turn {} after {} sentences", token.turnId(), emitted.get());
            return ReplyOutcome.cancelled(emitted.get());
        } catch (TimeoutException e) {
            done.cancel(false);
            LOG.warn("Reply generation timed out after {}ms", timeout.toMillis());
            return ReplyOutcome.failed(emitted.get(), new ProviderTimeoutException(PROVIDER, timeout));
        } catch (ExecutionException e) {
            LOG.warn("Reply generation failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return ReplyOutcome.failed(emitted.get(), e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ReplyOutcome.cancelled(emitted.get());
        }
    }
}
