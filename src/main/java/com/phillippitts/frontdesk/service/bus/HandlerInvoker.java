package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.domain.SessionMessage;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

/**
 * Runs a queue consumer on one message with {@code sessionId} and {@code queue} in the Log4j2
 * ThreadContext, and records the delivery result.
 */
final class HandlerInvoker {

    private static final Logger LOG = LogManager.getLogger(HandlerInvoker.class);

    private HandlerInvoker() {}

    /**
     * @return true to acknowledge, false to reject without requeue
     */
    static <T extends SessionMessage> boolean invoke(BusQueue<T> queue, MessageHandler<T> handler, T message,
                                                     PipelineMetrics metrics) {
        ThreadContext.put("sessionId", message.sessionId());
        ThreadContext.put("queue", queue.name());
        try {
            handler.handle(message);
            metrics.recordDelivery(queue.name(), true);
            LOG.debug("Acked {} on {}", message.getClass().getSimpleName(), queue.name());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordDelivery(queue.name(), false);
            LOG.warn("Interrupted while handling {} on {}; nacked", message.getClass().getSimpleName(), queue.name());
            return false;
        } catch (Exception e) {
            metrics.recordDelivery(queue.name(), false);
            LOG.error("Handler failed on {}; nacked without requeue", queue.name(), e);
            return false;
        } finally {
            ThreadContext.remove("queue");
            ThreadContext.remove("sessionId");
        }
    }
}
