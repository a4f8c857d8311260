package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.domain.SessionMessage;
import com.phillippitts.frontdesk.exception.MessageBusException;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * In-process message bus backed by the pipeline executor, for a single node without a broker
 * ({@code bus.type=in-process}).
 *
 * <p>Delivery is serialized per queue and session, so a long-running generation never blocks the
 * same session's transcripts or audio. A handler that returns acknowledges the message; a handler
 * that throws negatively acknowledges it and the message is dropped (no requeue).
 *
 * <p>Each delivery runs with {@code sessionId} and {@code queue} in the Log4j2 ThreadContext.
 */
@Component
@ConditionalOnProperty(prefix = "bus", name = "type", havingValue = "in-process")
public class InProcessMessageBus implements MessageBus {

    private static final Logger LOG = LogManager.getLogger(InProcessMessageBus.class);

    private final KeyedSerialExecutor serialExecutor;
    private final PipelineMetrics metrics;
    private final Map<String, MessageHandler<?>> consumers = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public InProcessMessageBus(@Qualifier("pipelineExecutor") Executor pipelineExecutor, PipelineMetrics metrics) {
        this.serialExecutor = new KeyedSerialExecutor(pipelineExecutor);
        this.metrics = metrics;
    }

    @Override
    public <T extends SessionMessage> void subscribe(BusQueue<T> queue, MessageHandler<T> handler) {
        if (shutdown) {
            throw new MessageBusException("Message bus is shut down", queue.name());
        }
        if (consumers.putIfAbsent(queue.name(), handler) != null) {
            throw new MessageBusException("Queue already has a consumer", queue.name());
        }
        LOG.info("Consumer registered on queue {}", queue.name());
    }

    @Override
    public <T extends SessionMessage> void publish(BusQueue<T> queue, T message) {
        if (shutdown) {
            throw new MessageBusException("Message bus is shut down", queue.name());
        }
        @SuppressWarnings("unchecked")
        MessageHandler<T> handler = (MessageHandler<T>) consumers.get(queue.name());
        if (handler == null) {
            throw new MessageBusException("No consumer registered", queue.name());
        }
        serialExecutor.execute(queue.name() + '|' + message.sessionId(),
                () -> HandlerInvoker.invoke(queue, handler, message, metrics));
    }

    @PreDestroy
    void shutdown() {
        shutdown = true;
        LOG.info("Message bus shut down; in-flight sessions={}", serialExecutor.activeKeys());
    }
}
