package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.config.properties.BusProperties;
import com.phillippitts.frontdesk.domain.SessionMessage;
import com.phillippitts.frontdesk.exception.MessageBusException;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.rabbitmq.client.Channel;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Message bus on a RabbitMQ broker, the default ({@code bus.type=rabbit}).
 *
 * <p>Every pipeline queue is declared non-durable under {@code bus.queue-prefix} and consumed by one
 * listener container with manual acknowledgement. Messages travel as JSON ({@link BusMessageCodec}).
 * The broker keeps per-queue order; deliveries are then handed to the pipeline executor serialized
 * per queue and session, as in the in-process bus, and acked when the handler returns. A handler that
 * throws, or a body that cannot be decoded, is rejected without requeue.
 *
 * <p>A broker that cannot be reached while subscribing raises {@link MessageBusException}, which
 * stops the application during startup.
 */
@Component
@ConditionalOnProperty(prefix = "bus", name = "type", havingValue = "rabbit", matchIfMissing = true)
public class RabbitMessageBus implements MessageBus {

    private static final Logger LOG = LogManager.getLogger(RabbitMessageBus.class);

    private final ConnectionFactory connectionFactory;
    private final RabbitTemplate rabbitTemplate;
    private final AmqpAdmin amqpAdmin;
    private final BusMessageCodec codec;
    private final BusProperties properties;
    private final KeyedSerialExecutor serialExecutor;
    private final PipelineMetrics metrics;
    private final Map<String, MessageListenerContainer> containers = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public RabbitMessageBus(ConnectionFactory connectionFactory,
                            RabbitTemplate rabbitTemplate,
                            AmqpAdmin amqpAdmin,
                            BusMessageCodec codec,
                            BusProperties properties,
                            @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                            PipelineMetrics metrics) {
        this.connectionFactory = connectionFactory;
        this.rabbitTemplate = rabbitTemplate;
        this.amqpAdmin = amqpAdmin;
        this.codec = codec;
        this.properties = properties;
        this.serialExecutor = new KeyedSerialExecutor(pipelineExecutor);
        this.metrics = metrics;
    }

    @Override
    public synchronized <T extends SessionMessage> void subscribe(BusQueue<T> queue, MessageHandler<T> handler) {
        if (shutdown) {
            throw new MessageBusException("Message bus is shut down", queue.name());
        }
        if (containers.containsKey(queue.name())) {
            throw new MessageBusException("Queue already has a consumer", queue.name());
        }
        String brokerQueue = properties.brokerQueue(queue.name());
        String declared;
        try {
            declared = amqpAdmin.declareQueue(new Queue(brokerQueue, false, false, false));
        } catch (AmqpException e) {
            throw new MessageBusException("Broker unreachable while declaring queue", queue.name(), e);
        }
        if (declared == null) {
            throw new MessageBusException("Broker did not declare queue " + brokerQueue, queue.name());
        }
        ChannelAwareMessageListener listener = (message, channel) -> dispatch(queue, handler, message, channel);
        containers.put(queue.name(), startContainer(brokerQueue, listener));
        LOG.info("Consumer registered on broker queue {}", brokerQueue);
    }

    @Override
    public <T extends SessionMessage> void publish(BusQueue<T> queue, T message) {
        if (shutdown) {
            throw new MessageBusException("Message bus is shut down", queue.name());
        }
        if (!containers.containsKey(queue.name())) {
            throw new MessageBusException("No consumer registered", queue.name());
        }
        Message amqpMessage = MessageBuilder.withBody(codec.encode(message))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setHeader("sessionId", message.sessionId())
                .build();
        try {
            rabbitTemplate.send("", properties.brokerQueue(queue.name()), amqpMessage);
        } catch (AmqpException e) {
            throw new MessageBusException("Publish to broker failed", queue.name(), e);
        }
    }

    /**
     * Creates and starts the listener container of one broker queue.
     */
    protected MessageListenerContainer startContainer(String brokerQueue, ChannelAwareMessageListener listener) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(brokerQueue);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setPrefetchCount(properties.prefetch());
        container.setDefaultRequeueRejected(false);
        container.setMessageListener(listener);
        container.start();
        return container;
    }

    private <T extends SessionMessage> void dispatch(BusQueue<T> queue, MessageHandler<T> handler,
                                                     Message amqpMessage, Channel channel) {
        long deliveryTag = amqpMessage.getMessageProperties().getDeliveryTag();
        T message;
        try {
            message = codec.decode(queue, amqpMessage.getBody());
        } catch (RuntimeException e) {
            metrics.recordDelivery(queue.name(), false);
            LOG.error("Undecodable message on {}; rejected without requeue", queue.name(), e);
            settle(channel, deliveryTag, false, queue);
            return;
        }
        serialExecutor.execute(queue.name() + '|' + message.sessionId(), () -> {
            boolean acked = HandlerInvoker.invoke(queue, handler, message, metrics);
            settle(channel, deliveryTag, acked, queue);
        });
    }

    private static void settle(Channel channel, long deliveryTag, boolean ack, BusQueue<?> queue) {
        // acks arrive from pipeline workers; a channel must not be used by two threads at once
        synchronized (channel) {
            try {
                if (ack) {
                    channel.basicAck(deliveryTag, false);
                } else {
                    channel.basicNack(deliveryTag, false, false);
                }
            } catch (IOException e) {
                LOG.warn("Could not settle delivery {} on {}: {}", deliveryTag, queue.name(), e.getMessage());
            }
        }
    }

    @PreDestroy
    void shutdown() {
        shutdown = true;
        containers.values().forEach(MessageListenerContainer::stop);
        LOG.info("Message bus shut down; {} consumers stopped, in-flight sessions={}",
                containers.size(), serialExecutor.activeKeys());
    }
}
