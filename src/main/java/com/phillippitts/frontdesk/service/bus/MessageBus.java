package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.domain.SessionMessage;
import com.phillippitts.frontdesk.exception.MessageBusException;

/**
 * Named asynchronous queues between pipeline stages.
 *
 * <p>Each queue has exactly one logical consumer. Messages for one session are delivered in
 * publish order; messages for different sessions are delivered concurrently.
 */
public interface MessageBus {

    /**
     * Registers the consumer of a queue.
     *
     * @throws MessageBusException if the queue already has a consumer or the bus is shut down
     */
    <T extends SessionMessage> void subscribe(BusQueue<T> queue, MessageHandler<T> handler);

    /**
     * Publishes a message for asynchronous delivery.
     *
     * @throws MessageBusException if the queue has no consumer or the bus is shut down
     */
    <T extends SessionMessage> void publish(BusQueue<T> queue, T message);
}
