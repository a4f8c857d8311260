package com.phillippitts.frontdesk.service.bus;

/**
 * Consumer of one queue. Returning normally acknowledges the message; throwing
 * negatively acknowledges it without requeue.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void handle(T message) throws Exception;
}
