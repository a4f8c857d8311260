package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.domain.SessionMessage;

import java.util.Objects;

/**
 * Typed descriptor of a named pipeline queue.
 *
 * @param name queue name, used in logs and metrics
 * @param type message type carried on the queue
 * @param <T>  message type
 */
public record BusQueue<T extends SessionMessage>(String name, Class<T> type) {

    public BusQueue {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
