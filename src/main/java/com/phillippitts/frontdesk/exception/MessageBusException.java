package com.phillippitts.frontdesk.exception;

/**
 * Thrown when the message bus cannot accept a subscription or a message.
 * Raised during startup wiring this is fatal and stops the application context.
 */
public class MessageBusException extends FrontDeskException {

    private final String queueName;

    public MessageBusException(String message, String queueName) {
        super(message + " (queue: " + queueName + ")");
        this.queueName = queueName;
    }

    public MessageBusException(String message, String queueName, Throwable cause) {
        super(message + " (queue: " + queueName + ")", cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
