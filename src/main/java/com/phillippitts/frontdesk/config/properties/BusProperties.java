package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Message bus between pipeline stages.
 *
 * <p>Example application.properties:
 * <pre>
 * bus.type=rabbit
 * bus.queue-prefix=frontdesk.
 * bus.prefetch=250
 * spring.rabbitmq.addresses=amqp://localhost
 * </pre>
 *
 * @param type        {@code rabbit} (broker, the default) or {@code in-process} (single node, no broker)
 * @param queuePrefix prepended to every pipeline queue name on the broker
 * @param prefetch    unacknowledged deliveries a queue consumer may hold
 */
@ConfigurationProperties(prefix = "bus")
@Validated
public record BusProperties(
        @NotBlank @DefaultValue("rabbit") String type,
        @DefaultValue("frontdesk.") String queuePrefix,
        @Min(1) @DefaultValue("250") int prefetch
) {
    public static BusProperties defaults() {
        return new BusProperties("rabbit", "frontdesk.", 250);
    }

    public String brokerQueue(String queueName) {
        return queuePrefix + queueName;
    }
}
