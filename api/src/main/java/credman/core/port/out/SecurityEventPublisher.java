package credman.core.port.out;

import credman.spi.SecurityEvent;

/**
 * Publishes security-relevant events to the configured handlers.
 */
public interface SecurityEventPublisher {

    /**
     * Publish an event. Must not block or throw.
     */
    void publish(SecurityEvent event);
}
