package credman.spi;

/**
 * SPI for handling security events.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records events as Micrometer counters (priority 10)</li>
 * </ul>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/credman.spi.SecurityEventHandler}
 */
public interface SecurityEventHandler {

    /**
     * Returns the unique name of this handler.
     */
    String name();

    /**
     * Returns the priority of this handler. Higher priority handlers run first.
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive events.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a security event.
     *
     * <p>Implementations should catch and log their own failures so other
     * handlers still see the event.
     *
     * @param event the security event to handle
     */
    void handle(SecurityEvent event);
}
