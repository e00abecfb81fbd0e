package com.ryuqq.workflow.core.spi;

/**
 * Thrown by {@link NotificationDispatcher} when delivery fails.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class NotificationDeliveryException extends RuntimeException {

    private final boolean permanent;

    public NotificationDeliveryException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public NotificationDeliveryException(String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    /**
     * @return true if retrying cannot succeed
     */
    public boolean isPermanent() {
        return permanent;
    }
}
