package com.ryuqq.workflow.core.spi;

import java.util.Map;

/**
 * Notification SPI.
 *
 * <p>The core supplies only a template key and parameters; rendering, localization and channel
 * delivery are the collaborator's concern.</p>
 *
 * <p><strong>Failure signalling:</strong> throw {@link NotificationDeliveryException}.
 * A permanent failure (e.g. unknown recipient) is not retried; anything else is retried per the
 * {@code notification-dispatch} policy.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface NotificationDispatcher {

    /**
     * Requests delivery of a notification.
     *
     * @param recipientId the recipient ({@code role:<code>} for a stage, or an actor id)
     * @param templateKey the template key (e.g. {@code request.assigned})
     * @param parameters template parameters
     * @throws NotificationDeliveryException if delivery fails
     */
    void dispatch(String recipientId, String templateKey, Map<String, String> parameters);
}
