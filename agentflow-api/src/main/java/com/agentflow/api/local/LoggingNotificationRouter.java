package com.agentflow.api.local;

import com.agentflow.core.spi.Notification;
import com.agentflow.core.spi.NotificationRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to a dedicated logger. Any channel is accepted.
 */
public class LoggingNotificationRouter implements NotificationRouter {

    private static final Logger log = LoggerFactory.getLogger("agentflow.notifications");

    @Override
    public void send(Notification notification) {
        log.info("[{}] {}: {} (task {})", notification.channel(), notification.title(),
            notification.body(), notification.taskId());
    }
}
