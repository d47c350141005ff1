package com.agentflow.core.spi;

/**
 * Delivers notifications to a channel (desktop, chat, ...).
 */
public interface NotificationRouter {

    void send(Notification notification);
}
