package com.gpuopt.infrastructure.notification;

import com.gpuopt.application.ports.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dev/default sender: writes notifications to the log instead of delivering them.
 */
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void send(String to, String subject, String body) {
        log.info("[NOTIFY] to={} subject={}\n{}", to, subject, body);
    }
}
