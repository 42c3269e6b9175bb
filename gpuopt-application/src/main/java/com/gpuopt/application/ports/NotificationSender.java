package com.gpuopt.application.ports;

/**
 * Outbound customer notifications (email in production, log in dev).
 * Implementations may throw; callers treat delivery as best effort.
 */
public interface NotificationSender {
    void send(String to, String subject, String body);
}
