package com.gpuopt.application.notification;

import com.gpuopt.application.ports.NotificationSender;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget notifications. Callers never wait for delivery and never see its failures.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationSender sender;
    private final Executor executor;

    public NotificationDispatcher(NotificationSender sender, Executor executor) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void welcome(Customer customer) {
        dispatch(customer.email(),
                "Welcome to GPU Optimizer",
                "Your API key: " + customer.apiKey() + "\n"
                        + "Plan: " + customer.tier().code() + "\n"
                        + "Install the monitoring agent and pass this key to start tracking savings.");
    }

    public void upgrade(String email, SubscriptionTier tier) {
        dispatch(email,
                "GPU Optimizer plan upgraded",
                "Your account is now on the " + tier.code() + " plan.");
    }

    void dispatch(String to, String subject, String body) {
        try {
            executor.execute(() -> {
                try {
                    sender.send(to, subject, body);
                } catch (Exception e) {
                    log.warn("Notification '{}' to {} failed: {}", subject, to, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Notification '{}' to {} dropped: executor rejected", subject, to);
        }
    }
}
