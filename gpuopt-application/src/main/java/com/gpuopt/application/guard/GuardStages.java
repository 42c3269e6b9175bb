package com.gpuopt.application.guard;

import com.gpuopt.application.catalog.TierCatalog;
import com.gpuopt.domain.AccessDeniedException;
import com.gpuopt.domain.DomainException;
import com.gpuopt.domain.RateLimitedException;
import com.gpuopt.domain.model.Customer;

import java.time.Duration;

/**
 * Stock stages built on {@link AccessGuard}.
 */
public final class GuardStages {

    /** Window of the per-key tier quota. */
    public static final Duration TIER_WINDOW = Duration.ofHours(1);

    private GuardStages() {}

    public static GuardStage blockedIp(AccessGuard guard) {
        return ctx -> guard.isBlocked(ctx.ip())
                ? GuardDecision.reject(new AccessDeniedException("IP address is blocked"))
                : GuardDecision.proceed();
    }

    public static GuardStage ipRateLimit(AccessGuard guard, int limit, Duration window) {
        return ctx -> guard.checkRateLimit("ip:" + ctx.ip(), limit, window)
                ? GuardDecision.proceed()
                : GuardDecision.reject(new RateLimitedException("Too many requests from this address"));
    }

    /** Resolves the customer behind the API key and attaches it to the context. */
    public static GuardStage apiKey(AccessGuard guard) {
        return ctx -> {
            try {
                Customer c = guard.authenticateCustomer(ctx.authorizationHeader(), ctx.bodyApiKey());
                ctx.authenticated(c);
                return GuardDecision.proceed();
            } catch (DomainException e) {
                return GuardDecision.reject(e);
            }
        };
    }

    /** Hourly quota of the customer's tier; must run after {@link #apiKey}. */
    public static GuardStage tierRateLimit(AccessGuard guard) {
        return ctx -> {
            Customer c = ctx.customer().orElse(null);
            if (c == null) return GuardDecision.proceed();
            int limit = TierCatalog.limits(c.tier()).requestsPerHour();
            return guard.checkRateLimit("key:" + c.apiKey(), limit, TIER_WINDOW)
                    ? GuardDecision.proceed()
                    : GuardDecision.reject(new RateLimitedException(
                            "Rate limit exceeded for " + c.tier().code() + " tier"));
        };
    }
}
