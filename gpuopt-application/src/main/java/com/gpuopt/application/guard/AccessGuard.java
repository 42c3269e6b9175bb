package com.gpuopt.application.guard;

import com.gpuopt.application.identity.ApiKeyGenerator;
import com.gpuopt.application.identity.IdentityStore;
import com.gpuopt.application.ports.BlockedIpRepository;
import com.gpuopt.domain.UnauthorizedException;
import com.gpuopt.domain.ValidationException;
import com.gpuopt.domain.model.BlockedIp;
import com.gpuopt.domain.model.Customer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * API-key checks, request quotas and the IP block list.
 *
 * The block list lives in memory and is written through to storage; {@link #reloadBlockList()}
 * rebuilds it from storage at startup.
 */
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);
    private static final Logger security = LoggerFactory.getLogger("security");

    private static final String BEARER = "Bearer ";

    private final IdentityStore identities;
    private final RateLimiter rateLimiter;
    private final BlockedIpRepository blockedIps;
    private final Clock clock;
    private final Map<String, BlockedIp> blockList = new ConcurrentHashMap<>();

    public AccessGuard(IdentityStore identities, RateLimiter rateLimiter, BlockedIpRepository blockedIps, Clock clock) {
        this.identities = Objects.requireNonNull(identities, "identities");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.blockedIps = Objects.requireNonNull(blockedIps, "blockedIps");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Extracts the API key. A {@code Bearer} header wins over a key in the body.
     *
     * @return a well-formed key (existence is not checked here)
     * @throws UnauthorizedException when the key is missing or malformed
     */
    public String authenticate(String authorizationHeader, String bodyApiKey) {
        String key = null;
        if (authorizationHeader != null && authorizationHeader.startsWith(BEARER)) {
            key = authorizationHeader.substring(BEARER.length()).trim();
        } else if (bodyApiKey != null && !bodyApiKey.isBlank()) {
            key = bodyApiKey.trim();
        }

        if (key == null || key.isEmpty()) {
            security.warn("Request without API key");
            throw new UnauthorizedException("API key required");
        }
        if (!ApiKeyGenerator.isWellFormed(key)) {
            security.warn("Malformed API key: {}", ApiKeyGenerator.mask(key));
            throw new UnauthorizedException("Invalid API key format");
        }
        return key;
    }

    /**
     * {@link #authenticate} plus lookup of the owning customer.
     */
    public Customer authenticateCustomer(String authorizationHeader, String bodyApiKey) {
        String key = authenticate(authorizationHeader, bodyApiKey);
        return identities.getByApiKey(key).orElseThrow(() -> {
            security.warn("Unknown API key: {}", ApiKeyGenerator.mask(key));
            return new UnauthorizedException("Invalid API key");
        });
    }

    public boolean checkRateLimit(String identifier, int limit, Duration window) {
        boolean allowed = rateLimiter.tryAcquire(identifier, limit, window);
        if (!allowed) {
            security.warn("Rate limit exceeded: id={} limit={} window={}", identifier, limit, window);
        }
        return allowed;
    }

    public boolean isBlocked(String ip) {
        if (ip == null) return false;
        BlockedIp entry = blockList.get(ip);
        if (entry == null) return false;
        if (entry.isActiveAt(clock.instant())) return true;
        blockList.remove(ip, entry);
        return false;
    }

    /**
     * @param duration null for a permanent block
     */
    public BlockedIp block(String ip, String reason, Duration duration) {
        if (ip == null || ip.isBlank()) {
            throw new ValidationException("ip is required");
        }
        if (duration != null && (duration.isZero() || duration.isNegative())) {
            throw new ValidationException("duration must be positive");
        }
        Instant now = clock.instant();
        BlockedIp entry = new BlockedIp(ip.trim(), reason == null ? "" : reason, now,
                duration == null ? null : now.plus(duration), true);
        blockedIps.save(entry);
        blockList.put(entry.ip(), entry);
        security.warn("IP blocked: ip={} reason={} until={}", entry.ip(), entry.reason(),
                entry.expiresAt() == null ? "permanent" : entry.expiresAt());
        return entry;
    }

    public boolean unblock(String ip) {
        if (ip == null || ip.isBlank()) return false;
        boolean stored = blockedIps.deactivate(ip.trim());
        boolean cached = blockList.remove(ip.trim()) != null;
        if (stored || cached) {
            log.info("IP unblocked: {}", ip);
        }
        return stored || cached;
    }

    public List<BlockedIp> activeBlocks() {
        return blockedIps.findActive(clock.instant());
    }

    public int reloadBlockList() {
        List<BlockedIp> active = blockedIps.findActive(clock.instant());
        blockList.clear();
        for (BlockedIp b : active) {
            blockList.put(b.ip(), b);
        }
        log.info("Loaded {} active IP blocks", active.size());
        return active.size();
    }

    public void evictIdleWindows(Duration window) {
        rateLimiter.evictIdle(window);
    }
}
