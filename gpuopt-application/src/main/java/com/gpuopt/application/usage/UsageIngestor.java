package com.gpuopt.application.usage;

import com.gpuopt.application.catalog.TierCatalog;
import com.gpuopt.application.identity.IdentityStore;
import com.gpuopt.application.ports.UsageRepository;
import com.gpuopt.domain.UnauthorizedException;
import com.gpuopt.domain.ValidationException;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.GpuSample;
import com.gpuopt.domain.model.TierLimits;
import com.gpuopt.domain.model.UsageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a batch of agent readings into usage rows and a savings estimate.
 *
 * A batch is accepted or rejected as a whole: validation and tier checks run before anything is written.
 */
public class UsageIngestor {

    private static final Logger log = LoggerFactory.getLogger(UsageIngestor.class);

    /** GPUs below this utilisation (percent) count as idle. */
    static final double IDLE_THRESHOLD = 15.0;
    static final double IDLE_SAVINGS_FACTOR = 0.5;
    static final int HOURS_PER_MONTH = 24 * 30;
    static final int MAX_RECENT = 500;

    private final IdentityStore identities;
    private final UsageRepository usage;
    private final int maxBatchSize;
    private final Clock clock;

    public UsageIngestor(IdentityStore identities, UsageRepository usage, int maxBatchSize, Clock clock) {
        this.identities = Objects.requireNonNull(identities, "identities");
        this.usage = Objects.requireNonNull(usage, "usage");
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
        this.maxBatchSize = maxBatchSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public IngestResult ingest(String apiKey, List<GpuReading> readings) {
        Customer customer = identities.getByApiKey(apiKey)
                .orElseThrow(() -> new UnauthorizedException("Invalid API key"));

        if (readings == null) {
            throw new ValidationException("gpu_data is required");
        }
        if (readings.size() > maxBatchSize) {
            throw new ValidationException("gpu_data exceeds " + maxBatchSize + " entries");
        }

        TierLimits limits = TierCatalog.limits(customer.tier());
        if (!limits.allowsGpuCount(readings.size())) {
            throw new ValidationException("Free tier limited to " + limits.maxGpus()
                    + " GPUs. Upgrade to Professional.");
        }

        Instant now = clock.instant();
        List<UsageRecord> records = new ArrayList<>(readings.size());
        double hourly = 0.0;
        for (int i = 0; i < readings.size(); i++) {
            GpuSample s = SampleValidator.validate(readings.get(i), i);
            double savings = potentialSavings(s);
            hourly += savings;
            records.add(new UsageRecord(
                    customer.email(),
                    s.gpuIndex(),
                    s.gpuName(),
                    s.utilization(),
                    s.memoryUsed(),
                    s.memoryTotal(),
                    s.costPerHour(),
                    savings,
                    now
            ));
        }

        double monthly = hourly * HOURS_PER_MONTH;
        identities.recordUsage(customer, records, monthly);

        log.debug("Ingested {} GPU samples for {} (hourly savings {})", records.size(), customer.email(), hourly);
        return new IngestResult(records.size(), hourly, monthly, customer.tier());
    }

    public List<UsageRecord> recentUsage(String apiKey, int limit) {
        Customer customer = identities.getByApiKey(apiKey)
                .orElseThrow(() -> new UnauthorizedException("Invalid API key"));
        int bounded = Math.max(1, Math.min(limit, MAX_RECENT));
        return usage.recent(customer.email(), bounded);
    }

    static double potentialSavings(GpuSample s) {
        return s.utilization() < IDLE_THRESHOLD ? s.costPerHour() * IDLE_SAVINGS_FACTOR : 0.0;
    }
}
