package com.gpuopt.api.usage;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.gpuopt.api.config.GpuOptProperties;
import com.gpuopt.api.guard.ApiGuard;
import com.gpuopt.application.usage.GpuReading;
import com.gpuopt.application.usage.IngestResult;
import com.gpuopt.application.usage.UsageIngestor;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.UsageRecord;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class UsageController {

  private final UsageIngestor ingestor;
  private final ApiGuard guard;
  private final int defaultRecentLimit;

  public UsageController(UsageIngestor ingestor, ApiGuard guard, GpuOptProperties props) {
    this.ingestor = ingestor;
    this.guard = guard;
    this.defaultRecentLimit = props.usage().recentLimit();
  }

  /** Agent payload; field names arrive in snake_case. */
  public record TrackUsageRequest(String apiKey, List<GpuData> gpuData) {}

  public record GpuData(
      Integer gpuIndex,
      String gpuName,
      @JsonAlias({"util", "utilization"}) Double gpuUtil,
      Double memUsed,
      Double memTotal,
      Double temperature,
      Double costPerHour
  ) {
    GpuReading toReading() {
      return new GpuReading(gpuIndex, gpuName, gpuUtil, memUsed, memTotal, temperature, costPerHour);
    }
  }

  @PostMapping("/api/track-usage")
  public Map<String, Object> trackUsage(@RequestBody TrackUsageRequest body, HttpServletRequest request) {
    Customer customer = guard.enforceApiKey(request, body.apiKey());
    List<GpuReading> readings = body.gpuData() == null
        ? List.of()
        : body.gpuData().stream().map(d -> d == null ? null : d.toReading()).toList();

    IngestResult r = ingestor.ingest(customer.apiKey(), readings);

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", "success");
    out.put("gpus_monitored", r.gpusMonitored());
    out.put("potential_hourly_savings", r.potentialHourlySavings());
    out.put("monthly_projection", r.monthlyProjection());
    out.put("tier", r.tier().code());
    return out;
  }

  @GetMapping("/api/usage/recent")
  public Map<String, Object> recent(@RequestParam(value = "limit", required = false) Integer limit,
                                    HttpServletRequest request) {
    Customer customer = guard.enforceApiKey(request, null);
    List<UsageRecord> rows = ingestor.recentUsage(customer.apiKey(), limit == null ? defaultRecentLimit : limit);
    return Map.of(
        "status", "success",
        "count", rows.size(),
        "usage", rows
    );
  }
}
