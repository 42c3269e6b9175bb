package com.gpuopt.api.stats;

import com.gpuopt.application.stats.RevenueStats;
import com.gpuopt.application.stats.RevenueStatsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatsController {

  private final RevenueStatsService stats;

  public StatsController(RevenueStatsService stats) {
    this.stats = stats;
  }

  @GetMapping("/api/stats")
  public RevenueStats stats() {
    return stats.snapshot();
  }
}
