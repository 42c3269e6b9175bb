package com.gpuopt.api.guard;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final ApiUsageLoggingInterceptor usageLogging;
  private final GuardInterceptor guard;

  public WebConfig(ApiUsageLoggingInterceptor usageLogging, GuardInterceptor guard) {
    this.usageLogging = usageLogging;
    this.guard = guard;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // logging first so that rejected calls are recorded too
    registry.addInterceptor(usageLogging)
        .addPathPatterns("/api/**")
        .excludePathPatterns("/api/health");
    registry.addInterceptor(guard)
        .addPathPatterns("/api/**", "/payment/**")
        .excludePathPatterns("/api/health", "/api/webhooks/**");
  }
}
