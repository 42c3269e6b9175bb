package com.gpuopt.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.gpuopt.api")
@ConfigurationPropertiesScan(basePackages = "com.gpuopt.api")
@EnableScheduling
public class GpuOptApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(GpuOptApiApplication.class, args);
  }
}
