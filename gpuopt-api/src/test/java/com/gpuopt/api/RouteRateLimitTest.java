package com.gpuopt.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {"gpuopt.guard.signup-limit=2"})
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RouteRateLimitTest {

  @Autowired MockMvc mvc;

  static RequestPostProcessor remoteAddr(String ip) {
    return request -> {
      request.setRemoteAddr(ip);
      return request;
    };
  }

  private int signupFrom(String ip) throws Exception {
    return mvc.perform(post("/api/signup")
            .with(remoteAddr(ip))
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"rl-" + UUID.randomUUID() + "@example.com\"}"))
        .andReturn().getResponse().getStatus();
  }

  @Test
  void signupIsLimitedPerAddress() throws Exception {
    signupFrom("198.51.100.10");
    signupFrom("198.51.100.10");

    mvc.perform(post("/api/signup")
            .with(remoteAddr("198.51.100.10"))
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"rl-" + UUID.randomUUID() + "@example.com\"}"))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.reason").value("rate_limited"));

    // another address has its own window
    mvc.perform(post("/api/signup")
            .with(remoteAddr("198.51.100.11"))
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"rl-" + UUID.randomUUID() + "@example.com\"}"))
        .andExpect(status().isOk());
  }

  @Test
  void rotatingForwardedHeaderDoesNotResetTheWindow() throws Exception {
    for (int i = 1; i <= 2; i++) {
      mvc.perform(post("/api/signup")
              .with(remoteAddr("198.51.100.20"))
              .header("X-Forwarded-For", "203.0.113." + i)
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"email\":\"rl-" + UUID.randomUUID() + "@example.com\"}"))
          .andExpect(status().isOk());
    }

    mvc.perform(post("/api/signup")
            .with(remoteAddr("198.51.100.20"))
            .header("X-Forwarded-For", "203.0.113.3")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"rl-" + UUID.randomUUID() + "@example.com\"}"))
        .andExpect(status().isTooManyRequests());
  }
}
