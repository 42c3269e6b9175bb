package com.gpuopt.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CustomerFlowTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper mapper;

  private String signup(String email) throws Exception {
    String body = mvc.perform(post("/api/signup")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"" + email + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("success"))
        .andExpect(jsonPath("$.tier").value("free"))
        .andExpect(jsonPath("$.api_key", startsWith("gopt_")))
        .andReturn().getResponse().getContentAsString();
    JsonNode root = mapper.readTree(body);
    return root.get("api_key").asText();
  }

  private static String uniqueEmail() {
    return "dev-" + UUID.randomUUID() + "@example.com";
  }

  @Test
  void signupThenTrackIdleGpu() throws Exception {
    String apiKey = signup(uniqueEmail());

    mvc.perform(post("/api/track-usage")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"api_key\":\"" + apiKey + "\",\"gpu_data\":[{\"gpu_index\":0,\"gpu_name\":\"A100\","
                + "\"gpu_util\":5.0,\"mem_used\":1000,\"mem_total\":16000,\"cost_per_hour\":3.0}]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("success"))
        .andExpect(jsonPath("$.gpus_monitored").value(1))
        .andExpect(jsonPath("$.potential_hourly_savings").value(1.5))
        .andExpect(jsonPath("$.monthly_projection").value(1080.0))
        .andExpect(jsonPath("$.tier").value("free"));

    mvc.perform(get("/api/usage/recent").header("Authorization", "Bearer " + apiKey))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.usage", hasSize(1)))
        .andExpect(jsonPath("$.usage[0].gpu_name").value("A100"));
  }

  @Test
  void duplicateSignupIsConflict() throws Exception {
    String email = uniqueEmail();
    signup(email);

    mvc.perform(post("/api/signup")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"" + email + "\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.status").value("error"))
        .andExpect(jsonPath("$.reason").value("duplicate_customer"));
  }

  @Test
  void malformedEmailIsRejected() throws Exception {
    mvc.perform(post("/api/signup")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"not-an-email\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("validation"));
  }

  @Test
  void unknownApiKeyIsUnauthorized() throws Exception {
    mvc.perform(post("/api/track-usage")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"api_key\":\"gopt_doesnotexist\",\"gpu_data\":[]}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.reason").value("unauthorized"));

    mvc.perform(get("/api/usage/recent"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void freeTierGpuCapIsEnforced() throws Exception {
    String apiKey = signup(uniqueEmail());
    StringBuilder gpus = new StringBuilder();
    for (int i = 0; i < 3; i++) {
      if (i > 0) gpus.append(',');
      gpus.append("{\"gpu_util\":50,\"mem_used\":1,\"mem_total\":2}");
    }

    mvc.perform(post("/api/track-usage")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"api_key\":\"" + apiKey + "\",\"gpu_data\":[" + gpus + "]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("validation"));
  }

  @Test
  void statsExposeRevenueSnapshot() throws Exception {
    signup(uniqueEmail());

    mvc.perform(get("/api/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.customers_by_tier.free").isNumber())
        .andExpect(jsonPath("$.monthly_recurring_revenue").isNumber())
        .andExpect(jsonPath("$.conversion_rate").isNumber());
  }
}
