package com.gpuopt.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static com.gpuopt.api.RouteRateLimitTest.remoteAddr;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminBlockedIpTest {

  private static final String TOKEN = "test-admin-token";

  @Autowired MockMvc mvc;

  @Test
  void adminCallsNeedTheToken() throws Exception {
    mvc.perform(get("/api/admin/blocked-ips"))
        .andExpect(status().isUnauthorized());
    mvc.perform(get("/api/admin/blocked-ips").header("X-Admin-Token", "wrong"))
        .andExpect(status().isUnauthorized());
    mvc.perform(get("/api/admin/blocked-ips").header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("success"));
  }

  @Test
  void blockedAddressIsRejectedUntilUnblocked() throws Exception {
    String ip = "203.0.113.77";

    mvc.perform(post("/api/admin/blocked-ips")
            .header("X-Admin-Token", TOKEN)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"ip\":\"" + ip + "\",\"reason\":\"abuse\",\"duration_minutes\":30}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.ip").value(ip))
        .andExpect(jsonPath("$.active").value(true));

    mvc.perform(get("/api/stats").with(remoteAddr(ip)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.reason").value("forbidden"));

    // a forged forwarding header neither escapes the block nor blocks someone else
    mvc.perform(get("/api/stats").with(remoteAddr(ip)).header("X-Forwarded-For", "198.51.100.99"))
        .andExpect(status().isForbidden());
    mvc.perform(get("/api/stats").with(remoteAddr("198.51.100.98")).header("X-Forwarded-For", ip))
        .andExpect(status().isOk());

    // health stays reachable
    mvc.perform(get("/api/health").with(remoteAddr(ip)))
        .andExpect(status().isOk());

    mvc.perform(delete("/api/admin/blocked-ips/" + ip).header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk());

    mvc.perform(get("/api/stats").with(remoteAddr(ip)))
        .andExpect(status().isOk());

    mvc.perform(delete("/api/admin/blocked-ips/" + ip).header("X-Admin-Token", TOKEN))
        .andExpect(status().isNotFound());
  }

  @Test
  void blockRejectsNonPositiveDuration() throws Exception {
    mvc.perform(post("/api/admin/blocked-ips")
            .header("X-Admin-Token", TOKEN)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"ip\":\"203.0.113.78\",\"duration_minutes\":0}"))
        .andExpect(status().isBadRequest());
  }
}
