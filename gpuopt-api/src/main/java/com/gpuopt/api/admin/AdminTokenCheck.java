package com.gpuopt.api.admin;

import com.gpuopt.api.config.GpuOptProperties;
import com.gpuopt.domain.AccessDeniedException;
import com.gpuopt.domain.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/** Shared-secret check for admin endpoints. A blank configured token disables them. */
@Component
public class AdminTokenCheck {

  public static final String HEADER = "X-Admin-Token";

  private static final Logger security = LoggerFactory.getLogger("security");

  private final byte[] expected;

  public AdminTokenCheck(GpuOptProperties props) {
    this.expected = props.admin().token().trim().getBytes(StandardCharsets.UTF_8);
  }

  public void require(String presented) {
    if (expected.length == 0) {
      throw new AccessDeniedException("Admin API is disabled");
    }
    if (presented == null || presented.isBlank()) {
      throw new UnauthorizedException("Admin token required");
    }
    if (!MessageDigest.isEqual(expected, presented.trim().getBytes(StandardCharsets.UTF_8))) {
      security.warn("Rejected admin call with invalid token");
      throw new UnauthorizedException("Invalid admin token");
    }
  }
}
