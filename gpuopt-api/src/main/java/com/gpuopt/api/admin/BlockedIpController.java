package com.gpuopt.api.admin;

import com.gpuopt.application.guard.AccessGuard;
import com.gpuopt.domain.NotFoundException;
import com.gpuopt.domain.model.BlockedIp;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/blocked-ips")
public class BlockedIpController {

  private final AccessGuard accessGuard;
  private final AdminTokenCheck admin;

  public BlockedIpController(AccessGuard accessGuard, AdminTokenCheck admin) {
    this.accessGuard = accessGuard;
    this.admin = admin;
  }

  /** @param durationMinutes omitted for a permanent block */
  public record BlockRequest(@NotBlank String ip, String reason, @Positive Long durationMinutes) {}

  @GetMapping
  public Map<String, Object> list(@RequestHeader(value = AdminTokenCheck.HEADER, required = false) String token) {
    admin.require(token);
    List<Map<String, Object>> blocks = accessGuard.activeBlocks().stream().map(BlockedIpController::view).toList();
    return Map.of("status", "success", "blocked_ips", blocks);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Object> block(@RequestHeader(value = AdminTokenCheck.HEADER, required = false) String token,
                                   @Valid @RequestBody BlockRequest body) {
    admin.require(token);
    Duration duration = body.durationMinutes() == null ? null : Duration.ofMinutes(body.durationMinutes());
    BlockedIp entry = accessGuard.block(body.ip(), body.reason(), duration);
    Map<String, Object> out = view(entry);
    out.put("status", "success");
    return out;
  }

  @DeleteMapping("/{ip}")
  public Map<String, Object> unblock(@RequestHeader(value = AdminTokenCheck.HEADER, required = false) String token,
                                     @PathVariable("ip") String ip) {
    admin.require(token);
    if (!accessGuard.unblock(ip)) {
      throw new NotFoundException("IP is not blocked: " + ip);
    }
    return Map.of("status", "success", "ip", ip, "active", false);
  }

  private static Map<String, Object> view(BlockedIp b) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("ip", b.ip());
    out.put("reason", b.reason());
    out.put("blocked_at", String.valueOf(b.blockedAt()));
    out.put("expires_at", b.expiresAt() == null ? null : b.expiresAt().toString());
    out.put("active", b.active());
    return out;
  }
}
