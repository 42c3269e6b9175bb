package com.gpuopt.api.identity;

import com.gpuopt.api.guard.ApiGuard;
import com.gpuopt.application.identity.IdentityStore;
import com.gpuopt.domain.model.Customer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class SignupController {

  private final IdentityStore identities;
  private final ApiGuard guard;

  public SignupController(IdentityStore identities, ApiGuard guard) {
    this.identities = identities;
    this.guard = guard;
  }

  public record SignupRequest(@NotBlank @Size(max = 255) String email) {}

  @PostMapping("/api/signup")
  public Map<String, Object> signup(@Valid @RequestBody SignupRequest body, HttpServletRequest request) {
    guard.enforceSignupLimit(request);
    Customer customer = identities.createCustomer(body.email().trim());
    return Map.of(
        "status", "success",
        "message", "Account created successfully",
        "api_key", customer.apiKey(),
        "tier", customer.tier().code()
    );
  }
}
