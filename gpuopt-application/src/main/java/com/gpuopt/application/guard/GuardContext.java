package com.gpuopt.application.guard;

import com.gpuopt.domain.model.Customer;

import java.util.Optional;

/**
 * Per-request input to the guard chain. Stages may attach the authenticated customer.
 */
public final class GuardContext {

    private final String ip;
    private final String path;
    private final String authorizationHeader;
    private final String bodyApiKey;
    private Customer customer;

    public GuardContext(String ip, String path, String authorizationHeader, String bodyApiKey) {
        this.ip = ip;
        this.path = path;
        this.authorizationHeader = authorizationHeader;
        this.bodyApiKey = bodyApiKey;
    }

    public String ip() {
        return ip;
    }

    public String path() {
        return path;
    }

    public String authorizationHeader() {
        return authorizationHeader;
    }

    public String bodyApiKey() {
        return bodyApiKey;
    }

    public Optional<Customer> customer() {
        return Optional.ofNullable(customer);
    }

    void authenticated(Customer customer) {
        this.customer = customer;
    }
}
