package com.gpuopt.domain;

public final class RateLimitedException extends DomainException {

    public RateLimitedException(String message) {
        super(ErrorKind.RATE_LIMITED, message);
    }
}
