package com.gpuopt.domain;

public final class UnauthorizedException extends DomainException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
