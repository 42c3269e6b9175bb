package com.gpuopt.domain;

public final class AccessDeniedException extends DomainException {

    public AccessDeniedException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
