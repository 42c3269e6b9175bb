package com.gpuopt.domain;

public final class NotFoundException extends DomainException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
