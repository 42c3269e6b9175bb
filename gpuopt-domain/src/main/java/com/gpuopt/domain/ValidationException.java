package com.gpuopt.domain;

public class ValidationException extends DomainException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
