package com.gpuopt.domain;

public final class InvalidStateTransitionException extends DomainException {

    public InvalidStateTransitionException(String message) {
        super(ErrorKind.INVALID_STATE_TRANSITION, message);
    }
}
