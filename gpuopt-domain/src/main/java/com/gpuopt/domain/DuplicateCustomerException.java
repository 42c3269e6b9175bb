package com.gpuopt.domain;

public final class DuplicateCustomerException extends DomainException {

    public DuplicateCustomerException(String message) {
        super(ErrorKind.DUPLICATE_CUSTOMER, message);
    }
}
