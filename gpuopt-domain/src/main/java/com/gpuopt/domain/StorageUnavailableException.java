package com.gpuopt.domain;

/**
 * Raised when the database cannot be opened or a statement fails at the storage level
 * (busy timeout, I/O error). Not retried automatically.
 */
public final class StorageUnavailableException extends DomainException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }
}
