package com.phonepe.soulwire.core.errors;

public class StorageException extends SoulException {
    public StorageException(String details, Throwable cause) {
        super(ErrorType.STORAGE_ERROR, cause, details);
    }
}
