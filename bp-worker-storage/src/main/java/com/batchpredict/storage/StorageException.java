package com.batchpredict.storage;

/**
 * Unchecked failure of an external store (object storage, metadata store, relational store or prediction
 * service). The message names the operation and target; the cause carries the client's own error.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
