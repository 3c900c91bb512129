package com.docproof.storage;

/**
 * A temp-store operation could not complete (e.g. overwrite or removal failed, value could not be decoded).
 */
public class TempStoreException extends RuntimeException {

    public TempStoreException(String message) {
        super(message);
    }

    public TempStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
