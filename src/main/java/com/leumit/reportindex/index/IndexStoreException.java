package com.leumit.reportindex.index;

public class IndexStoreException extends RuntimeException {

    public IndexStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
