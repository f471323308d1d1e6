package com.example.mediacache.backend;

public class MetadataRetrievalException extends RuntimeException {

    public MetadataRetrievalException(String message) {
        super(message);
    }

    public MetadataRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
