package com.example.catalog_import.service.match;

public class MetadataAccessException extends RuntimeException {
    public MetadataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
