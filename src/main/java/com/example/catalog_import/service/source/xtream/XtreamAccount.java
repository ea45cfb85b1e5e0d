package com.example.catalog_import.service.source.xtream;

public record XtreamAccount(
        String status,
        String expDate,
        Integer maxConnections,
        Integer activeConnections,
        boolean trial
) {
}
