package com.example.catalog_import.dto;

import com.example.catalog_import.util.ImportErrorType;

public record ImportError(ImportErrorType type, String message) {
}
