package com.example.catalog_import.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record XtreamAnalyzeRequest(
        @NotBlank @Size(max = 2048) String serverUrl,
        @NotBlank String username,
        @NotBlank String password
) {
}
