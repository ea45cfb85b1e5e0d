package com.example.catalog_import.dto.web;

import com.example.catalog_import.util.MetaType;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record NzbUrlsRequest(
        @NotEmpty @Size(max = 500) List<String> urls,
        MetaType metaType
) {
}
