package com.example.catalog_import.dto.web;

import com.example.catalog_import.dto.FileEntry;

import java.util.List;

public record AnnotateResponse(String analysisHandle, List<FileEntry> files) {
}
