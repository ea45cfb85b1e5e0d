package com.example.catalog_import.service.source.xtream;

public record XtreamCategory(String id, String name, int count) {
}
