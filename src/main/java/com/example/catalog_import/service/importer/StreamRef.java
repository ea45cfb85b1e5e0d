package com.example.catalog_import.service.importer;

import java.util.UUID;

public record StreamRef(UUID streamId, UUID primaryMediaId) {
}
