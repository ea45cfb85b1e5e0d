package com.example.catalog_import.service.importer;

import java.util.UUID;

public record CommitResult(UUID streamId, UUID mediaId, int linkedFiles) {
}
