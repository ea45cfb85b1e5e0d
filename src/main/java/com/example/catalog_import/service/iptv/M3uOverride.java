package com.example.catalog_import.service.iptv;

import com.example.catalog_import.util.M3uContentType;

/** Client correction for one playlist entry, addressed by its index. */
public record M3uOverride(int index, M3uContentType type, String mediaId) {
}
