package com.example.catalog_import.service.source.torrent;

public class BencodeException extends RuntimeException {
    public BencodeException(String message) {
        super(message);
    }
}
