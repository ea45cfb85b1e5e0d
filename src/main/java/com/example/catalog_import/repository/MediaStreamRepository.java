package com.example.catalog_import.repository;

import com.example.catalog_import.model.MediaStream;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface MediaStreamRepository extends JpaRepository<MediaStream, UUID> {
    Optional<MediaStream> findByContentIdentity(String contentIdentity);

    boolean existsByContentIdentity(String contentIdentity);

    long countByContentIdentity(String contentIdentity);
}
