package com.example.catalog_import.repository;

import com.example.catalog_import.model.Media;
import com.example.catalog_import.model.MediaStream;
import com.example.catalog_import.model.StreamMediaLink;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface StreamMediaLinkRepository extends JpaRepository<StreamMediaLink, UUID> {
    boolean existsByStreamAndMedia(MediaStream stream, Media media);

    Optional<StreamMediaLink> findFirstByStreamAndPrimaryTrue(MediaStream stream);
}
