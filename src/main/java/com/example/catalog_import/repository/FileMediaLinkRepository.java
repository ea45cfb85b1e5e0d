package com.example.catalog_import.repository;

import com.example.catalog_import.model.FileMediaLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface FileMediaLinkRepository extends JpaRepository<FileMediaLink, UUID> {
    @Query("select count(l) from FileMediaLink l where l.file.stream.id = :streamId")
    long countByStreamId(@Param("streamId") UUID streamId);
}
