package com.example.catalog_import.repository;

import com.example.catalog_import.model.MediaStream;
import com.example.catalog_import.model.StreamFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StreamFileRepository extends JpaRepository<StreamFile, UUID> {
    List<StreamFile> findByStreamOrderByFileIndexAsc(MediaStream stream);
}
