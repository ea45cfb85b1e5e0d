package com.example.catalog_import.repository;

import com.example.catalog_import.model.IptvSource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface IptvSourceRepository extends JpaRepository<IptvSource, UUID> {
    List<IptvSource> findByOwnerSubjectOrderByCreatedAtDesc(String ownerSubject);

    List<IptvSource> findByActiveTrue();
}
