package com.example.catalog_import.repository;

import com.example.catalog_import.model.UserRssFeed;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface UserRssFeedRepository extends JpaRepository<UserRssFeed, UUID> {
    List<UserRssFeed> findByOwnerSubjectOrderByCreatedAtDesc(String ownerSubject);
}
