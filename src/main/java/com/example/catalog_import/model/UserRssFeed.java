package com.example.catalog_import.model;

import com.example.catalog_import.util.MetaType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * RSS feed registration with the filters applied to candidate items posted by the scraper.
 */
@Entity
@Table(name = "user_rss_feed", indexes = @Index(name = "idx_user_rss_feed_owner", columnList = "owner_subject"))
public class UserRssFeed {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_subject", length = 128)
    private String ownerSubject;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "url", nullable = false, columnDefinition = "text")
    private String url;

    @Column(name = "include_pattern", length = 512)
    private String includePattern;

    @Column(name = "exclude_pattern", length = 512)
    private String excludePattern;

    @Column(name = "min_size_bytes")
    private Long minSizeBytes;

    @Column(name = "max_size_bytes")
    private Long maxSizeBytes;

    @Enumerated(EnumType.STRING)
    @Column(name = "default_meta_type", nullable = false, length = 16)
    private MetaType defaultMetaType = MetaType.MOVIE;

    @Column(name = "auto_import", nullable = false)
    private boolean autoImport = true;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "last_processed_at")
    private Instant lastProcessedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public UserRssFeed() {}

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getOwnerSubject() {
        return ownerSubject;
    }

    public void setOwnerSubject(String ownerSubject) {
        this.ownerSubject = ownerSubject;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getIncludePattern() {
        return includePattern;
    }

    public void setIncludePattern(String includePattern) {
        this.includePattern = includePattern;
    }

    public String getExcludePattern() {
        return excludePattern;
    }

    public void setExcludePattern(String excludePattern) {
        this.excludePattern = excludePattern;
    }

    public Long getMinSizeBytes() {
        return minSizeBytes;
    }

    public void setMinSizeBytes(Long minSizeBytes) {
        this.minSizeBytes = minSizeBytes;
    }

    public Long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    public void setMaxSizeBytes(Long maxSizeBytes) {
        this.maxSizeBytes = maxSizeBytes;
    }

    public MetaType getDefaultMetaType() {
        return defaultMetaType;
    }

    public void setDefaultMetaType(MetaType defaultMetaType) {
        this.defaultMetaType = defaultMetaType;
    }

    public boolean isAutoImport() {
        return autoImport;
    }

    public void setAutoImport(boolean autoImport) {
        this.autoImport = autoImport;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getLastProcessedAt() {
        return lastProcessedAt;
    }

    public void setLastProcessedAt(Instant lastProcessedAt) {
        this.lastProcessedAt = lastProcessedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
