package com.example.catalog_import.model;

import com.example.catalog_import.util.IptvSourceType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Saved M3U playlist or Xtream panel that can be re-synced with the settings of its first import.
 */
@Entity
@Table(name = "iptv_source", indexes = @Index(name = "idx_iptv_source_owner", columnList = "owner_subject"))
public class IptvSource {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_subject", length = 128)
    private String ownerSubject;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 16)
    private IptvSourceType sourceType;

    @Column(name = "m3u_url", columnDefinition = "text")
    private String m3uUrl;

    @Column(name = "server", length = 512)
    private String server;

    @Column(name = "username", length = 255)
    private String username;

    @Column(name = "password", length = 255)
    private String password;

    @Column(name = "is_public", nullable = false)
    private boolean isPublic;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "import_live", nullable = false)
    private boolean importLive = true;

    @Column(name = "import_vod", nullable = false)
    private boolean importVod = true;

    @Column(name = "import_series", nullable = false)
    private boolean importSeries = true;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "live_category_ids", columnDefinition = "jsonb")
    private List<String> liveCategoryIds = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "vod_category_ids", columnDefinition = "jsonb")
    private List<String> vodCategoryIds = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "series_category_ids", columnDefinition = "jsonb")
    private List<String> seriesCategoryIds = new ArrayList<>();

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "last_sync_stats", columnDefinition = "jsonb")
    private Map<String, Integer> lastSyncStats;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public IptvSource() {}

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

    public IptvSourceType getSourceType() {
        return sourceType;
    }

    public void setSourceType(IptvSourceType sourceType) {
        this.sourceType = sourceType;
    }

    public String getM3uUrl() {
        return m3uUrl;
    }

    public void setM3uUrl(String m3uUrl) {
        this.m3uUrl = m3uUrl;
    }

    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isPublic() {
        return isPublic;
    }

    public void setPublic(boolean isPublic) {
        this.isPublic = isPublic;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isImportLive() {
        return importLive;
    }

    public void setImportLive(boolean importLive) {
        this.importLive = importLive;
    }

    public boolean isImportVod() {
        return importVod;
    }

    public void setImportVod(boolean importVod) {
        this.importVod = importVod;
    }

    public boolean isImportSeries() {
        return importSeries;
    }

    public void setImportSeries(boolean importSeries) {
        this.importSeries = importSeries;
    }

    public List<String> getLiveCategoryIds() {
        return liveCategoryIds;
    }

    public void setLiveCategoryIds(List<String> liveCategoryIds) {
        this.liveCategoryIds = liveCategoryIds;
    }

    public List<String> getVodCategoryIds() {
        return vodCategoryIds;
    }

    public void setVodCategoryIds(List<String> vodCategoryIds) {
        this.vodCategoryIds = vodCategoryIds;
    }

    public List<String> getSeriesCategoryIds() {
        return seriesCategoryIds;
    }

    public void setSeriesCategoryIds(List<String> seriesCategoryIds) {
        this.seriesCategoryIds = seriesCategoryIds;
    }

    public Instant getLastSyncedAt() {
        return lastSyncedAt;
    }

    public void setLastSyncedAt(Instant lastSyncedAt) {
        this.lastSyncedAt = lastSyncedAt;
    }

    public Map<String, Integer> getLastSyncStats() {
        return lastSyncStats;
    }

    public void setLastSyncStats(Map<String, Integer> lastSyncStats) {
        this.lastSyncStats = lastSyncStats;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
