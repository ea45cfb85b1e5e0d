package com.example.catalog_import.model;

import com.example.catalog_import.util.SourceKind;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A playable source for one or more media records. {@code content_identity} is the dedup key and is
 * unique across all source kinds.
 */
@Entity
@Table(
        name = "media_stream",
        uniqueConstraints = @UniqueConstraint(name = "uq_media_stream_identity", columnNames = "content_identity"),
        indexes = @Index(name = "idx_media_stream_source", columnList = "iptv_source_id")
)
public class MediaStream {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "content_identity", nullable = false, length = 128, updatable = false)
    private String contentIdentity;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_kind", nullable = false, length = 16)
    private SourceKind sourceKind;

    @Column(name = "name", nullable = false, length = 1024)
    private String name;

    @Column(name = "resolution", length = 16)
    private String resolution;

    @Column(name = "quality", length = 32)
    private String quality;

    @Column(name = "codec", length = 32)
    private String codec;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "audio", columnDefinition = "jsonb")
    private List<String> audio;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "hdr", columnDefinition = "jsonb")
    private List<String> hdr;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "languages", columnDefinition = "jsonb")
    private List<String> languages;

    @Column(name = "release_group", length = 128)
    private String releaseGroup;

    @Column(name = "total_size")
    private Long totalSize;

    @Column(name = "source_url", columnDefinition = "text")
    private String sourceUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "attributes", columnDefinition = "jsonb")
    private Map<String, Object> attributes;

    @Column(name = "iptv_source_id")
    private UUID iptvSourceId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected MediaStream() {}

    public MediaStream(String contentIdentity, SourceKind sourceKind, String name) {
        this.contentIdentity = contentIdentity;
        this.sourceKind = sourceKind;
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getContentIdentity() {
        return contentIdentity;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getResolution() {
        return resolution;
    }

    public void setResolution(String resolution) {
        this.resolution = resolution;
    }

    public String getQuality() {
        return quality;
    }

    public void setQuality(String quality) {
        this.quality = quality;
    }

    public String getCodec() {
        return codec;
    }

    public void setCodec(String codec) {
        this.codec = codec;
    }

    public List<String> getAudio() {
        return audio;
    }

    public void setAudio(List<String> audio) {
        this.audio = audio;
    }

    public List<String> getHdr() {
        return hdr;
    }

    public void setHdr(List<String> hdr) {
        this.hdr = hdr;
    }

    public List<String> getLanguages() {
        return languages;
    }

    public void setLanguages(List<String> languages) {
        this.languages = languages;
    }

    public String getReleaseGroup() {
        return releaseGroup;
    }

    public void setReleaseGroup(String releaseGroup) {
        this.releaseGroup = releaseGroup;
    }

    public Long getTotalSize() {
        return totalSize;
    }

    public void setTotalSize(Long totalSize) {
        this.totalSize = totalSize;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = attributes;
    }

    public UUID getIptvSourceId() {
        return iptvSourceId;
    }

    public void setIptvSourceId(UUID iptvSourceId) {
        this.iptvSourceId = iptvSourceId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
