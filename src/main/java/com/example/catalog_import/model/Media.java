package com.example.catalog_import.model;

import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.TitleSimilarity;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
        name = "media",
        uniqueConstraints = @UniqueConstraint(name = "uq_media_external_id", columnNames = "external_id"),
        indexes = @Index(name = "idx_media_title_norm", columnList = "title_normalized, year")
)
public class Media {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "external_id", nullable = false, length = 128)
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private MetaType type;

    @Column(name = "title", nullable = false, length = 512)
    private String title;

    // lower-cased, punctuation-free title used for exact lookups
    @Column(name = "title_normalized", nullable = false, length = 512)
    private String titleNormalized;

    @Column(name = "year")
    private Integer year;

    @Column(name = "poster_url", columnDefinition = "text")
    private String posterUrl;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "genres", columnDefinition = "jsonb")
    private List<String> genres;

    @Column(name = "popularity")
    private Double popularity;

    @Column(name = "rating")
    private Double rating;

    @Column(name = "user_created", nullable = false)
    private boolean userCreated;

    @Column(name = "total_streams", nullable = false)
    private int totalStreams;

    @Column(name = "last_stream_added_at")
    private Instant lastStreamAddedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public Media() {}

    public Media(String externalId, MetaType type, String title, Integer year) {
        this.externalId = externalId;
        this.type = type;
        setTitle(title);
        this.year = year;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getExternalId() {
        return externalId;
    }

    public void setExternalId(String externalId) {
        this.externalId = externalId;
    }

    public MetaType getType() {
        return type;
    }

    public void setType(MetaType type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
        this.titleNormalized = TitleSimilarity.normalize(title);
    }

    public String getTitleNormalized() {
        return titleNormalized;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public String getPosterUrl() {
        return posterUrl;
    }

    public void setPosterUrl(String posterUrl) {
        this.posterUrl = posterUrl;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getGenres() {
        return genres;
    }

    public void setGenres(List<String> genres) {
        this.genres = genres;
    }

    public Double getPopularity() {
        return popularity;
    }

    public void setPopularity(Double popularity) {
        this.popularity = popularity;
    }

    public Double getRating() {
        return rating;
    }

    public void setRating(Double rating) {
        this.rating = rating;
    }

    public boolean isUserCreated() {
        return userCreated;
    }

    public void setUserCreated(boolean userCreated) {
        this.userCreated = userCreated;
    }

    public int getTotalStreams() {
        return totalStreams;
    }

    public void setTotalStreams(int totalStreams) {
        this.totalStreams = totalStreams;
    }

    public Instant getLastStreamAddedAt() {
        return lastStreamAddedAt;
    }

    public void setLastStreamAddedAt(Instant lastStreamAddedAt) {
        this.lastStreamAddedAt = lastStreamAddedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
