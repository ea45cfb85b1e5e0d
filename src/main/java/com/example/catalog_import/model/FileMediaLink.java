package com.example.catalog_import.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.util.UUID;

@Entity
@Table(
        name = "file_media_link",
        indexes = @Index(name = "idx_file_media_link_media", columnList = "media_id, season, episode")
)
public class FileMediaLink {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false, foreignKey = @ForeignKey(name = "fk_file_media_link_file"))
    private StreamFile file;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "media_id", nullable = false, foreignKey = @ForeignKey(name = "fk_file_media_link_media"))
    private Media media;

    @Column(name = "season")
    private Integer season;

    @Column(name = "episode")
    private Integer episode;

    @Column(name = "episode_end")
    private Integer episodeEnd;

    protected FileMediaLink() {}

    public FileMediaLink(StreamFile file, Media media, Integer season, Integer episode, Integer episodeEnd) {
        this.file = file;
        this.media = media;
        this.season = season;
        this.episode = episode;
        this.episodeEnd = episodeEnd;
    }

    public UUID getId() {
        return id;
    }

    public StreamFile getFile() {
        return file;
    }

    public Media getMedia() {
        return media;
    }

    public Integer getSeason() {
        return season;
    }

    public Integer getEpisode() {
        return episode;
    }

    public Integer getEpisodeEnd() {
        return episodeEnd;
    }
}
