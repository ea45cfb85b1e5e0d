package com.example.catalog_import.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.util.UUID;

@Entity
@Table(
        name = "stream_media_link",
        uniqueConstraints = @UniqueConstraint(name = "uq_stream_media_link", columnNames = {"stream_id", "media_id"})
)
public class StreamMediaLink {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "stream_id", nullable = false, foreignKey = @ForeignKey(name = "fk_stream_media_link_stream"))
    private MediaStream stream;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "media_id", nullable = false, foreignKey = @ForeignKey(name = "fk_stream_media_link_media"))
    private Media media;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;

    protected StreamMediaLink() {}

    public StreamMediaLink(MediaStream stream, Media media, boolean primary) {
        this.stream = stream;
        this.media = media;
        this.primary = primary;
    }

    public UUID getId() {
        return id;
    }

    public MediaStream getStream() {
        return stream;
    }

    public Media getMedia() {
        return media;
    }

    public boolean isPrimary() {
        return primary;
    }
}
