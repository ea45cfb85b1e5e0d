package com.example.catalog_import.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.util.UUID;

@Entity
@Table(
        name = "stream_file",
        uniqueConstraints = @UniqueConstraint(name = "uq_stream_file_index", columnNames = {"stream_id", "file_index"})
)
public class StreamFile {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "stream_id", nullable = false, foreignKey = @ForeignKey(name = "fk_stream_file_stream"))
    private MediaStream stream;

    @Column(name = "file_index", nullable = false)
    private int fileIndex;

    @Column(name = "filename", nullable = false, length = 1024)
    private String filename;

    @Column(name = "size", nullable = false)
    private long size;

    // single-file sources and unresolved magnets get one placeholder file
    @Column(name = "virtual_file", nullable = false)
    private boolean virtualFile;

    protected StreamFile() {}

    public StreamFile(MediaStream stream, int fileIndex, String filename, long size, boolean virtualFile) {
        this.stream = stream;
        this.fileIndex = fileIndex;
        this.filename = filename;
        this.size = size;
        this.virtualFile = virtualFile;
    }

    public UUID getId() {
        return id;
    }

    public MediaStream getStream() {
        return stream;
    }

    public int getFileIndex() {
        return fileIndex;
    }

    public String getFilename() {
        return filename;
    }

    public long getSize() {
        return size;
    }

    public boolean isVirtualFile() {
        return virtualFile;
    }
}
