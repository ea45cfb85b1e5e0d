package com.example.catalog_import.repository;

import com.example.catalog_import.model.ImportJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ImportJobRepository extends JpaRepository<ImportJob, UUID> {

    @Query(value = """
        SELECT id FROM import_job
        WHERE status = 'QUEUED'
        ORDER BY created_at
        FOR UPDATE SKIP LOCKED
        LIMIT :limit
        """, nativeQuery = true)
    List<UUID> selectQueuedIdsForUpdate(@Param("limit") int limit);

    @Modifying
    @Query(value = """
        UPDATE import_job
           SET status = 'PROCESSING',
               updated_at = now(),
               version = version + 1
         WHERE id IN (:ids)
           AND status = 'QUEUED'
        """, nativeQuery = true)
    int markProcessingBatch(@Param("ids") List<UUID> ids);

    // progress and total never move backwards
    @Modifying
    @Query(value = """
        UPDATE import_job
           SET progress = GREATEST(progress, :progress),
               total = GREATEST(total, :total),
               stats = CAST(:statsJson AS jsonb),
               updated_at = now(),
               version = version + 1
         WHERE id = :id
           AND status = 'PROCESSING'
        """, nativeQuery = true)
    int updateProgress(@Param("id") UUID id,
                       @Param("progress") int progress,
                       @Param("total") int total,
                       @Param("statsJson") String statsJson);

    @Modifying
    @Query(value = """
        UPDATE import_job
           SET status = 'COMPLETED',
               total = GREATEST(total, progress, :processed),
               progress = GREATEST(total, progress, :processed),
               stats = CAST(:statsJson AS jsonb),
               updated_at = now(),
               version = version + 1
         WHERE id = :id
           AND status = 'PROCESSING'
        """, nativeQuery = true)
    int markCompleted(@Param("id") UUID id, @Param("processed") int processed, @Param("statsJson") String statsJson);

    @Modifying
    @Query(value = """
        UPDATE import_job
           SET status = 'FAILED',
               error = :error,
               stats = CAST(:statsJson AS jsonb),
               updated_at = now(),
               version = version + 1
         WHERE id = :id
           AND status IN ('QUEUED', 'PROCESSING')
        """, nativeQuery = true)
    int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("statsJson") String statsJson);

    @Modifying
    @Query(value = """
        UPDATE import_job
           SET status = 'FAILED',
               error = :error,
               updated_at = now(),
               version = version + 1
         WHERE id = :id
           AND status = 'QUEUED'
        """, nativeQuery = true)
    int cancelQueued(@Param("id") UUID id, @Param("error") String error);
}
