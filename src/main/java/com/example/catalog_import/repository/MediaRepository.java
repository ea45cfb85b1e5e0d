package com.example.catalog_import.repository;

import com.example.catalog_import.model.Media;
import com.example.catalog_import.util.MetaType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MediaRepository extends JpaRepository<Media, UUID> {
    Optional<Media> findByExternalId(String externalId);

    List<Media> findByTypeAndTitleNormalizedAndYearBetween(MetaType type, String titleNormalized, Integer from, Integer to);

    List<Media> findByTypeAndTitleNormalized(MetaType type, String titleNormalized);

    @Query("""
       select m from Media m
       where m.type = :type
         and m.titleNormalized like concat('%', :fragment, '%')
       order by m.popularity desc nulls last, m.createdAt desc
    """)
    List<Media> searchByTitleFragment(@Param("type") MetaType type, @Param("fragment") String fragment, Pageable page);

    @Modifying
    @Query("""
       update Media m
          set m.totalStreams = m.totalStreams + 1,
              m.lastStreamAddedAt = :at
        where m.id = :id
    """)
    int incrementStreamCount(@Param("id") UUID id, @Param("at") Instant at);
}
