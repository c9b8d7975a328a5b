package com.episcope.trends.repository;

import com.episcope.trends.entity.CacheEntryEntity;
import com.episcope.trends.model.MetricKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;

/**
 * Repository for cached trends payloads, keyed by cache key.
 */
@Repository
public interface CacheEntryRepository extends JpaRepository<CacheEntryEntity, String> {

    /**
     * Find entry by key, locking the row for a read-modify-write.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM CacheEntryEntity e WHERE e.cacheKey = :key")
    Optional<CacheEntryEntity> findForUpdate(@Param("key") String key);

    /**
     * Update last access time without touching freshness fields.
     */
    @Modifying
    @Query("UPDATE CacheEntryEntity e SET e.lastAccessedAt = :now WHERE e.cacheKey = :key")
    int touchAccess(@Param("key") String key, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM CacheEntryEntity e WHERE e.entity = :entity AND e.metricKind = :kind")
    int deleteByEntityAndMetricKind(@Param("entity") String entity, @Param("kind") MetricKind kind);

    @Modifying
    @Query("DELETE FROM CacheEntryEntity e WHERE e.entity = :entity")
    int deleteByEntity(@Param("entity") String entity);

    @Modifying
    @Query("DELETE FROM CacheEntryEntity e WHERE e.metricKind = :kind")
    int deleteByMetricKind(@Param("kind") MetricKind kind);
}
