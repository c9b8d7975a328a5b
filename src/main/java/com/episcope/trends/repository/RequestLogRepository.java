package com.episcope.trends.repository;

import com.episcope.trends.entity.RequestLogEntity;
import com.episcope.trends.model.RequestStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for upstream call attempts.
 */
@Repository
public interface RequestLogRepository extends JpaRepository<RequestLogEntity, Long> {

    List<RequestLogEntity> findAllByOrderByTimestampDesc(Pageable pageable);

    /**
     * Count attempts by status since a point in time.
     */
    @Query("SELECT COUNT(r) FROM RequestLogEntity r WHERE r.status = :status AND r.timestamp >= :since")
    long countByStatusSince(@Param("status") RequestStatus status, @Param("since") Instant since);
}
