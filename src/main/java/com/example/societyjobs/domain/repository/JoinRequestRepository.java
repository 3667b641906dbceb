package com.example.societyjobs.domain.repository;

import com.example.societyjobs.domain.entity.JoinRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JoinRequest entity.
 */
@Repository
public interface JoinRequestRepository extends JpaRepository<JoinRequest, UUID> {

    /**
     * Fetch one page of processed (non-pending) requests created before the cutoff.
     * Ordered by creation time so repeated calls walk the oldest rows first.
     */
    @Query(value = """
            SELECT j.* FROM join_requests j
            WHERE j.status <> 'PENDING'
              AND j.created_at < :cutoff
            ORDER BY j.created_at ASC, j.id ASC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<JoinRequest> findStaleBatch(@Param("cutoff") Instant cutoff, @Param("limit") int limit, @Param("offset") int offset);

    /**
     * Delete a batch of requests in one statement
     *
     * @return number of rows deleted
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM JoinRequest j WHERE j.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<UUID> ids);
}
