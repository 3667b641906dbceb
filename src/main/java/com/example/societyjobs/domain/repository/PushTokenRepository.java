package com.example.societyjobs.domain.repository;

import com.example.societyjobs.domain.entity.PushToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface PushTokenRepository extends JpaRepository<PushToken, UUID> {

    /**
     * Delete tokens that were deactivated or have not been used since the cutoff
     */
    @Modifying
    @Transactional
    @Query("""
            DELETE FROM PushToken t
            WHERE t.active = false
               OR t.lastUsedAt < :cutoff
            """)
    int deleteInactiveOrUnusedSince(@Param("cutoff") Instant cutoff);
}
