package com.example.societyjobs.domain.repository;

import com.example.societyjobs.domain.entity.Meeting;
import com.example.societyjobs.domain.enums.MeetingStatus;
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

@Repository
public interface MeetingRepository extends JpaRepository<Meeting, UUID> {

    @Modifying
    @Transactional
    @Query("""
            DELETE FROM Meeting m
            WHERE m.status IN :statuses
              AND m.createdAt < :cutoff
            """)
    int deleteByStatusInAndCreatedBefore(@Param("statuses") Collection<MeetingStatus> statuses, @Param("cutoff") Instant cutoff);

    /**
     * Delete ended or cancelled meetings created before the cutoff
     */
    default int deleteFinishedBefore(Instant cutoff) {
        return deleteByStatusInAndCreatedBefore(List.of(MeetingStatus.ENDED, MeetingStatus.CANCELLED), cutoff);
    }
}
