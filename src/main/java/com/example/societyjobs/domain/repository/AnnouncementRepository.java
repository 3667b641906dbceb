package com.example.societyjobs.domain.repository;

import com.example.societyjobs.domain.entity.Announcement;
import com.example.societyjobs.domain.enums.Visibility;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AnnouncementRepository extends JpaRepository<Announcement, UUID> {

    @Query("""
            SELECT a FROM Announcement a
            WHERE a.status = :status
              AND a.publishAt <= :now
            ORDER BY a.publishAt ASC
            """)
    List<Announcement> findDueForPublishing(@Param("status") Visibility status, @Param("now") Instant now, Pageable pageable);

    default List<Announcement> findDueForPublishing(Instant now, int limit) {
        return findDueForPublishing(Visibility.SCHEDULE, now, Pageable.ofSize(limit));
    }
}
