package com.example.societyjobs.domain.repository;

import com.example.societyjobs.domain.entity.Event;
import com.example.societyjobs.domain.enums.EventStatus;
import com.example.societyjobs.domain.enums.Visibility;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for Event entity.
 * <p>
 * Status transitions are set-based updates; each runs in its own transaction
 * and returns the number of rows changed.
 */
@Repository
public interface EventRepository extends JpaRepository<Event, UUID> {

    /**
     * Find events whose scheduled publish time has passed, oldest first.
     */
    @Query("""
            SELECT e FROM Event e
            WHERE e.visibility = :visibility
              AND e.publishAt <= :now
            ORDER BY e.publishAt ASC
            """)
    List<Event> findDueForPublishing(@Param("visibility") Visibility visibility, @Param("now") Instant now, Pageable pageable);

    default List<Event> findDueForPublishing(Instant now, int limit) {
        return findDueForPublishing(Visibility.SCHEDULE, now, Pageable.ofSize(limit));
    }

    /**
     * Upcoming events whose start time has passed but whose end time has not.
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE Event e
            SET e.status = :ongoing,
                e.updatedAt = :now
            WHERE e.status = :upcoming
              AND e.startsAt <= :now
              AND e.endsAt > :now
            """)
    int markStarted(@Param("upcoming") EventStatus upcoming, @Param("ongoing") EventStatus ongoing, @Param("now") Instant now);

    default int markStarted(Instant now) {
        return markStarted(EventStatus.UPCOMING, EventStatus.ONGOING, now);
    }

    /**
     * Upcoming or ongoing events whose end time has passed.
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE Event e
            SET e.status = :completed,
                e.updatedAt = :now
            WHERE e.status IN :active
              AND e.endsAt <= :now
            """)
    int markCompleted(@Param("active") List<EventStatus> active, @Param("completed") EventStatus completed, @Param("now") Instant now);

    default int markCompleted(Instant now) {
        return markCompleted(List.of(EventStatus.UPCOMING, EventStatus.ONGOING), EventStatus.COMPLETED, now);
    }

    /**
     * Published, non-draft upcoming events starting inside [from, until].
     */
    @Query("""
            SELECT e FROM Event e
            WHERE e.status = :status
              AND e.draft = false
              AND e.startsAt >= :from
              AND e.startsAt <= :until
            ORDER BY e.startsAt ASC
            """)
    List<Event> findStartingBetween(@Param("status") EventStatus status, @Param("from") Instant from, @Param("until") Instant until);

    default List<Event> findUpcomingStartingBetween(Instant from, Instant until) {
        return findStartingBetween(EventStatus.UPCOMING, from, until);
    }
}
