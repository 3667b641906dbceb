package com.example.societyjobs.domain.repository;

import com.example.societyjobs.domain.entity.EventRegistration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EventRegistrationRepository extends JpaRepository<EventRegistration, UUID> {

    @Query("SELECT r.studentId FROM EventRegistration r WHERE r.eventId = :eventId")
    List<UUID> findStudentIdsByEventId(@Param("eventId") UUID eventId);
}
