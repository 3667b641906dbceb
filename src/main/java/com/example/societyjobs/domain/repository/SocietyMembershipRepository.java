package com.example.societyjobs.domain.repository;

import com.example.societyjobs.domain.entity.SocietyMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SocietyMembershipRepository extends JpaRepository<SocietyMembership, UUID> {

    @Query("SELECT m.studentId FROM SocietyMembership m WHERE m.societyId = :societyId")
    List<UUID> findStudentIdsBySocietyId(@Param("societyId") UUID societyId);
}
