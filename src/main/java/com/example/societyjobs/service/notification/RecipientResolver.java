package com.example.societyjobs.service.notification;

import com.example.societyjobs.domain.enums.EventAudience;
import com.example.societyjobs.domain.repository.EventRegistrationRepository;
import com.example.societyjobs.domain.repository.SocietyMembershipRepository;
import com.example.societyjobs.domain.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Works out which students a notification is addressed to.
 */
@Component
@RequiredArgsConstructor
public class RecipientResolver {

    private final StudentRepository studentRepository;
    private final SocietyMembershipRepository membershipRepository;
    private final EventRegistrationRepository registrationRepository;

    /**
     * OPEN reaches every student, MEMBERS the society's members, INVITE nobody.
     */
    public List<UUID> forAudience(UUID societyId, EventAudience audience) {
        if (audience == null) {
            return List.of();
        }
        return switch (audience) {
            case OPEN -> studentRepository.findAllIds();
            case MEMBERS -> membershipRepository.findStudentIdsBySocietyId(societyId);
            case INVITE -> List.of();
        };
    }

    public List<UUID> registrantsOf(UUID eventId) {
        return registrationRepository.findStudentIdsByEventId(eventId);
    }
}
