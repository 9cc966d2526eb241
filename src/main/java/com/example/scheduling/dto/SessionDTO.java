package com.example.scheduling.dto;

import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TrainingSession;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionDTO {
    private Long id;
    private Long trainerId;

    private Instant scheduledStart;
    private Instant scheduledEnd;

    private String location;
    private int maxParticipants;
    private int currentParticipants;
    private String notes;

    private SessionStatus status;

    private List<SessionBookingDTO> bookings = new ArrayList<>();

    public static SessionDTO from(TrainingSession session) {
        List<SessionBookingDTO> bookings = session.getBookings().stream()
                .map(b -> new SessionBookingDTO(b.getId(), b.getMemberId(), b.getStatus()))
                .toList();
        return new SessionDTO(
                session.getId(),
                session.getTrainerId(),
                session.getScheduledStart(),
                session.getScheduledEnd(),
                session.getLocation(),
                session.getMaxParticipants(),
                session.getCurrentParticipants(),
                session.getNotes(),
                session.getStatus(),
                new ArrayList<>(bookings)
        );
    }
}
