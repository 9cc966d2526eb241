package com.example.scheduling.dto;

import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TrainingSession;

import java.time.Instant;

public record MemberBookingDTO(Long bookingId,
                               Long sessionId,
                               Long trainerId,
                               Instant scheduledStart,
                               Instant scheduledEnd,
                               String location,
                               SessionStatus sessionStatus) {

    public static MemberBookingDTO from(SessionBooking booking) {
        TrainingSession session = booking.getSession();
        return new MemberBookingDTO(booking.getId(), session.getId(), session.getTrainerId(),
                session.getScheduledStart(), session.getScheduledEnd(), session.getLocation(), session.getStatus());
    }
}
