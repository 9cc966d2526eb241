package com.example.scheduling.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "training_sessions", indexes = {
        @Index(name = "idx_sessions_trainer_start", columnList = "trainer_id, scheduled_start"),
        @Index(name = "idx_sessions_status", columnList = "status")
})
@Getter @Setter
public class TrainingSession {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trainer_id", nullable = false)
    private Long trainerId;

    @Column(name = "scheduled_start", nullable = false)
    private Instant scheduledStart;

    @Column(name = "scheduled_end", nullable = false)
    private Instant scheduledEnd;

    @Column(nullable = false, columnDefinition = "text")
    private String location;

    @Column(name = "max_participants", nullable = false)
    private Integer maxParticipants;

    @Column(name = "current_participants", nullable = false)
    private Integer currentParticipants = 0;

    @Column(columnDefinition = "text")
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.SCHEDULED;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("id")
    private List<SessionBooking> bookings = new ArrayList<>();

    @Version
    private Long version;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public TimeInterval interval() {
        return new TimeInterval(scheduledStart, scheduledEnd);
    }

    public Duration duration() {
        return Duration.between(scheduledStart, scheduledEnd);
    }

    public boolean isActive() {
        return status != SessionStatus.CANCELLED;
    }

    public long confirmedBookingCount() {
        return bookings.stream().filter(SessionBooking::isConfirmed).count();
    }
}
