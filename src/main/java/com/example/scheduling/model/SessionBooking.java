package com.example.scheduling.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "session_bookings",
        uniqueConstraints = @UniqueConstraint(name = "uk_booking_session_member", columnNames = {"session_id", "member_id"}),
        indexes = @Index(name = "idx_bookings_member", columnList = "member_id, status"))
@Getter @Setter
public class SessionBooking {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false)
    private TrainingSession session;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BookingStatus status = BookingStatus.CONFIRMED;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    public enum BookingStatus { CONFIRMED, CANCELLED }
}
