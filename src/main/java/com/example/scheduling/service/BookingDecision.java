package com.example.scheduling.service;

import com.example.scheduling.dto.Rejection;

/**
 * Result of one booking attempt. An accepted decision carries the normalized proposal to commit;
 * a rejected one carries the reason and nothing to write.
 */
public record BookingDecision(BookingProposal proposal, Rejection rejection) {

    public static BookingDecision accepted(BookingProposal proposal) {
        return new BookingDecision(proposal, null);
    }

    public static BookingDecision rejected(Rejection rejection) {
        return new BookingDecision(null, rejection);
    }

    public boolean isAccepted() {
        return rejection == null;
    }
}
