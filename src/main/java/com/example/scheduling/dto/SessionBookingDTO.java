package com.example.scheduling.dto;

import com.example.scheduling.model.SessionBooking;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionBookingDTO {
    private Long id;
    private Long memberId;
    private SessionBooking.BookingStatus status;
}
