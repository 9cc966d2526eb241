package com.example.scheduling.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkAvailabilityRequest {
    private Long excludeSessionId;
    private List<SlotDTO> slots = new ArrayList<>();
}
