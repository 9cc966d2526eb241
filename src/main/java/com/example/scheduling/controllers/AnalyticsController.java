package com.example.scheduling.controllers;

import com.example.scheduling.dto.AnalyticsReport;
import com.example.scheduling.security.PrincipalResolver;
import com.example.scheduling.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final PrincipalResolver principalResolver;

    @GetMapping("/analytics")
    public ResponseEntity<AnalyticsReport> report(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                  @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                  @RequestParam(required = false) Long trainerId,
                                                  @RequestParam Instant from,
                                                  @RequestParam Instant to) {
        return ResponseEntity.ok(analyticsService.getAnalytics(principalResolver.resolve(role, id), trainerId, from, to));
    }
}
