package com.example.scheduling.controllers;

import com.example.scheduling.dto.AnalyticsReport;
import com.example.scheduling.exception.GlobalExceptionHandler;
import com.example.scheduling.security.Principal;
import com.example.scheduling.security.PrincipalResolver;
import com.example.scheduling.security.RoleAliases;
import com.example.scheduling.service.AnalyticsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalyticsControllerTest {

    private static final Instant FROM = Instant.parse("2030-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2030-02-01T00:00:00Z");

    @Mock
    private AnalyticsService analyticsService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new AnalyticsController(analyticsService, new PrincipalResolver(RoleAliases.parse(""))))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    void returnsReportForTrainerScope() throws Exception {
        AnalyticsReport report = new AnalyticsReport(3L, FROM, TO, 4, 1, 0, 2, 1, 1, 1.0, 0.75, 3.0,
                List.of(), 3, 1, 9, 2, Map.of(9, 2L), Map.of(), Map.of());
        when(analyticsService.getAnalytics(Principal.admin(), 3L, FROM, TO)).thenReturn(report);

        mockMvc.perform(get("/analytics")
                        .header(PrincipalResolver.ROLE_HEADER, "admin")
                        .param("trainerId", "3")
                        .param("from", FROM.toString())
                        .param("to", TO.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSessions").value(4))
                .andExpect(jsonPath("$.averageAttendanceRate").value(0.75))
                .andExpect(jsonPath("$.peakHour").value(9));
    }

    @Test
    void invertedPeriodReturns400() throws Exception {
        when(analyticsService.getAnalytics(any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Report period end must be later than its start"));

        mockMvc.perform(get("/analytics")
                        .header(PrincipalResolver.ROLE_HEADER, "admin")
                        .param("from", TO.toString())
                        .param("to", FROM.toString()))
                .andExpect(status().isBadRequest());
    }
}
