package com.leadscoring.controller;

import com.leadscoring.exception.StageTransitionException;
import com.leadscoring.model.ProspectStage;
import com.leadscoring.scoring.ScoringEngine;
import com.leadscoring.service.ProspectService;
import com.leadscoring.service.ScoreQueryService;
import com.leadscoring.service.SignalIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.leadscoring.Fixtures.PROSPECT;
import static com.leadscoring.Fixtures.TENANT;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GlobalExceptionHandlerTest {

    private static final String BASE = "/api/tenants/" + TENANT + "/prospects/" + PROSPECT;

    @Mock
    private ProspectService prospectService;

    @Mock
    private SignalIngestionService ingestionService;

    @Mock
    private ScoreQueryService scoreQueryService;

    @Mock
    private ScoringEngine scoringEngine;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ProspectController(prospectService, ingestionService, scoreQueryService, scoringEngine))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Refused stage move is a 409 naming the prospect and the lifecycle")
    void testStageTransitionConflict() throws Exception {
        when(prospectService.moveToStage(TENANT, PROSPECT, ProspectStage.QUALIFIED))
                .thenThrow(new StageTransitionException("ProspectLifecycle", PROSPECT,
                        ProspectStage.CONVERTED, ProspectStage.QUALIFIED, "Prospect is in terminal stage CONVERTED"));

        mockMvc.perform(post(BASE + "/stage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stage\":\"QUALIFIED\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid Stage Transition"))
                .andExpect(jsonPath("$.subjectId").value(PROSPECT))
                .andExpect(jsonPath("$.component").value("ProspectLifecycle"));
    }

    @Test
    @DisplayName("Internal illegal state, e.g. an outbox serialization failure, is a 500")
    void testIllegalStateIsServerError() throws Exception {
        when(prospectService.register(any()))
                .thenThrow(new IllegalStateException("Failed to serialize ProspectRescored to outbox"));

        mockMvc.perform(put(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Acme Legal LLP\",\"companySize\":\"medium\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    @Test
    @DisplayName("Missing target stage is a 400 with field errors")
    void testValidationError() throws Exception {
        mockMvc.perform(post(BASE + "/stage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors[0].field").value("stage"));
    }
}
