package com.example.timetable.schedule;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TimetableControllerTest {

    private static final String TWO_HOMEROOM_TEACHERS = """
            {
              "teacherPools": {
                "homeroomKoreanPool": ["H1", "H2"],
                "foreignPool": ["F1"]
              },
              "globalOptions": {
                "roundClassCounts": { "1": 2 }
              }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void generate_returnsScheduleInEnvelope() throws Exception {
        mockMvc.perform(post("/api/timetable/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(TWO_HOMEROOM_TEACHERS))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("Timetable generated with 2 warning(s)"))
            .andExpect(jsonPath("$.data.homerooms.R1C1.name").value("H1"))
            .andExpect(jsonPath("$.data.homerooms.R1C2.name").value("H2"))
            .andExpect(jsonPath("$.data.metrics.totalAssignments").value(12))
            .andExpect(jsonPath("$.data.warnings[0]").value("[WED 1] R1C2 F assignment failed: no available candidate"))
            .andExpect(jsonPath("$.meta.warningsCount").value(2))
            .andExpect(jsonPath("$.meta.classesCount").value(2))
            .andExpect(jsonPath("$.meta.feasible").value(false));
    }

    @Test
    void feasibility_reportsPeakDemand() throws Exception {
        mockMvc.perform(post("/api/timetable/feasibility")
                .contentType(MediaType.APPLICATION_JSON)
                .content(TWO_HOMEROOM_TEACHERS))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.peakForeignDemand").value(2))
            .andExpect(jsonPath("$.data.foreignOk").value(false))
            .andExpect(jsonPath("$.meta.feasible").value(false));
    }

    @Test
    void audit_generatedScheduleIsValid() throws Exception {
        mockMvc.perform(post("/api/timetable/audit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(TWO_HOMEROOM_TEACHERS))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.valid").value(true))
            .andExpect(jsonPath("$.meta.violationsCount").value(0));
    }

    @Test
    void generate_missingPools_returnsValidationError() throws Exception {
        String payload = """
                { "globalOptions": { "roundClassCounts": { "1": 1 } } }
                """;

        mockMvc.perform(post("/api/timetable/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.teacherPools").value("teacherPools is required"));
    }

    @Test
    void generate_unknownRound_returnsConfigurationError() throws Exception {
        String payload = """
                {
                  "teacherPools": { "homeroomKoreanPool": ["H1"], "foreignPool": ["F1"] },
                  "teacherConstraints": { "H1": { "unavailable": ["SUN|1"] } },
                  "globalOptions": { "roundClassCounts": { "5": 1 } }
                }
                """;

        mockMvc.perform(post("/api/timetable/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_SLOT_CONFIGURATION"))
            .andExpect(jsonPath("$.details.violation1").exists())
            .andExpect(jsonPath("$.details.violation2").exists())
            .andExpect(jsonPath("$.details.*", hasItem("roundClassCounts has unknown round 5 (expected 1-4)")));
    }

    @Test
    void generate_malformedJson_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/timetable/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{ \"teacherPools\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void generate_oversizedClassCount_returnsConfigurationError() throws Exception {
        String payload = """
                {
                  "teacherPools": { "homeroomKoreanPool": ["H1"], "foreignPool": ["F1"] },
                  "globalOptions": { "roundClassCounts": { "1": 2147483647 } }
                }
                """;

        mockMvc.perform(post("/api/timetable/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_SLOT_CONFIGURATION"))
            .andExpect(jsonPath("$.details.violation1").value("roundClassCounts[1] must not exceed 500 (was 2147483647)"));
    }
}
