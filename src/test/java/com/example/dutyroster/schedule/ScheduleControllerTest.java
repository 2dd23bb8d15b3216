package com.example.dutyroster.schedule;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ScheduleControllerTest {

    private static final String THREE_DAYS = """
            SECTION_HORIZON
            3
            SECTION_SHIFTS
            D,480,
            SECTION_STAFF
            S1,,3,1440,0,2,1,1,1
            SECTION_COVER
            0,D,1,10,1
            1,D,1,10,1
            2,D,1,10,1
            """;

    private static final String ONE_DAY = """
            SECTION_HORIZON
            3
            SECTION_SHIFTS
            D,480,
            SECTION_STAFF
            S1,,3,1440,0,2,1,1,1
            SECTION_COVER
            0,D,1,10,1
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void generate_coverableInstance_returnsCompleteRoster() throws Exception {
        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.TEXT_PLAIN)
                .content(ONE_DAY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("シフトを生成しました"))
            .andExpect(jsonPath("$.data.complete").value(true))
            .andExpect(jsonPath("$.data.assignments[0].staffId").value("S1"))
            .andExpect(jsonPath("$.data.assignments[0].day").value(0))
            .andExpect(jsonPath("$.data.assignments[0].shiftId").value("D"))
            .andExpect(jsonPath("$.data.assignmentsPerStaff.S1").value(1))
            .andExpect(jsonPath("$.meta.assignmentCount").value(1));
    }

    @Test
    void generate_uncoverableDay_reportsShortfall() throws Exception {
        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.TEXT_PLAIN)
                .content(THREE_DAYS))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("必要人数を満たせない枠があります"))
            .andExpect(jsonPath("$.data.complete").value(false))
            .andExpect(jsonPath("$.data.assignments.length()").value(2))
            .andExpect(jsonPath("$.data.unmet[0].day").value(2))
            .andExpect(jsonPath("$.data.unmet[0].shortfall").value(1))
            .andExpect(jsonPath("$.meta.shortfall").value(1))
            .andExpect(jsonPath("$.meta.requirementsTotal").value(3));
    }

    @Test
    void generate_withOverrides_echoesSettingsUsed() throws Exception {
        mockMvc.perform(post("/api/schedule/generate")
                .param("policy", "STOP_AT_FIRST_UNMET")
                .param("validityMode", "CALENDAR")
                .contentType(MediaType.TEXT_PLAIN)
                .content(THREE_DAYS))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.policy").value("STOP_AT_FIRST_UNMET"))
            .andExpect(jsonPath("$.data.validityMode").value("CALENDAR"))
            .andExpect(jsonPath("$.data.staffOrder").value("LISTED"));
    }

    @Test
    void generate_malformedInstance_returnsFormatError() throws Exception {
        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.TEXT_PLAIN)
                .content("SECTION_HORIZON\n3\nSECTION_COVER\n0,X,1,10,1\n"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("インスタンス書式エラー"))
            .andExpect(jsonPath("$.details.section").value("COVER"))
            .andExpect(jsonPath("$.details.line").value("4"));
    }

    @Test
    void generate_unknownPolicy_isRejected() throws Exception {
        mockMvc.perform(post("/api/schedule/generate")
                .param("policy", "BACKTRACK")
                .contentType(MediaType.TEXT_PLAIN)
                .content(ONE_DAY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("引数エラー"));
    }

    @Test
    void generate_blankBody_isRejected() throws Exception {
        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.TEXT_PLAIN)
                .content("   "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("バリデーションエラー"));
    }

    @Test
    void export_returnsCsvAttachment() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/schedule/export")
                .param("name", "week-1")
                .contentType(MediaType.TEXT_PLAIN)
                .content(THREE_DAYS))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", "attachment; filename=\"roster-week-1.csv\""))
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andReturn();

        String csv = new String(result.getResponse().getContentAsByteArray(), StandardCharsets.UTF_8);
        assertThat(csv).contains("0,S1,D,480").contains("1,S1,D,480").doesNotContain("2,S1,D");
    }

    @Test
    void export_unsafeName_isRejected() throws Exception {
        mockMvc.perform(post("/api/schedule/export")
                .param("name", "../etc")
                .contentType(MediaType.TEXT_PLAIN)
                .content(ONE_DAY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.name").exists());
    }

    @Test
    void defaultSettings_reportsConfiguredFillSettings() throws Exception {
        mockMvc.perform(get("/api/schedule/settings"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.policy").value("CONTINUE"))
            .andExpect(jsonPath("$.data.validityMode").value("INSERTION_ORDER"))
            .andExpect(jsonPath("$.data.staffOrder").value("LISTED"));
    }

    @Test
    void healthEndpoint_isNotExposed() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("未定義のパス"));
    }
}
