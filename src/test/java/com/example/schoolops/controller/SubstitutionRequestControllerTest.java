package com.example.schoolops.controller;

import com.example.schoolops.config.SchoolOpsProperties;
import com.example.schoolops.config.SecurityConfig;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.entities.SubstitutionRequest;
import com.example.schoolops.enums.SubstitutionRequestStatus;
import com.example.schoolops.service.SubstitutionRequestService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubstitutionRequestController.class)
@Import(SecurityConfig.class)
class SubstitutionRequestControllerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 10, 6);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SubstitutionRequestService substitutionRequestService;

    @MockitoBean
    private SchoolOpsProperties properties;

    private static SubstitutionRequest request(SubstitutionRequestStatus status) {
        return SubstitutionRequest.builder().id("r1").requestDate(DAY).scheduleItemId("a3")
                .substituteTeacher("C").status(status).requestedAt(Instant.parse("2024-10-05T08:00:00Z"))
                .requestedBy("principal").build();
    }

    @Test
    @WithMockUser(username = "principal", roles = "ADMIN")
    void createUsesCallerAsRequester() throws Exception {
        when(substitutionRequestService.create(DAY, "a3", "C", "principal"))
                .thenReturn(Outcome.success(request(SubstitutionRequestStatus.PENDING)));

        mockMvc.perform(post("/api/substitution-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-10-06\",\"scheduleItemId\":\"a3\",\"teacher\":\"C\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request.status", is("pending")))
                .andExpect(jsonPath("$.request.requestedBy", is("principal")));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void createWithoutSlotIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/substitution-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-10-06\",\"teacher\":\"C\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("missing_scheduleItemId")));
    }

    @Test
    @WithMockUser(username = "teacher-c", roles = "TEACHER")
    void teacherSeesOwnPendingRequestsOnly() throws Exception {
        when(properties.teacherNameFor("teacher-c")).thenReturn("C");
        when(substitutionRequestService.pendingFor("C")).thenReturn(List.of(request(SubstitutionRequestStatus.PENDING)));

        mockMvc.perform(get("/api/substitution-requests/pending").param("teacher", "D"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id", is("r1")));
        verify(substitutionRequestService, never()).pendingFor("D");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void adminChoosesTeacherForPendingList() throws Exception {
        when(substitutionRequestService.pendingFor("D")).thenReturn(List.of());

        mockMvc.perform(get("/api/substitution-requests/pending").param("teacher", "D"))
                .andExpect(status().isOk());
        verify(substitutionRequestService).pendingFor("D");
    }

    @Test
    @WithMockUser(username = "teacher-d", roles = "TEACHER")
    void teacherAnsweringAnotherTeachersRequestGets404() throws Exception {
        when(properties.teacherNameFor("teacher-d")).thenReturn("D");
        when(substitutionRequestService.accept("r1", "D"))
                .thenReturn(Outcome.failure(EngineError.notFound("Substitution request not found: r1")));

        mockMvc.perform(post("/api/substitution-requests/r1/accept"))
                .andExpect(status().isNotFound());
    }

    @Test
    @WithMockUser(roles = "TEACHER")
    void teacherCannotCreateRequests() throws Exception {
        mockMvc.perform(post("/api/substitution-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-10-06\",\"scheduleItemId\":\"a3\",\"teacher\":\"C\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = "teacher-c", roles = "TEACHER")
    void acceptingTwiceIsConflict() throws Exception {
        when(properties.teacherNameFor("teacher-c")).thenReturn("C");
        when(substitutionRequestService.accept("r1", "C"))
                .thenReturn(Outcome.failure(EngineError.invalidState("Substitution request r1 is already ACCEPTED")));

        mockMvc.perform(post("/api/substitution-requests/r1/accept"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("invalid_state")));
    }

    @Test
    @WithMockUser(username = "teacher-c", roles = "TEACHER")
    void rejectPassesReason() throws Exception {
        when(properties.teacherNameFor("teacher-c")).thenReturn("C");
        SubstitutionRequest rejected = request(SubstitutionRequestStatus.REJECTED);
        rejected.setRejectionReason("exams");
        when(substitutionRequestService.reject("r1", "exams", "C")).thenReturn(Outcome.success(rejected));

        mockMvc.perform(post("/api/substitution-requests/r1/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"exams\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request.status", is("rejected")))
                .andExpect(jsonPath("$.request.rejectionReason", is("exams")));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void cancelDeletesRequest() throws Exception {
        when(substitutionRequestService.cancel("r1")).thenReturn(Outcome.success(request(SubstitutionRequestStatus.ACCEPTED)));

        mockMvc.perform(delete("/api/substitution-requests/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)));
    }
}
