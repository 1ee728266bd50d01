package io.b2mash.b2b.taskengine.recurringtask;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.b2b.taskengine.assignment.Viewer;
import io.b2mash.b2b.taskengine.assignment.ViewerRole;
import io.b2mash.b2b.taskengine.completion.CompletionEntry;
import io.b2mash.b2b.taskengine.completion.CompletionSummary;
import io.b2mash.b2b.taskengine.exception.InapplicablePeriodException;
import io.b2mash.b2b.taskengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.taskengine.exception.UnauthorizedClientException;
import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;
import io.b2mash.b2b.taskengine.recurringtask.dto.CreateRecurringTaskRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.CycleHistoryResponse;
import io.b2mash.b2b.taskengine.security.SecurityConfig;
import io.b2mash.b2b.taskengine.security.ViewerJwtAuthenticationConverter;
import io.b2mash.b2b.taskengine.testutil.TestEntities;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RecurringTaskController.class)
@Import({SecurityConfig.class, ViewerJwtAuthenticationConverter.class})
class RecurringTaskControllerTest {

  private static final Viewer E1 = new Viewer("E1", ViewerRole.EMPLOYEE);
  private static final Viewer MANAGER = new Viewer("mgr-1", ViewerRole.MANAGER);

  private static final String CREATE_BODY =
      """
      {
        "title": "GST return",
        "priority": "HIGH",
        "recurrencePattern": "monthly",
        "startDate": "2026-04-01",
        "assignedClientIds": ["C1", "C2"]
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockBean private RecurringTaskOrchestrator orchestrator;
  @MockBean private JwtDecoder jwtDecoder;

  private static VisibleTask visibleTask(Set<String> visibleClientIds) {
    var task =
        TestEntities.task(RecurrencePattern.MONTHLY, LocalDate.of(2026, 4, 1), Set.of("C1", "C2"));
    return new VisibleTask(task, visibleClientIds);
  }

  @Test
  void listTasks_employee_usesViewerFromToken() throws Exception {
    when(orchestrator.getVisibleTasksForViewer(eq(E1), any(TaskFilter.class)))
        .thenReturn(List.of(visibleTask(Set.of("C1"))));

    mockMvc
        .perform(get("/api/recurring-tasks").with(employeeJwt("E1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].recurrencePattern").value("monthly"))
        .andExpect(jsonPath("$[0].recurrenceDescription").value("Every month"))
        .andExpect(jsonPath("$[0].visibleClientIds.length()").value(1))
        .andExpect(jsonPath("$[0].visibleClientIds[0]").value("C1"));
  }

  @Test
  void listTasks_filters_passedToOrchestrator() throws Exception {
    var filter = new TaskFilter(RecurringTaskStatus.PAUSED, RecurrencePattern.QUARTERLY);
    when(orchestrator.getVisibleTasksForViewer(MANAGER, filter)).thenReturn(List.of());

    mockMvc
        .perform(
            get("/api/recurring-tasks")
                .param("status", "PAUSED")
                .param("pattern", "quarterly")
                .with(managerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  void listTasks_unknownPattern_returns400() throws Exception {
    mockMvc
        .perform(get("/api/recurring-tasks").param("pattern", "hourly").with(managerJwt()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid recurrence pattern"));
  }

  @Test
  void listTasks_withoutToken_returns401() throws Exception {
    mockMvc.perform(get("/api/recurring-tasks")).andExpect(status().isUnauthorized());
  }

  @Test
  void listTasks_tokenWithoutRoleClaim_returns500() throws Exception {
    var noRole =
        jwt()
            .jwt(j -> j.subject("E1"))
            .authorities(List.of(new SimpleGrantedAuthority("ROLE_EMPLOYEE")));

    mockMvc
        .perform(get("/api/recurring-tasks").with(noRole))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.title").value("Viewer context not available"));
  }

  @Test
  void getTask_invisible_returns404() throws Exception {
    var id = UUID.randomUUID();
    when(orchestrator.getTask(id, E1))
        .thenThrow(new ResourceNotFoundException("RecurringTask", id));

    mockMvc
        .perform(get("/api/recurring-tasks/{id}", id).with(employeeJwt("E1")))
        .andExpect(status().isNotFound());
  }

  @Test
  void createTask_manager_returns201WithLocation() throws Exception {
    var created = visibleTask(Set.of("C1", "C2"));
    when(orchestrator.createTask(any(CreateRecurringTaskRequest.class), eq(MANAGER)))
        .thenReturn(created);

    mockMvc
        .perform(
            post("/api/recurring-tasks")
                .with(managerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(CREATE_BODY))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/recurring-tasks/" + created.task().getId()))
        .andExpect(jsonPath("$.status").value("ACTIVE"))
        .andExpect(jsonPath("$.nextOccurrence").value("2026-04-01"));
  }

  @Test
  void createTask_employee_returns403() throws Exception {
    mockMvc
        .perform(
            post("/api/recurring-tasks")
                .with(employeeJwt("E1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(CREATE_BODY))
        .andExpect(status().isForbidden());

    verify(orchestrator, never()).createTask(any(), any());
  }

  @Test
  void createTask_missingTitle_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/recurring-tasks")
                .with(managerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recurrencePattern": "monthly", "startDate": "2026-04-01",
                     "assignedClientIds": []}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void deleteTask_manager_returns403() throws Exception {
    mockMvc
        .perform(delete("/api/recurring-tasks/{id}", UUID.randomUUID()).with(managerJwt()))
        .andExpect(status().isForbidden());
  }

  @Test
  void deleteTask_admin_returns204() throws Exception {
    var id = UUID.randomUUID();

    mockMvc
        .perform(delete("/api/recurring-tasks/{id}", id).with(adminJwt()))
        .andExpect(status().isNoContent());

    verify(orchestrator).delete(id);
  }

  @Test
  void replaceMappings_employee_returns403() throws Exception {
    mockMvc
        .perform(
            put("/api/recurring-tasks/{id}/mappings", UUID.randomUUID())
                .with(employeeJwt("E1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mappings\": []}"))
        .andExpect(status().isForbidden());
  }

  @Test
  void setCompletion_inapplicablePeriod_returns422() throws Exception {
    var id = UUID.randomUUID();
    when(orchestrator.recordCompletion(eq(id), any(CompletionEntry.class), eq(E1)))
        .thenThrow(new InapplicablePeriodException("2026-06", "quarterly"));

    mockMvc
        .perform(
            put("/api/recurring-tasks/{id}/completions", id)
                .with(employeeJwt("E1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"clientId": "C1", "periodKey": "2026-06", "completed": true}
                    """))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.title").value("Inapplicable period"))
        .andExpect(jsonPath("$.periodKey").value("2026-06"));
  }

  @Test
  void setCompletion_clientNotVisible_returns403() throws Exception {
    var id = UUID.randomUUID();
    when(orchestrator.recordCompletion(eq(id), any(CompletionEntry.class), eq(E1)))
        .thenThrow(new UnauthorizedClientException("E1", "C2"));

    mockMvc
        .perform(
            put("/api/recurring-tasks/{id}/completions", id)
                .with(employeeJwt("E1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"clientId": "C2", "periodKey": "2026-04", "completed": true}
                    """))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.clientId").value("C2"));
  }

  @Test
  void setCompletion_missingCompletedFlag_returns400() throws Exception {
    mockMvc
        .perform(
            put("/api/recurring-tasks/{id}/completions", UUID.randomUUID())
                .with(employeeJwt("E1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"clientId\": \"C1\", \"periodKey\": \"2026-04\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void getCompletionSummary_passesFiscalYear() throws Exception {
    var id = UUID.randomUUID();
    when(orchestrator.getCompletionSummary(id, 2025, E1))
        .thenReturn(CompletionSummary.of(3, 24));

    mockMvc
        .perform(
            get("/api/recurring-tasks/{id}/completions/summary", id)
                .param("fiscalYear", "2025")
                .with(employeeJwt("E1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completedCount").value(3))
        .andExpect(jsonPath("$.totalExpected").value(24))
        .andExpect(jsonPath("$.percentage").value(13));
  }

  @Test
  void getCycleHistory_returnsHistoryAndRate() throws Exception {
    var id = UUID.randomUUID();
    var cycle =
        new CycleCompletion(LocalDate.of(2026, 4, 1), "E1", Instant.parse("2026-04-02T05:00:00Z"));
    when(orchestrator.cycleHistory(id, E1))
        .thenReturn(new CycleHistoryResponse(id, List.of(cycle), CompletionSummary.of(1, 2)));

    mockMvc
        .perform(get("/api/recurring-tasks/{id}/cycles", id).with(employeeJwt("E1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.history[0].occurrence").value("2026-04-01"))
        .andExpect(jsonPath("$.history[0].completedBy").value("E1"))
        .andExpect(jsonPath("$.completionRate.percentage").value(50));
  }

  private JwtRequestPostProcessor employeeJwt(String actorId) {
    return jwt()
        .jwt(j -> j.subject(actorId).claim("role", "employee"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_EMPLOYEE")));
  }

  private JwtRequestPostProcessor managerJwt() {
    return jwt()
        .jwt(j -> j.subject("mgr-1").claim("role", "manager"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_MANAGER")));
  }

  private JwtRequestPostProcessor adminJwt() {
    return jwt()
        .jwt(j -> j.subject("admin-1").claim("role", "admin"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
  }
}
