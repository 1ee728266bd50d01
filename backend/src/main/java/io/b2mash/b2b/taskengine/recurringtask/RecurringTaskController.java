package io.b2mash.b2b.taskengine.recurringtask;

import io.b2mash.b2b.taskengine.completion.CompletionEntry;
import io.b2mash.b2b.taskengine.completion.CompletionGrid;
import io.b2mash.b2b.taskengine.completion.CompletionSummary;
import io.b2mash.b2b.taskengine.recurrence.RecurrencePattern;
import io.b2mash.b2b.taskengine.recurringtask.dto.BulkCompletionRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.CompletionRecordResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.CompletionStatusResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.CreateRecurringTaskRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.CycleHistoryResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.MappingRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.OccurrencesResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.PeriodsResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.RecurringTaskResponse;
import io.b2mash.b2b.taskengine.recurringtask.dto.ReplaceMappingsRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.SetCompletionRequest;
import io.b2mash.b2b.taskengine.recurringtask.dto.UpdateRecurringTaskRequest;
import io.b2mash.b2b.taskengine.security.ViewerContext;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recurring-tasks")
public class RecurringTaskController {

  private final RecurringTaskOrchestrator orchestrator;

  public RecurringTaskController(RecurringTaskOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<List<RecurringTaskResponse>> listTasks(
      @RequestParam(required = false) RecurringTaskStatus status,
      @RequestParam(required = false) String pattern) {
    var filter =
        new TaskFilter(status, pattern != null ? RecurrencePattern.fromValue(pattern) : null);
    var tasks = orchestrator.getVisibleTasksForViewer(ViewerContext.requireViewer(), filter);
    return ResponseEntity.ok(tasks.stream().map(RecurringTaskController::toResponse).toList());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<RecurringTaskResponse> getTask(@PathVariable UUID id) {
    return ResponseEntity.ok(toResponse(orchestrator.getTask(id, ViewerContext.requireViewer())));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<RecurringTaskResponse> createTask(
      @Valid @RequestBody CreateRecurringTaskRequest request) {
    var response = toResponse(orchestrator.createTask(request, ViewerContext.requireViewer()));
    return ResponseEntity.created(URI.create("/api/recurring-tasks/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<RecurringTaskResponse> updateTask(
      @PathVariable UUID id, @Valid @RequestBody UpdateRecurringTaskRequest request) {
    return ResponseEntity.ok(
        toResponse(orchestrator.updateTask(id, request, ViewerContext.requireViewer())));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID id) {
    orchestrator.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/pause")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<RecurringTaskResponse> pauseTask(@PathVariable UUID id) {
    return ResponseEntity.ok(toResponse(orchestrator.pause(id, ViewerContext.requireViewer())));
  }

  @PostMapping("/{id}/resume")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<RecurringTaskResponse> resumeTask(@PathVariable UUID id) {
    return ResponseEntity.ok(toResponse(orchestrator.resume(id, ViewerContext.requireViewer())));
  }

  @PostMapping("/{id}/complete-cycle")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<RecurringTaskResponse> completeCycle(@PathVariable UUID id) {
    return ResponseEntity.ok(
        toResponse(orchestrator.completeCycle(id, ViewerContext.requireViewer())));
  }

  @GetMapping("/{id}/cycles")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<CycleHistoryResponse> getCycleHistory(@PathVariable UUID id) {
    return ResponseEntity.ok(orchestrator.cycleHistory(id, ViewerContext.requireViewer()));
  }

  // --- Mappings ---

  @PutMapping("/{id}/mappings")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<RecurringTaskResponse> replaceMappings(
      @PathVariable UUID id, @Valid @RequestBody ReplaceMappingsRequest request) {
    return ResponseEntity.ok(
        toResponse(
            orchestrator.updateMappings(id, request.mappings(), ViewerContext.requireViewer())));
  }

  @PutMapping("/{id}/mappings/{employeeId}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<RecurringTaskResponse> upsertMapping(
      @PathVariable UUID id,
      @PathVariable String employeeId,
      @Valid @RequestBody MappingRequest request) {
    return ResponseEntity.ok(
        toResponse(
            orchestrator.upsertMapping(id, employeeId, request, ViewerContext.requireViewer())));
  }

  @DeleteMapping("/{id}/mappings/{employeeId}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<RecurringTaskResponse> removeMapping(
      @PathVariable UUID id, @PathVariable String employeeId) {
    return ResponseEntity.ok(
        toResponse(orchestrator.removeMapping(id, employeeId, ViewerContext.requireViewer())));
  }

  // --- Schedule and periods ---

  @GetMapping("/{id}/occurrences")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<OccurrencesResponse> listOccurrences(
      @PathVariable UUID id,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    var dates = orchestrator.occurrences(id, from, to, ViewerContext.requireViewer());
    return ResponseEntity.ok(new OccurrencesResponse(from, to, dates));
  }

  @GetMapping("/{id}/periods")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<PeriodsResponse> listPeriods(
      @PathVariable UUID id, @RequestParam(required = false) Integer fiscalYear) {
    return ResponseEntity.ok(
        orchestrator.applicablePeriods(id, fiscalYear, ViewerContext.requireViewer()));
  }

  @GetMapping("/{id}/periods/display")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<PeriodsResponse> listDisplayPeriods(@PathVariable UUID id) {
    return ResponseEntity.ok(orchestrator.displayPeriods(id, ViewerContext.requireViewer()));
  }

  // --- Completions ---

  @PutMapping("/{id}/completions")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<CompletionRecordResponse> setCompletion(
      @PathVariable UUID id, @Valid @RequestBody SetCompletionRequest request) {
    var record =
        orchestrator.recordCompletion(id, request.toEntry(), ViewerContext.requireViewer());
    return ResponseEntity.ok(CompletionRecordResponse.from(record));
  }

  @PostMapping("/{id}/completions/bulk")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<List<CompletionRecordResponse>> bulkSetCompletion(
      @PathVariable UUID id, @Valid @RequestBody BulkCompletionRequest request) {
    List<CompletionEntry> entries =
        request.entries().stream().map(SetCompletionRequest::toEntry).toList();
    var records = orchestrator.bulkRecordCompletions(id, entries, ViewerContext.requireViewer());
    return ResponseEntity.ok(records.stream().map(CompletionRecordResponse::from).toList());
  }

  @GetMapping("/{id}/completions/summary")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<CompletionSummary> getCompletionSummary(
      @PathVariable UUID id, @RequestParam(required = false) Integer fiscalYear) {
    return ResponseEntity.ok(
        orchestrator.getCompletionSummary(id, fiscalYear, ViewerContext.requireViewer()));
  }

  @GetMapping("/{id}/completions/grid")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<CompletionGrid> getCompletionGrid(
      @PathVariable UUID id, @RequestParam(required = false) Integer fiscalYear) {
    return ResponseEntity.ok(
        orchestrator.getCompletionGrid(id, fiscalYear, ViewerContext.requireViewer()));
  }

  @GetMapping("/{id}/completions/{clientId}/{periodKey}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'EMPLOYEE')")
  public ResponseEntity<CompletionStatusResponse> getCompletionStatus(
      @PathVariable UUID id, @PathVariable String clientId, @PathVariable String periodKey) {
    return ResponseEntity.ok(
        orchestrator.getCompletionStatus(
            id, clientId, periodKey, ViewerContext.requireViewer()));
  }

  private static RecurringTaskResponse toResponse(VisibleTask visible) {
    return RecurringTaskResponse.from(visible.task(), visible.visibleClientIds());
  }
}
