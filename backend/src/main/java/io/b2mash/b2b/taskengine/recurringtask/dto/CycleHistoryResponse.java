package io.b2mash.b2b.taskengine.recurringtask.dto;

import io.b2mash.b2b.taskengine.completion.CompletionSummary;
import io.b2mash.b2b.taskengine.recurringtask.CycleCompletion;
import java.util.List;
import java.util.UUID;

/**
 * Closed cycles of a task. {@code completionRate} counts cycles due up to today (or the end date)
 * against the ones closed for those due dates.
 */
public record CycleHistoryResponse(
    UUID recurringTaskId, List<CycleCompletion> history, CompletionSummary completionRate) {}
