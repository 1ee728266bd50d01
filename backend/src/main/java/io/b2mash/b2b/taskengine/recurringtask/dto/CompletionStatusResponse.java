package io.b2mash.b2b.taskengine.recurringtask.dto;

import io.b2mash.b2b.taskengine.completion.CompletionStatus;

/** Status of one cell, with the stored record when there is one. */
public record CompletionStatusResponse(
    String clientId, String periodKey, CompletionStatus status, CompletionRecordResponse record) {}
